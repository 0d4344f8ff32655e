package com.qqsuccubus.capacity.core.model;

public enum RecommendationType {
    DOWNSIZE,
    UPSIZE,
    OPTIMIZE
}
