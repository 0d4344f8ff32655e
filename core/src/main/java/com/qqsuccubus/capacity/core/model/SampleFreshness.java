package com.qqsuccubus.capacity.core.model;

public enum SampleFreshness {
    FRESH,

    /**
     * The source failed this cycle; the value is the last-known-good reading (low confidence).
     */
    STALE
}
