package com.qqsuccubus.capacity.core.model;

public enum ProposalOrigin {
    REACTIVE,
    PREDICTIVE,

    /**
     * Produced by the arbiter when no component had an opinion.
     */
    HOLD
}
