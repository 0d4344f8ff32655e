package com.qqsuccubus.capacity.core.msg;

public final class Topics {
    private Topics() {
    }

    /**
     * Alert topic (Alert messages).
     * Published by the controller, consumed by notification bridges (Slack, e-mail, paging).
     */
    public static final String CONTROL_ALERTS = "capacity.control.alerts";

    /**
     * Decision audit topic (DecisionEvent messages), keyed by target id so each target's history
     * stays ordered within one partition.
     */
    public static final String CONTROL_DECISIONS = "capacity.control.decisions";
}
