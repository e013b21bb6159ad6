package com.gomflow.smartagent.decision;

import com.gomflow.smartagent.config.SmartAgentProperties;

/**
 * Confidence bands used by the decision table, ordered
 * {@code rejectFloor <= conditional <= autoApprove}.
 */
public record DecisionThresholds(
        double autoApprove,
        double conditional,
        double rejectFloor,
        boolean rejectConfirmedMismatch
) {

    public DecisionThresholds {
        if (!(rejectFloor <= conditional && conditional <= autoApprove)) {
            throw new IllegalArgumentException(String.format(
                    "Thresholds out of order: rejectFloor=%s, conditional=%s, autoApprove=%s",
                    rejectFloor, conditional, autoApprove));
        }
    }

    public static DecisionThresholds from(SmartAgentProperties.Decision decision) {
        return new DecisionThresholds(decision.getAutoApprove(), decision.getConditional(),
                decision.getRejectFloor(), decision.isRejectConfirmedMismatch());
    }
}
