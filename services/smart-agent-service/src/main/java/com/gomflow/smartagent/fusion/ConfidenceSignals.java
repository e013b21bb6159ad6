package com.gomflow.smartagent.fusion;

import com.gomflow.smartagent.config.SmartAgentProperties;

/**
 * Per-signal credits in [0, 1] that make up an extraction's base confidence.
 */
public record ConfidenceSignals(
        double amount,
        double reference,
        double method,
        double timestamp,
        double legibility
) {

    public double weighted(SmartAgentProperties.ScoringWeights weights) {
        return amount * weights.getAmount()
                + reference * weights.getReference()
                + method * weights.getMethod()
                + timestamp * weights.getTimestamp()
                + legibility * weights.getImageQuality();
    }
}
