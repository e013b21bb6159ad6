package com.gomflow.smartagent.domain;

/**
 * Stages a verification job moves through, strictly in declaration order.
 * DEAD_LETTERED can be reached from any non-terminal stage.
 */
public enum PipelineStage {
    RECEIVED,
    EXTRACTING,
    FUSED,
    MATCHING,
    DECIDED,
    DEAD_LETTERED;

    public boolean isTerminal() {
        return this == DECIDED || this == DEAD_LETTERED;
    }

    public boolean canAdvanceTo(PipelineStage next) {
        if (isTerminal()) {
            return false;
        }
        if (next == DEAD_LETTERED) {
            return true;
        }
        return next.ordinal() >= ordinal();
    }
}
