package com.gomflow.smartagent.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal outcome of a decision. Rank orders outcomes from worst to best for the payer.
 */
public enum DecisionOutcome {
    REJECTED("rejected", 0),
    MANUAL_REVIEW("manual_review", 1),
    CONDITIONAL_APPROVED("conditional_approved", 2),
    AUTO_APPROVED("auto_approved", 3),
    MANUALLY_APPROVED("manually_approved", 3);

    private final String value;
    private final int rank;

    DecisionOutcome(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getRank() {
        return rank;
    }

    public boolean isApproved() {
        return this == AUTO_APPROVED || this == CONDITIONAL_APPROVED || this == MANUALLY_APPROVED;
    }
}
