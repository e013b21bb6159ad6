package com.gomflow.smartagent.events;

import com.fasterxml.jackson.annotation.JsonValue;
import com.gomflow.smartagent.domain.DecisionOutcome;

public enum VerificationEventType {
    PROCESSING_STARTED("processing_started"),
    PAYMENT_DETECTED("payment_detected"),
    AUTO_APPROVED("auto_approved"),
    PAYMENT_MATCHED("payment_matched"),
    REVIEW_REQUIRED("review_required"),
    PAYMENT_REJECTED("payment_rejected");

    private final String value;

    VerificationEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static VerificationEventType forOutcome(DecisionOutcome outcome) {
        return switch (outcome) {
            case AUTO_APPROVED -> AUTO_APPROVED;
            case CONDITIONAL_APPROVED, MANUALLY_APPROVED -> PAYMENT_MATCHED;
            case MANUAL_REVIEW -> REVIEW_REQUIRED;
            case REJECTED -> PAYMENT_REJECTED;
        };
    }
}
