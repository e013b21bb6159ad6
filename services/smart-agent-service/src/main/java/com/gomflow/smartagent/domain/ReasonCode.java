package com.gomflow.smartagent.domain;

public enum ReasonCode {
    // system
    PROCESSING_FAILED,
    NO_DATA_EXTRACTED,
    CONFIRMED_AMOUNT_MISMATCH,
    CONFIDENCE_BELOW_FLOOR,
    AMOUNT_CONTRADICTION,
    REFERENCE_CONTRADICTION,
    SINGLE_SOURCE,
    MULTIPLE_AMOUNTS,
    NO_CANDIDATES,
    CANDIDATE_LOOKUP_FAILED,
    AMBIGUOUS_MATCH,
    UNMATCHED,
    MATCH_AMOUNT_MISMATCH,
    SECONDARY_READING_MATCH,
    HIGH_CONFIDENCE_MATCH,
    LIGHT_AUDIT,
    CONFIDENCE_IN_REVIEW_BAND,
    CONCURRENT_CLAIM_CONFLICT,
    // reviewer
    REVIEWER_APPROVED,
    REVIEWER_REJECTED,
    REVIEWER_CORRECTED,
    CORRECTED_UNMATCHED
}
