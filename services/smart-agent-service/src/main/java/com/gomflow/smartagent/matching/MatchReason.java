package com.gomflow.smartagent.matching;

public enum MatchReason {
    PRIMARY_READING,
    SECONDARY_READING,
    AMOUNT_EXACT,
    AMOUNT_MISMATCH,
    REFERENCE_EXACT,
    REFERENCE_PARTIAL,
    REFERENCE_MISMATCH,
    REFERENCE_MISSING,
    METHOD_ACCEPTED,
    METHOD_NOT_ACCEPTED,
    METHOD_UNKNOWN,
    TIMESTAMP_VALID,
    TIMESTAMP_INVALID,
    TIMESTAMP_MISSING,
    BUYER_NAME_MATCH
}
