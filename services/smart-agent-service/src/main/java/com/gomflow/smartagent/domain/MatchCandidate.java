package com.gomflow.smartagent.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Pending submission as returned by the order store. Read-only on this side.
 */
public record MatchCandidate(
        String id,
        String expectedReference,
        BigDecimal expectedAmount,
        String currency,
        String buyerIdentity,
        String status,
        Instant createdAt,
        List<String> acceptedMethods
) {

    public static final String STATUS_PENDING = "pending";

    public boolean isPending() {
        return STATUS_PENDING.equalsIgnoreCase(status);
    }

    public List<String> acceptedMethodsOrEmpty() {
        return acceptedMethods != null ? acceptedMethods : List.of();
    }
}
