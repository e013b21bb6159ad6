package com.gomflow.smartagent.domain;

import java.math.BigDecimal;

/**
 * Caller-supplied expectations for a "verify then confirm" submission.
 * A {@code submissionId} narrows matching to that submission; {@code orderId} is carried for the caller.
 */
public record SubmissionContext(
        BigDecimal expectedAmount,
        String currency,
        String referenceCode,
        String buyerIdentity,
        String submissionId,
        String orderId
) {

    public boolean isEmpty() {
        return expectedAmount == null
                && isBlank(currency)
                && isBlank(referenceCode)
                && isBlank(buyerIdentity)
                && isBlank(submissionId)
                && isBlank(orderId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
