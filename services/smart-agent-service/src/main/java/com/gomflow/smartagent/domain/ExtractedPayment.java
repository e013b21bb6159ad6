package com.gomflow.smartagent.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One candidate reading of the payment shown on a proof image.
 */
public record ExtractedPayment(
        BigDecimal amount,
        String currency,
        String method,
        String sender,
        String recipient,
        String reference,
        Instant timestamp,
        double confidence,
        Provenance provenance
) {

    public ExtractedPayment withConfidence(double value, Provenance newProvenance) {
        return new ExtractedPayment(amount, currency, method, sender, recipient, reference, timestamp,
                value, newProvenance);
    }

    /**
     * Applies reviewer corrections; null fields keep the extracted value.
     */
    public ExtractedPayment correctedWith(ManualCorrections corrections) {
        if (corrections == null) {
            return this;
        }
        return new ExtractedPayment(
                corrections.amount() != null ? corrections.amount() : amount,
                corrections.currency() != null ? corrections.currency() : currency,
                corrections.method() != null ? corrections.method() : method,
                sender,
                recipient,
                corrections.reference() != null ? corrections.reference() : reference,
                timestamp,
                confidence,
                provenance);
    }
}
