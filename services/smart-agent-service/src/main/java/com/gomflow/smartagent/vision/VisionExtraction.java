package com.gomflow.smartagent.vision;

import java.math.BigDecimal;

/**
 * Structured best guess returned by the vision model, with its own confidence in [0, 1].
 * {@code fallbackParsed} marks answers recovered from free text rather than JSON.
 */
public record VisionExtraction(
        String description,
        Fields fields,
        double confidence,
        String rationale,
        String modelId,
        boolean fallbackParsed
) {

    public VisionExtraction {
        fields = fields != null ? fields : Fields.empty();
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public boolean hasAnyField() {
        return fields.hasAny();
    }

    public record Fields(
            String method,
            BigDecimal amount,
            String currency,
            String sender,
            String recipient,
            String reference,
            String timestamp,
            String bankName
    ) {

        public static Fields empty() {
            return new Fields(null, null, null, null, null, null, null, null);
        }

        public boolean hasAny() {
            return present(method) || amount != null || present(currency) || present(sender)
                    || present(recipient) || present(reference) || present(timestamp) || present(bankName);
        }

        private static boolean present(String value) {
            return value != null && !value.isBlank();
        }
    }
}
