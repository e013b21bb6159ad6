package com.gomflow.smartagent.client;

import java.math.BigDecimal;
import java.util.UUID;

public record ClaimRequest(
        UUID extractionId,
        UUID decisionId,
        String outcome,
        BigDecimal amount,
        String reference
) {
}
