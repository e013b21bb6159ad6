package com.gomflow.smartagent.client;

public record ClaimResponse(
        String submissionId,
        String status,
        boolean claimed
) {
}
