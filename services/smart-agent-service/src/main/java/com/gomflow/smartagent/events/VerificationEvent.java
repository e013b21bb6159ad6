package com.gomflow.smartagent.events;

import com.gomflow.smartagent.domain.DecisionOutcome;
import com.gomflow.smartagent.domain.JobPriority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Payload of the payment verification topic. Consumers deduplicate on the idempotency key,
 * {@code extractionId:outcome}, since delivery is at-least-once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationEvent {

    private String eventId;
    private VerificationEventType type;
    private UUID extractionId;
    private UUID jobId;
    private String candidateId;
    private DecisionOutcome outcome;
    private String userId;
    private List<String> platforms;
    private JobPriority priority;
    private String idempotencyKey;
    private Double confidence;
    private Instant createdAt;
}
