package com.gomflow.smartagent.events;

import com.gomflow.smartagent.config.SmartAgentProperties;
import com.gomflow.smartagent.domain.DecisionOutcome;
import com.gomflow.smartagent.domain.PaymentExtraction;
import com.gomflow.smartagent.domain.VerificationDecision;
import com.gomflow.smartagent.domain.VerificationJob;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Queue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Publishes verification lifecycle events keyed by extraction id.
 *
 * Fire-and-forget: a failed send never fails the pipeline. Failures are copied to the
 * dead letter topic and queued in memory for {@link #replayFailedEvents()}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationEventPublisher {

    private static final String SERVICE_NAME = "smart-agent-service";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final SmartAgentProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Queue<VerificationEvent> failedEvents = new ConcurrentLinkedQueue<>();

    public CompletableFuture<SendResult<String, Object>> publishProcessingStarted(VerificationJob job) {
        return publish(baseEvent(job, VerificationEventType.PROCESSING_STARTED)
                .idempotencyKey(job.getExtractionId() + ":" + VerificationEventType.PROCESSING_STARTED.getValue())
                .build());
    }

    public CompletableFuture<SendResult<String, Object>> publishPaymentDetected(VerificationJob job,
                                                                              PaymentExtraction extraction) {
        return publish(baseEvent(job, VerificationEventType.PAYMENT_DETECTED)
                .confidence(extraction.getOverallConfidence())
                .idempotencyKey(job.getExtractionId() + ":" + VerificationEventType.PAYMENT_DETECTED.getValue())
                .build());
    }

    public CompletableFuture<SendResult<String, Object>> publishDecision(VerificationJob job,
                                                                       VerificationDecision decision) {
        DecisionOutcome outcome = decision.getOutcome();
        return publish(baseEvent(job, VerificationEventType.forOutcome(outcome))
                .candidateId(decision.getMatchedCandidateId())
                .outcome(outcome)
                .confidence(decision.getConfidence())
                .idempotencyKey(decision.idempotencyKey())
                .build());
    }

    /**
     * Resends events whose delivery failed. Events that fail again are queued for the next run.
     */
    @Scheduled(fixedDelayString = "${smart-agent.events.replay-interval:PT1M}")
    public void replayFailedEvents() {
        if (failedEvents.isEmpty()) {
            return;
        }
        List<VerificationEvent> pending = new ArrayList<>();
        VerificationEvent event;
        while ((event = failedEvents.poll()) != null) {
            pending.add(event);
        }
        log.info("Replaying {} failed verification events", pending.size());
        pending.forEach(this::publish);
    }

    public int getFailedEventCount() {
        return failedEvents.size();
    }

    private VerificationEvent.VerificationEventBuilder baseEvent(VerificationJob job, VerificationEventType type) {
        return VerificationEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .extractionId(job.getExtractionId())
                .jobId(job.getId())
                .userId(job.getSubmittedBy())
                .platforms(platformsFor(job))
                .priority(job.getPriority())
                .createdAt(clock.instant());
    }

    private List<String> platformsFor(VerificationJob job) {
        Set<String> platforms = new LinkedHashSet<>();
        if (job.getSourcePlatform() != null) {
            platforms.add(job.getSourcePlatform().getValue());
        }
        properties.getEvents().getAlwaysNotify().stream()
                .map(platform -> platform.toLowerCase(Locale.ROOT))
                .forEach(platforms::add);
        return new ArrayList<>(platforms);
    }

    CompletableFuture<SendResult<String, Object>> publish(VerificationEvent event) {
        String topic = properties.getEvents().getTopic();
        String key = event.getExtractionId().toString();
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(record(topic, key, event));
            future.whenComplete((result, ex) -> {
                sample.stop(meterRegistry.timer("smart_agent.events.publish.latency"));
                if (ex == null) {
                    meterRegistry.counter("smart_agent.events.published", "type", event.getType().getValue())
                            .increment();
                    log.debug("Published {} for extraction {}", event.getType().getValue(), key);
                } else {
                    onPublishFailure(topic, key, event, ex);
                }
            });
            return future;
        } catch (RuntimeException e) {
            sample.stop(meterRegistry.timer("smart_agent.events.publish.latency"));
            onPublishFailure(topic, key, event, e);
            return CompletableFuture.failedFuture(e);
        }
    }

    private void onPublishFailure(String topic, String key, VerificationEvent event, Throwable error) {
        meterRegistry.counter("smart_agent.events.failed", "type", event.getType().getValue()).increment();
        log.error("Failed to publish {} for extraction {} to {}", event.getType().getValue(), key, topic, error);
        failedEvents.offer(event);
        publishToDeadLetterQueue(topic, key, event, error);
    }

    private void publishToDeadLetterQueue(String originalTopic, String key, VerificationEvent event, Throwable error) {
        String dlqTopic = originalTopic + properties.getEvents().getDlqSuffix();
        String errorMessage = String.valueOf(error.getMessage());
        DeadLetterVerificationEvent dlqEvent = DeadLetterVerificationEvent.builder()
                .originalEvent(event)
                .originalTopic(originalTopic)
                .errorMessage(errorMessage)
                .failureTimestamp(clock.instant())
                .build();

        try {
            ProducerRecord<String, Object> dlqRecord = record(dlqTopic, key, dlqEvent);
            dlqRecord.headers().add("original-topic", originalTopic.getBytes(StandardCharsets.UTF_8));
            dlqRecord.headers().add("error-message", errorMessage.getBytes(StandardCharsets.UTF_8));
            kafkaTemplate.send(dlqRecord).whenComplete((result, ex) -> {
                if (ex == null) {
                    log.warn("Verification event sent to DLQ: topic={}, type={}", dlqTopic, event.getType().getValue());
                } else {
                    log.error("Failed to send verification event to DLQ {}", dlqTopic, ex);
                }
            });
        } catch (RuntimeException e) {
            log.error("Failed to publish verification event to dead letter queue {}", dlqTopic, e);
        }
    }

    private ProducerRecord<String, Object> record(String topic, String key, Object payload) {
        ProducerRecord<String, Object> record = new ProducerRecord<>(topic, key, payload);
        record.headers().add("event-type", payload.getClass().getSimpleName().getBytes(StandardCharsets.UTF_8));
        record.headers().add("timestamp",
                String.valueOf(clock.instant().toEpochMilli()).getBytes(StandardCharsets.UTF_8));
        record.headers().add("service", SERVICE_NAME.getBytes(StandardCharsets.UTF_8));
        return record;
    }
}
