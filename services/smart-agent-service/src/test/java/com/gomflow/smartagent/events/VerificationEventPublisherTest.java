package com.gomflow.smartagent.events;

import com.gomflow.smartagent.TestFixtures;
import com.gomflow.smartagent.config.SmartAgentProperties;
import com.gomflow.smartagent.domain.DecisionOutcome;
import com.gomflow.smartagent.domain.PipelineStage;
import com.gomflow.smartagent.domain.ReasonCode;
import com.gomflow.smartagent.domain.VerificationDecision;
import com.gomflow.smartagent.domain.VerificationJob;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("VerificationEventPublisher Unit Tests")
class VerificationEventPublisherTest {

    private static final String TOPIC = "payment-verification-events";

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    @Captor
    private ArgumentCaptor<ProducerRecord<String, Object>> recordCaptor;

    private SimpleMeterRegistry meterRegistry;
    private VerificationEventPublisher publisher;
    private VerificationJob job;
    private VerificationDecision decision;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        publisher = new VerificationEventPublisher(kafkaTemplate, new SmartAgentProperties(), meterRegistry,
                TestFixtures.fixedClock());
        job = TestFixtures.trackedJob(TestFixtures.job(), PipelineStage.DECIDED);
        decision = VerificationDecision.builder()
                .id(UUID.randomUUID())
                .extractionId(job.getExtractionId())
                .jobId(job.getId())
                .outcome(DecisionOutcome.AUTO_APPROVED)
                .matchedCandidateId("cand-1200")
                .confidence(1.0)
                .reasonCodes(List.of(ReasonCode.HIGH_CONFIDENCE_MATCH))
                .decidedBy(VerificationDecision.SYSTEM)
                .initialDecision(true)
                .decidedAt(TestFixtures.NOW)
                .build();
    }

    private static CompletableFuture<SendResult<String, Object>> sent() {
        return CompletableFuture.completedFuture(null);
    }

    private static CompletableFuture<SendResult<String, Object>> failed(String message) {
        return CompletableFuture.failedFuture(new IllegalStateException(message));
    }

    @SafeVarargs
    private void givenSends(CompletableFuture<SendResult<String, Object>> first,
                            CompletableFuture<SendResult<String, Object>>... rest) {
        when(kafkaTemplate.send(ArgumentMatchers.<ProducerRecord<String, Object>>any())).thenReturn(first, rest);
    }

    private static String header(ProducerRecord<String, Object> record, String name) {
        return new String(record.headers().lastHeader(name).value(), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should publish a decision keyed by extraction id with an idempotency key")
    void shouldPublishDecision() {
        // Given
        givenSends(sent());

        // When
        publisher.publishDecision(job, decision).join();

        // Then
        verify(kafkaTemplate).send(recordCaptor.capture());
        ProducerRecord<String, Object> record = recordCaptor.getValue();
        assertThat(record.topic()).isEqualTo(TOPIC);
        assertThat(record.key()).isEqualTo(job.getExtractionId().toString());
        assertThat(header(record, "service")).isEqualTo("smart-agent-service");

        VerificationEvent event = (VerificationEvent) record.value();
        assertThat(event.getType()).isEqualTo(VerificationEventType.AUTO_APPROVED);
        assertThat(event.getOutcome()).isEqualTo(DecisionOutcome.AUTO_APPROVED);
        assertThat(event.getCandidateId()).isEqualTo("cand-1200");
        assertThat(event.getIdempotencyKey()).isEqualTo(job.getExtractionId() + ":auto_approved");
        assertThat(event.getUserId()).isEqualTo("buyer-42");
        assertThat(event.getPlatforms()).containsExactly("whatsapp", "web");
        assertThat(event.getCreatedAt()).isEqualTo(TestFixtures.NOW);
        assertThat(meterRegistry.counter("smart_agent.events.published", "type", "auto_approved").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should route a failed send to the dead letter topic and keep it for replay")
    void shouldDeadLetterFailedSend() {
        // Given
        givenSends(failed("broker down"), sent());

        // When
        CompletableFuture<SendResult<String, Object>> result = publisher.publishProcessingStarted(job);

        // Then
        assertThat(result).isCompletedExceptionally();
        verify(kafkaTemplate, times(2)).send(recordCaptor.capture());
        ProducerRecord<String, Object> dlqRecord = recordCaptor.getAllValues().get(1);
        assertThat(dlqRecord.topic()).isEqualTo(TOPIC + ".dlq");
        assertThat(header(dlqRecord, "original-topic")).isEqualTo(TOPIC);
        assertThat(header(dlqRecord, "error-message")).isEqualTo("broker down");

        DeadLetterVerificationEvent dlqEvent = (DeadLetterVerificationEvent) dlqRecord.value();
        assertThat(dlqEvent.getOriginalEvent().getType()).isEqualTo(VerificationEventType.PROCESSING_STARTED);
        assertThat(dlqEvent.getFailureTimestamp()).isEqualTo(TestFixtures.NOW);
        assertThat(publisher.getFailedEventCount()).isEqualTo(1);
        assertThat(meterRegistry.counter("smart_agent.events.failed", "type", "processing_started").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should not propagate a send that fails before reaching the broker")
    void shouldAbsorbSynchronousFailure() {
        // Given
        when(kafkaTemplate.send(ArgumentMatchers.<ProducerRecord<String, Object>>any()))
                .thenThrow(new IllegalStateException("metadata not available after 5000 ms"))
                .thenReturn(sent());

        // When
        CompletableFuture<SendResult<String, Object>> result = publisher.publishDecision(job, decision);

        // Then
        assertThat(result).isCompletedExceptionally();
        assertThat(publisher.getFailedEventCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should resend queued events on replay")
    void shouldReplayFailedEvents() {
        // Given
        givenSends(failed("broker down"), sent(), sent());
        publisher.publishDecision(job, decision);

        // When
        publisher.replayFailedEvents();

        // Then
        verify(kafkaTemplate, times(3)).send(recordCaptor.capture());
        ProducerRecord<String, Object> replayed = recordCaptor.getAllValues().get(2);
        assertThat(replayed.topic()).isEqualTo(TOPIC);
        assertThat(((VerificationEvent) replayed.value()).getIdempotencyKey())
                .isEqualTo(decision.idempotencyKey());
        assertThat(publisher.getFailedEventCount()).isZero();
    }
}
