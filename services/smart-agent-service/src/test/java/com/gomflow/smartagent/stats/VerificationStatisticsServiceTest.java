package com.gomflow.smartagent.stats;

import com.gomflow.smartagent.TestFixtures;
import com.gomflow.smartagent.domain.DecisionOutcome;
import com.gomflow.smartagent.domain.ExtractedPayment;
import com.gomflow.smartagent.domain.ExtractionFlag;
import com.gomflow.smartagent.domain.PaymentExtraction;
import com.gomflow.smartagent.domain.Provenance;
import com.gomflow.smartagent.domain.ReasonCode;
import com.gomflow.smartagent.domain.SourcePlatform;
import com.gomflow.smartagent.domain.VerificationDecision;
import com.gomflow.smartagent.dto.DetectionStats;
import com.gomflow.smartagent.repository.PaymentExtractionRepository;
import com.gomflow.smartagent.repository.VerificationDecisionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("VerificationStatisticsService Unit Tests")
class VerificationStatisticsServiceTest {

    @Mock
    private PaymentExtractionRepository extractionRepository;

    @Mock
    private VerificationDecisionRepository decisionRepository;

    private VerificationStatisticsService statisticsService;

    @BeforeEach
    void setUp() {
        statisticsService = new VerificationStatisticsService(extractionRepository, decisionRepository,
                TestFixtures.fixedClock());
    }

    private static PaymentExtraction extraction(SourcePlatform platform, String currency, String method,
                                                double confidence, long processingTimeMs, boolean hasData) {
        PaymentExtraction.PaymentExtractionBuilder builder = PaymentExtraction.builder()
                .id(UUID.randomUUID())
                .jobId(UUID.randomUUID())
                .sourcePlatform(platform)
                .primaryCurrency(currency)
                .primaryMethod(method)
                .overallConfidence(confidence)
                .processingTimeMs(processingTimeMs)
                .createdAt(TestFixtures.NOW);
        if (hasData) {
            builder.candidates(List.of(new ExtractedPayment(new BigDecimal("1200.00"), currency, method, null, null,
                    TestFixtures.REFERENCE, null, confidence, Provenance.COMBINED)));
        } else {
            builder.flags(EnumSet.of(ExtractionFlag.NO_DATA_EXTRACTED));
        }
        return builder.build();
    }

    private static VerificationDecision decision(DecisionOutcome outcome, String candidateId, ReasonCode reason) {
        return VerificationDecision.builder()
                .id(UUID.randomUUID())
                .extractionId(UUID.randomUUID())
                .jobId(UUID.randomUUID())
                .outcome(outcome)
                .matchedCandidateId(candidateId)
                .reasonCodes(List.of(reason))
                .decidedBy(VerificationDecision.SYSTEM)
                .initialDecision(true)
                .decidedAt(TestFixtures.NOW)
                .build();
    }

    @Test
    @DisplayName("Should aggregate extractions and initial decisions over the last 30 days by default")
    void shouldAggregateDefaultRange() {
        // Given
        Instant start = TestFixtures.NOW.minus(Duration.ofDays(30));
        when(extractionRepository.findByCreatedAtBetween(start, TestFixtures.NOW)).thenReturn(List.of(
                extraction(SourcePlatform.WHATSAPP, "PHP", "gcash", 1.0, 1200, true),
                extraction(SourcePlatform.TELEGRAM, "MYR", "maybank", 0.8, 1800, true),
                extraction(SourcePlatform.WHATSAPP, null, null, 0.0, 600, false)));
        when(decisionRepository.findByInitialDecisionTrueAndDecidedAtBetween(start, TestFixtures.NOW))
                .thenReturn(List.of(
                decision(DecisionOutcome.AUTO_APPROVED, "cand-1", ReasonCode.HIGH_CONFIDENCE_MATCH),
                decision(DecisionOutcome.CONDITIONAL_APPROVED, "cand-2", ReasonCode.LIGHT_AUDIT),
                decision(DecisionOutcome.MANUAL_REVIEW, null, ReasonCode.NO_DATA_EXTRACTED),
                decision(DecisionOutcome.MANUAL_REVIEW, null, ReasonCode.PROCESSING_FAILED)));

        // When
        DetectionStats stats = statisticsService.getStats(null, null);

        // Then
        assertThat(stats.getFrom()).isEqualTo(start);
        assertThat(stats.getTo()).isEqualTo(TestFixtures.NOW);
        assertThat(stats.getTotalProcessed()).isEqualTo(4);
        assertThat(stats.getSuccessfulExtractions()).isEqualTo(2);
        assertThat(stats.getSuccessfulMatches()).isEqualTo(2);
        assertThat(stats.getAutoApproved()).isEqualTo(1);
        assertThat(stats.getConditionallyApproved()).isEqualTo(1);
        assertThat(stats.getRequiresReview()).isEqualTo(2);
        assertThat(stats.getRejected()).isZero();
        assertThat(stats.getFailedProcessing()).isEqualTo(1);
        assertThat(stats.getAutoApprovalRate()).isEqualTo(0.25);
        assertThat(stats.getAverageConfidence()).isCloseTo(0.6, within(1e-9));
        assertThat(stats.getAverageProcessingTimeMs()).isEqualTo(1200.0);
        assertThat(stats.getByPlatform()).containsEntry("whatsapp", 2L).containsEntry("telegram", 1L);
        assertThat(stats.getByCurrency()).containsOnlyKeys("MYR", "PHP");
        assertThat(stats.getByPaymentMethod()).containsEntry("gcash", 1L).containsEntry("maybank", 1L);
    }

    @Test
    @DisplayName("Should not count a lost claim as a successful match")
    void shouldExcludeClaimConflictsFromMatches() {
        // Given
        Instant from = TestFixtures.NOW.minus(Duration.ofDays(1));
        when(extractionRepository.findByCreatedAtBetween(from, TestFixtures.NOW)).thenReturn(List.of());
        when(decisionRepository.findByInitialDecisionTrueAndDecidedAtBetween(from, TestFixtures.NOW))
                .thenReturn(List.of(
                        decision(DecisionOutcome.AUTO_APPROVED, "cand-1", ReasonCode.HIGH_CONFIDENCE_MATCH),
                        decision(DecisionOutcome.MANUAL_REVIEW, "cand-2", ReasonCode.CONCURRENT_CLAIM_CONFLICT)));

        // When
        DetectionStats stats = statisticsService.getStats(from, TestFixtures.NOW);

        // Then
        assertThat(stats.getSuccessfulMatches()).isEqualTo(1);
        assertThat(stats.getRequiresReview()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should report zero rates for an empty range")
    void shouldHandleEmptyRange() {
        // Given
        Instant from = TestFixtures.NOW.minus(Duration.ofDays(1));
        when(extractionRepository.findByCreatedAtBetween(from, TestFixtures.NOW)).thenReturn(List.of());
        when(decisionRepository.findByInitialDecisionTrueAndDecidedAtBetween(from, TestFixtures.NOW))
                .thenReturn(List.of());

        // When
        DetectionStats stats = statisticsService.getStats(from, TestFixtures.NOW);

        // Then
        assertThat(stats.getTotalProcessed()).isZero();
        assertThat(stats.getAutoApprovalRate()).isZero();
        assertThat(stats.getAverageConfidence()).isZero();
        assertThat(stats.getByPlatform()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a range that ends before it starts")
    void shouldRejectInvertedRange() {
        assertThatThrownBy(() -> statisticsService.getStats(TestFixtures.NOW, TestFixtures.NOW.minusSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(extractionRepository, decisionRepository);
    }
}
