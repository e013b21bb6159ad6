package com.gomflow.smartagent.decision;

import com.gomflow.smartagent.TestFixtures;
import com.gomflow.smartagent.config.SmartAgentProperties;
import com.gomflow.smartagent.domain.DecisionOutcome;
import com.gomflow.smartagent.domain.ExtractionFlag;
import com.gomflow.smartagent.domain.ReasonCode;
import com.gomflow.smartagent.matching.MatchReason;
import com.gomflow.smartagent.matching.PaymentMatch;
import com.gomflow.smartagent.matching.ScoredCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DecisionEngine Unit Tests")
class DecisionEngineTest {

    private static final UUID EXTRACTION_ID = UUID.randomUUID();

    private SmartAgentProperties properties;
    private DecisionEngine decisionEngine;

    @BeforeEach
    void setUp() {
        properties = new SmartAgentProperties();
        decisionEngine = new DecisionEngine(properties);
    }

    private static ScoredCandidate candidate(boolean eligible, boolean amountExact, boolean referenceExact) {
        return new ScoredCandidate("sub-1", eligible ? 0.99 : 0.70, List.of(), eligible, amountExact,
                referenceExact, new BigDecimal("1200.00"));
    }

    private static PaymentMatch matched(ScoredCandidate best) {
        return new PaymentMatch(EXTRACTION_ID, List.of(best), best, false, !best.autoApproveEligible(),
                PaymentMatch.MatchStatus.MATCHED, TestFixtures.NOW);
    }

    private static PaymentMatch eligibleMatch() {
        return matched(candidate(true, true, true));
    }

    private DecisionTable.Verdict decide(double confidence, Set<ExtractionFlag> flags, PaymentMatch match) {
        return decisionEngine.evaluate(new DecisionInput(confidence, flags, match, false));
    }

    @Nested
    @DisplayName("Confidence bands")
    class Bands {

        @Test
        @DisplayName("Should auto-approve a confident, eligible match")
        void shouldAutoApprove() {
            // When
            DecisionTable.Verdict verdict = decide(0.95, Set.of(), eligibleMatch());

            // Then
            assertThat(verdict.outcome()).isEqualTo(DecisionOutcome.AUTO_APPROVED);
            assertThat(verdict.reasonCodes()).containsExactly(ReasonCode.HIGH_CONFIDENCE_MATCH);
            assertThat(verdict.matchedCandidateId()).isEqualTo("sub-1");
            assertThat(verdict.ruleName()).isEqualTo("auto-approve");
        }

        @Test
        @DisplayName("Should conditionally approve in the light-audit band")
        void shouldConditionallyApprove() {
            // When
            DecisionTable.Verdict verdict = decide(0.80, Set.of(), eligibleMatch());

            // Then
            assertThat(verdict.outcome()).isEqualTo(DecisionOutcome.CONDITIONAL_APPROVED);
            assertThat(verdict.reasonCodes()).containsExactly(ReasonCode.LIGHT_AUDIT);
            assertThat(verdict.matchedCandidateId()).isEqualTo("sub-1");
        }

        @Test
        @DisplayName("Should not auto-approve a match that is not eligible, however confident")
        void shouldRequireEligibleMatchForAutoApproval() {
            // When
            DecisionTable.Verdict verdict = decide(0.99, Set.of(), matched(candidate(false, true, false)));

            // Then
            assertThat(verdict.outcome()).isEqualTo(DecisionOutcome.CONDITIONAL_APPROVED);
        }

        @Test
        @DisplayName("Should review a match found only through a secondary reading")
        void shouldReviewSecondaryReadingMatch() {
            // Given
            ScoredCandidate secondary = new ScoredCandidate("sub-1", 0.95,
                    List.of(MatchReason.SECONDARY_READING, MatchReason.AMOUNT_EXACT), false, true, true,
                    new BigDecimal("1200.00"));

            // When
            DecisionTable.Verdict verdict = decide(0.95, Set.of(), matched(secondary));

            // Then
            assertThat(verdict.outcome()).isEqualTo(DecisionOutcome.MANUAL_REVIEW);
            assertThat(verdict.reasonCodes()).containsExactly(ReasonCode.SECONDARY_READING_MATCH);
            assertThat(verdict.matchedCandidateId()).isNull();
        }

        @Test
        @DisplayName("Should send mid-confidence extractions to review without a candidate")
        void shouldReviewMidConfidence() {
            // When
            DecisionTable.Verdict verdict = decide(0.50, Set.of(), eligibleMatch());

            // Then
            assertThat(verdict.outcome()).isEqualTo(DecisionOutcome.MANUAL_REVIEW);
            assertThat(verdict.reasonCodes()).containsExactly(ReasonCode.CONFIDENCE_IN_REVIEW_BAND);
            assertThat(verdict.matchedCandidateId()).isNull();
        }

        @Test
        @DisplayName("Should reject below the reject floor")
        void shouldRejectBelowFloor() {
            // When
            DecisionTable.Verdict verdict = decide(0.20, Set.of(), eligibleMatch());

            // Then
            assertThat(verdict.outcome()).isEqualTo(DecisionOutcome.REJECTED);
            assertThat(verdict.reasonCodes()).containsExactly(ReasonCode.CONFIDENCE_BELOW_FLOOR);
        }
    }

    @Nested
    @DisplayName("Rule order")
    class RuleOrder {

        @Test
        @DisplayName("Should route processing failures to review")
        void shouldReviewProcessingFailure() {
            // When
            DecisionTable.Verdict verdict = decisionEngine.evaluate(DecisionInput.processingFailure());

            // Then
            assertThat(verdict.outcome()).isEqualTo(DecisionOutcome.MANUAL_REVIEW);
            assertThat(verdict.reasonCodes()).containsExactly(ReasonCode.PROCESSING_FAILED);
        }

        @Test
        @DisplayName("Should review, not reject, an extraction with no data")
        void shouldReviewNoData() {
            // When
            DecisionTable.Verdict verdict = decide(0.0, EnumSet.of(ExtractionFlag.NO_DATA_EXTRACTED), null);

            // Then
            assertThat(verdict.outcome()).isEqualTo(DecisionOutcome.MANUAL_REVIEW);
            assertThat(verdict.reasonCodes()).containsExactly(ReasonCode.NO_DATA_EXTRACTED);
        }

        @Test
        @DisplayName("Should reject when both sources agree on an amount the referenced order contradicts")
        void shouldRejectConfirmedMismatch() {
            // When
            DecisionTable.Verdict verdict = decide(1.0, EnumSet.of(ExtractionFlag.AMOUNT_CORROBORATED),
                    matched(candidate(false, false, true)));

            // Then
            assertThat(verdict.outcome()).isEqualTo(DecisionOutcome.REJECTED);
            assertThat(verdict.reasonCodes()).containsExactly(ReasonCode.CONFIRMED_AMOUNT_MISMATCH);
            assertThat(verdict.matchedCandidateId()).isNull();
        }

        @Test
        @DisplayName("Should review an uncorroborated amount mismatch")
        void shouldReviewUncorroboratedMismatch() {
            // When
            DecisionTable.Verdict verdict = decide(0.95, Set.of(), matched(candidate(false, false, true)));

            // Then
            assertThat(verdict.outcome()).isEqualTo(DecisionOutcome.MANUAL_REVIEW);
            assertThat(verdict.reasonCodes()).containsExactly(ReasonCode.MATCH_AMOUNT_MISMATCH);
        }

        @Test
        @DisplayName("Should review a confirmed mismatch when rejection is switched off")
        void shouldHonourRejectSwitch() {
            // Given
            properties.getDecision().setRejectConfirmedMismatch(false);
            decisionEngine = new DecisionEngine(properties);

            // When
            DecisionTable.Verdict verdict = decide(1.0, EnumSet.of(ExtractionFlag.AMOUNT_CORROBORATED),
                    matched(candidate(false, false, true)));

            // Then
            assertThat(verdict.outcome()).isEqualTo(DecisionOutcome.MANUAL_REVIEW);
            assertThat(verdict.reasonCodes()).containsExactly(ReasonCode.MATCH_AMOUNT_MISMATCH);
        }

        @Test
        @DisplayName("Should let review-forcing flags override a confident match")
        void shouldHonourReviewFlags() {
            // When
            DecisionTable.Verdict singleSource = decide(0.95, EnumSet.of(ExtractionFlag.SINGLE_SOURCE),
                    eligibleMatch());
            DecisionTable.Verdict contradiction = decide(0.95,
                    EnumSet.of(ExtractionFlag.SINGLE_SOURCE, ExtractionFlag.AMOUNT_CONTRADICTION), eligibleMatch());

            // Then
            assertThat(singleSource.outcome()).isEqualTo(DecisionOutcome.MANUAL_REVIEW);
            assertThat(singleSource.reasonCodes()).containsExactly(ReasonCode.SINGLE_SOURCE);
            assertThat(contradiction.reasonCodes()).containsExactly(ReasonCode.AMOUNT_CONTRADICTION);
        }

        @Test
        @DisplayName("Should name the reason a confident extraction has no usable match")
        void shouldExplainUnusableMatch() {
            // Given
            PaymentMatch ambiguous = new PaymentMatch(EXTRACTION_ID, List.of(), null, true, true,
                    PaymentMatch.MatchStatus.AMBIGUOUS, TestFixtures.NOW);

            // When / Then
            assertThat(decide(0.95, Set.of(), ambiguous).reasonCodes())
                    .containsExactly(ReasonCode.AMBIGUOUS_MATCH);
            assertThat(decide(0.95, Set.of(), PaymentMatch.lookupFailed(EXTRACTION_ID, TestFixtures.NOW))
                    .reasonCodes()).containsExactly(ReasonCode.CANDIDATE_LOOKUP_FAILED);
            assertThat(decide(0.95, Set.of(), PaymentMatch.noCandidates(EXTRACTION_ID, TestFixtures.NOW))
                    .reasonCodes()).containsExactly(ReasonCode.NO_CANDIDATES);
            assertThat(decide(0.95, Set.of(), null).reasonCodes())
                    .containsExactly(ReasonCode.NO_CANDIDATES);
        }
    }

    @Test
    @DisplayName("Should never produce a worse outcome as confidence rises")
    void shouldBeMonotonicInConfidence() {
        List<PaymentMatch> matches = List.of(
                eligibleMatch(),
                matched(candidate(false, true, false)),
                matched(candidate(false, false, true)),
                PaymentMatch.noCandidates(EXTRACTION_ID, TestFixtures.NOW));
        List<Set<ExtractionFlag>> flagSets = List.of(
                EnumSet.noneOf(ExtractionFlag.class),
                EnumSet.of(ExtractionFlag.SINGLE_SOURCE),
                EnumSet.of(ExtractionFlag.AMOUNT_CORROBORATED, ExtractionFlag.REFERENCE_CORROBORATED));

        for (PaymentMatch match : matches) {
            for (Set<ExtractionFlag> flags : flagSets) {
                int previousRank = -1;
                for (int step = 0; step <= 100; step++) {
                    int rank = decide(step / 100.0, flags, match).outcome().getRank();
                    assertThat(rank)
                            .as("confidence %.2f, flags %s, match %s", step / 100.0, flags, match.status())
                            .isGreaterThanOrEqualTo(previousRank);
                    previousRank = rank;
                }
            }
        }
    }

    @Test
    @DisplayName("Should refuse thresholds that are out of order")
    void shouldValidateThresholdOrder() {
        assertThatThrownBy(() -> new DecisionThresholds(0.70, 0.80, 0.30, true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of order");
    }
}
