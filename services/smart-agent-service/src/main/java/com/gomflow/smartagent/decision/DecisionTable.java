package com.gomflow.smartagent.decision;

import com.gomflow.smartagent.domain.DecisionOutcome;
import com.gomflow.smartagent.domain.ExtractionFlag;
import com.gomflow.smartagent.domain.ReasonCode;
import com.gomflow.smartagent.matching.PaymentMatch;
import com.gomflow.smartagent.matching.ScoredCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Ordered decision rules; the first rule whose condition holds decides.
 *
 * Confidence only enters through the reject floor and the two approval bands, so for a fixed
 * set of flags and a fixed match the outcome never gets worse as confidence rises.
 */
public final class DecisionTable {

    private static final List<ExtractionFlag> REVIEW_FLAGS = List.of(
            ExtractionFlag.AMOUNT_CONTRADICTION,
            ExtractionFlag.REFERENCE_CONTRADICTION,
            ExtractionFlag.SINGLE_SOURCE,
            ExtractionFlag.MULTIPLE_AMOUNTS);

    private final List<DecisionRule> rules;

    public DecisionTable(List<DecisionRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("Decision table needs at least one rule");
        }
        this.rules = List.copyOf(rules);
    }

    public static DecisionTable standard(DecisionThresholds thresholds) {
        return new DecisionTable(List.of(
                DecisionRule.of("processing-failed",
                        DecisionInput::processingFailed,
                        DecisionOutcome.MANUAL_REVIEW, ReasonCode.PROCESSING_FAILED),
                DecisionRule.of("no-data",
                        input -> input.hasFlag(ExtractionFlag.NO_DATA_EXTRACTED),
                        DecisionOutcome.MANUAL_REVIEW, ReasonCode.NO_DATA_EXTRACTED),
                DecisionRule.of("confirmed-amount-mismatch",
                        input -> thresholds.rejectConfirmedMismatch() && input.confirmedAmountMismatch(),
                        DecisionOutcome.REJECTED, ReasonCode.CONFIRMED_AMOUNT_MISMATCH),
                DecisionRule.of("below-reject-floor",
                        input -> input.confidence() < thresholds.rejectFloor(),
                        DecisionOutcome.REJECTED, ReasonCode.CONFIDENCE_BELOW_FLOOR),
                new DecisionRule("review-flag",
                        input -> firstReviewFlag(input).isPresent(),
                        DecisionOutcome.MANUAL_REVIEW,
                        input -> ReasonCode.valueOf(firstReviewFlag(input).orElseThrow().name())),
                new DecisionRule("no-usable-match",
                        input -> unusableMatchReason(input).isPresent(),
                        DecisionOutcome.MANUAL_REVIEW,
                        input -> unusableMatchReason(input).orElseThrow()),
                DecisionRule.of("auto-approve",
                        input -> input.confidence() >= thresholds.autoApprove()
                                && input.bestMatch().map(ScoredCandidate::autoApproveEligible).orElse(false),
                        DecisionOutcome.AUTO_APPROVED, ReasonCode.HIGH_CONFIDENCE_MATCH),
                DecisionRule.of("conditional-approve",
                        input -> input.confidence() >= thresholds.conditional() && input.bestMatch().isPresent(),
                        DecisionOutcome.CONDITIONAL_APPROVED, ReasonCode.LIGHT_AUDIT),
                DecisionRule.of("review-band",
                        input -> true,
                        DecisionOutcome.MANUAL_REVIEW, ReasonCode.CONFIDENCE_IN_REVIEW_BAND)));
    }

    public Verdict evaluate(DecisionInput input) {
        for (DecisionRule rule : rules) {
            if (rule.applies(input)) {
                String candidateId = rule.outcome().isApproved()
                        ? input.bestMatch().map(ScoredCandidate::candidateId).orElse(null)
                        : null;
                return new Verdict(rule.outcome(), List.of(rule.reason().apply(input)), rule.name(), candidateId);
            }
        }
        throw new IllegalStateException("No decision rule applied to " + input);
    }

    public List<DecisionRule> getRules() {
        return rules;
    }

    private static Optional<ExtractionFlag> firstReviewFlag(DecisionInput input) {
        return REVIEW_FLAGS.stream().filter(input::hasFlag).findFirst();
    }

    private static Optional<ReasonCode> unusableMatchReason(DecisionInput input) {
        PaymentMatch.MatchStatus status = input.matchStatus();
        switch (status) {
            case NO_CANDIDATES:
                return Optional.of(ReasonCode.NO_CANDIDATES);
            case LOOKUP_FAILED:
                return Optional.of(ReasonCode.CANDIDATE_LOOKUP_FAILED);
            case AMBIGUOUS:
                return Optional.of(ReasonCode.AMBIGUOUS_MATCH);
            case UNMATCHED:
                return Optional.of(ReasonCode.UNMATCHED);
            default:
                break;
        }
        if (input.bestMatch().isEmpty()) {
            return Optional.of(ReasonCode.UNMATCHED);
        }
        if (!input.bestMatch().get().amountExact()) {
            return Optional.of(ReasonCode.MATCH_AMOUNT_MISMATCH);
        }
        if (input.bestMatch().get().fromSecondaryReading()) {
            return Optional.of(ReasonCode.SECONDARY_READING_MATCH);
        }
        return Optional.empty();
    }

    public record Verdict(
            DecisionOutcome outcome,
            List<ReasonCode> reasonCodes,
            String ruleName,
            String matchedCandidateId
    ) {
    }
}
