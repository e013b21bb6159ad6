package com.gomflow.smartagent.decision;

import com.gomflow.smartagent.domain.ExtractionFlag;
import com.gomflow.smartagent.domain.PaymentExtraction;
import com.gomflow.smartagent.matching.PaymentMatch;
import com.gomflow.smartagent.matching.ScoredCandidate;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

public record DecisionInput(
        double confidence,
        Set<ExtractionFlag> flags,
        PaymentMatch match,
        boolean processingFailed
) {

    public DecisionInput {
        flags = flags == null || flags.isEmpty() ? EnumSet.noneOf(ExtractionFlag.class) : EnumSet.copyOf(flags);
    }

    public static DecisionInput of(PaymentExtraction extraction, PaymentMatch match) {
        return new DecisionInput(extraction.getOverallConfidence(), extraction.getFlags(), match, false);
    }

    public static DecisionInput processingFailure() {
        return new DecisionInput(0.0, EnumSet.noneOf(ExtractionFlag.class), null, true);
    }

    public boolean hasFlag(ExtractionFlag flag) {
        return flags.contains(flag);
    }

    public Optional<ScoredCandidate> bestMatch() {
        return match == null ? Optional.empty() : match.best();
    }

    public PaymentMatch.MatchStatus matchStatus() {
        return match == null ? PaymentMatch.MatchStatus.NO_CANDIDATES : match.status();
    }

    /**
     * Both recognizers agree on an amount that contradicts the candidate the reference points at.
     */
    public boolean confirmedAmountMismatch() {
        if (!hasFlag(ExtractionFlag.AMOUNT_CORROBORATED) || match == null) {
            return false;
        }
        return match.scoredCandidates().stream()
                .anyMatch(candidate -> candidate.referenceExact() && !candidate.amountExact());
    }
}
