package com.gomflow.smartagent.matching;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Result of matching one extraction against the pending submissions of its currency.
 * Every scored candidate is kept so reviewers can see the runners-up.
 */
public record PaymentMatch(
        UUID extractionId,
        List<ScoredCandidate> scoredCandidates,
        ScoredCandidate bestMatch,
        boolean ambiguous,
        boolean reviewRequired,
        MatchStatus status,
        Instant matchedAt
) {

    public enum MatchStatus {
        MATCHED,
        AMBIGUOUS,
        UNMATCHED,
        NO_CANDIDATES,
        LOOKUP_FAILED
    }

    public PaymentMatch {
        scoredCandidates = scoredCandidates == null ? List.of() : List.copyOf(scoredCandidates);
    }

    public static PaymentMatch noCandidates(UUID extractionId, Instant matchedAt) {
        return new PaymentMatch(extractionId, List.of(), null, false, true, MatchStatus.NO_CANDIDATES, matchedAt);
    }

    public static PaymentMatch lookupFailed(UUID extractionId, Instant matchedAt) {
        return new PaymentMatch(extractionId, List.of(), null, false, true, MatchStatus.LOOKUP_FAILED, matchedAt);
    }

    public Optional<ScoredCandidate> best() {
        return Optional.ofNullable(bestMatch);
    }
}
