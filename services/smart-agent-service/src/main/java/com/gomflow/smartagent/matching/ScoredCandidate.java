package com.gomflow.smartagent.matching;

import java.math.BigDecimal;
import java.util.List;

public record ScoredCandidate(
        String candidateId,
        double score,
        List<MatchReason> reasons,
        boolean autoApproveEligible,
        boolean amountExact,
        boolean referenceExact,
        BigDecimal expectedAmount
) {

    public ScoredCandidate {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public boolean fromSecondaryReading() {
        return reasons.contains(MatchReason.SECONDARY_READING);
    }
}
