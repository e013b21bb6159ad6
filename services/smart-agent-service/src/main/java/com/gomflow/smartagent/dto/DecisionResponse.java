package com.gomflow.smartagent.dto;

import com.gomflow.smartagent.domain.DecisionOutcome;
import com.gomflow.smartagent.domain.ManualCorrections;
import com.gomflow.smartagent.domain.ReasonCode;
import com.gomflow.smartagent.domain.VerificationDecision;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionResponse {

    private UUID decisionId;
    private UUID extractionId;
    private UUID jobId;
    private DecisionOutcome outcome;
    private String matchedCandidateId;
    private double confidence;
    private List<ReasonCode> reasonCodes;
    private String decidedBy;
    private boolean initialDecision;
    private UUID supersedesDecisionId;
    private ManualCorrections corrections;
    private String notes;
    private Instant decidedAt;

    public static DecisionResponse from(VerificationDecision decision) {
        return DecisionResponse.builder()
                .decisionId(decision.getId())
                .extractionId(decision.getExtractionId())
                .jobId(decision.getJobId())
                .outcome(decision.getOutcome())
                .matchedCandidateId(decision.getMatchedCandidateId())
                .confidence(decision.getConfidence())
                .reasonCodes(decision.getReasonCodes())
                .decidedBy(decision.getDecidedBy())
                .initialDecision(decision.isInitialDecision())
                .supersedesDecisionId(decision.getSupersedesDecisionId())
                .corrections(decision.getCorrections())
                .notes(decision.getNotes())
                .decidedAt(decision.getDecidedAt())
                .build();
    }
}
