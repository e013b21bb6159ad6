package com.gomflow.smartagent.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Outcome recorded for an extraction. Decisions are never edited: a reviewer action
 * produces a new row that points at the decision it supersedes.
 */
@Entity
@Immutable
@Table(name = "verification_decisions", indexes = {
        @Index(name = "idx_verification_decisions_extraction", columnList = "extraction_id"),
        @Index(name = "idx_verification_decisions_decided", columnList = "decided_at")
})
@Getter
@Builder
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class VerificationDecision {

    public static final String SYSTEM = "SYSTEM";

    @Id
    private UUID id;

    @Column(name = "extraction_id", nullable = false, updatable = false)
    private UUID extractionId;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 30, updatable = false)
    private DecisionOutcome outcome;

    @Column(name = "matched_candidate_id", length = 64, updatable = false)
    private String matchedCandidateId;

    @Column(name = "confidence", nullable = false, updatable = false)
    private double confidence;

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "reason_codes", columnDefinition = "jsonb", updatable = false)
    private List<ReasonCode> reasonCodes = new ArrayList<>();

    @Column(name = "decided_by", nullable = false, length = 100, updatable = false)
    private String decidedBy;

    @Column(name = "initial_decision", nullable = false, updatable = false)
    private boolean initialDecision;

    @Column(name = "supersedes_decision_id", updatable = false)
    private UUID supersedesDecisionId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "corrections", columnDefinition = "jsonb", updatable = false)
    private ManualCorrections corrections;

    @Column(name = "notes", length = 2000, updatable = false)
    private String notes;

    @Column(name = "decided_at", nullable = false, updatable = false)
    private Instant decidedAt;

    public boolean hasReason(ReasonCode reasonCode) {
        return reasonCodes != null && reasonCodes.contains(reasonCode);
    }

    public String idempotencyKey() {
        return extractionId + ":" + outcome.getValue();
    }
}
