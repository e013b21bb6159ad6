package com.gomflow.smartagent.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Mutable progress row for a submitted job.
 */
@Entity
@Table(name = "verification_jobs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationJob {

    @Id
    private UUID id;

    @Column(name = "extraction_id", nullable = false, unique = true)
    private UUID extractionId;

    @Column(name = "fingerprint", length = 64)
    private String fingerprint;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_platform", length = 20)
    private SourcePlatform sourcePlatform;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", length = 10)
    private JobPriority priority;

    @Column(name = "submitted_by", length = 100)
    private String submittedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "stage", nullable = false, length = 20)
    private PipelineStage stage;

    @Column(name = "attempts")
    private int attempts;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    private Long version;

    /**
     * Moves the job forward. Backward moves are ignored so that a retried job can replay
     * stages it already passed.
     */
    public boolean advanceTo(PipelineStage next) {
        if (stage != null && !stage.canAdvanceTo(next)) {
            return false;
        }
        stage = next;
        if (next.isTerminal()) {
            completedAt = Instant.now();
        }
        return true;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (stage == null) {
            stage = PipelineStage.RECEIVED;
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
