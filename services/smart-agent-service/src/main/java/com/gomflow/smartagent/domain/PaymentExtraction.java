package com.gomflow.smartagent.domain;

import com.gomflow.smartagent.recognition.OcrResult;
import com.gomflow.smartagent.vision.VisionExtraction;
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
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Fused, canonical payment facts read from one proof image.
 *
 * Append-only: reviewer corrections are stored on new decisions and never written back here.
 * The first candidate is the primary reading that matching and decisions work from.
 */
@Entity
@Immutable
@Table(name = "payment_extractions", indexes = {
        @Index(name = "idx_payment_extractions_job", columnList = "job_id"),
        @Index(name = "idx_payment_extractions_created", columnList = "created_at")
})
@Getter
@Builder
@ToString(exclude = {"ocr", "vision"})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class PaymentExtraction {

    @Id
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "fingerprint", length = 64, updatable = false)
    private String fingerprint;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_platform", length = 20, updatable = false)
    private SourcePlatform sourcePlatform;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "ocr_result", columnDefinition = "jsonb", updatable = false)
    private OcrResult ocr;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "vision_result", columnDefinition = "jsonb", updatable = false)
    private VisionExtraction vision;

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "candidates", columnDefinition = "jsonb", updatable = false)
    private List<ExtractedPayment> candidates = new ArrayList<>();

    @Column(name = "overall_confidence", nullable = false, updatable = false)
    private double overallConfidence;

    @Column(name = "image_quality", nullable = false, updatable = false)
    private double imageQuality;

    @Column(name = "requires_review", nullable = false, updatable = false)
    private boolean requiresReview;

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "flags", columnDefinition = "jsonb", updatable = false)
    private Set<ExtractionFlag> flags = EnumSet.noneOf(ExtractionFlag.class);

    @Column(name = "primary_currency", length = 3, updatable = false)
    private String primaryCurrency;

    @Column(name = "primary_method", length = 30, updatable = false)
    private String primaryMethod;

    @Column(name = "processing_time_ms", updatable = false)
    private long processingTimeMs;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public Optional<ExtractedPayment> primaryPayment() {
        return candidates == null || candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    public boolean hasFlag(ExtractionFlag flag) {
        return flags != null && flags.contains(flag);
    }

    public boolean hasData() {
        return !hasFlag(ExtractionFlag.NO_DATA_EXTRACTED) && primaryPayment().isPresent();
    }
}
