package com.gomflow.smartagent.dto;

import com.gomflow.smartagent.domain.ExtractedPayment;
import com.gomflow.smartagent.domain.ExtractionFlag;
import com.gomflow.smartagent.domain.PaymentExtraction;
import com.gomflow.smartagent.domain.SourcePlatform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionResponse {

    private UUID extractionId;
    private UUID jobId;
    private SourcePlatform sourcePlatform;
    private List<ExtractedPayment> candidates;
    private double overallConfidence;
    private double imageQuality;
    private boolean requiresReview;
    private Set<ExtractionFlag> flags;
    private String ocrText;
    private String visionRationale;
    private long processingTimeMs;
    private Instant createdAt;

    public static ExtractionResponse from(PaymentExtraction extraction) {
        return ExtractionResponse.builder()
                .extractionId(extraction.getId())
                .jobId(extraction.getJobId())
                .sourcePlatform(extraction.getSourcePlatform())
                .candidates(extraction.getCandidates())
                .overallConfidence(extraction.getOverallConfidence())
                .imageQuality(extraction.getImageQuality())
                .requiresReview(extraction.isRequiresReview())
                .flags(extraction.getFlags())
                .ocrText(extraction.getOcr() != null ? extraction.getOcr().text() : null)
                .visionRationale(extraction.getVision() != null ? extraction.getVision().rationale() : null)
                .processingTimeMs(extraction.getProcessingTimeMs())
                .createdAt(extraction.getCreatedAt())
                .build();
    }
}
