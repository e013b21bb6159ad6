package com.gomflow.smartagent.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate view over extractions and their initial decisions for a time range.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionStats {

    private Instant from;
    private Instant to;
    private long totalProcessed;
    private long successfulExtractions;
    private long successfulMatches;
    private long autoApproved;
    private long conditionallyApproved;
    private long requiresReview;
    private long rejected;
    private long failedProcessing;
    private double averageConfidence;
    private double averageProcessingTimeMs;
    private double autoApprovalRate;
    private Map<String, Long> byPlatform;
    private Map<String, Long> byCurrency;
    private Map<String, Long> byPaymentMethod;
}
