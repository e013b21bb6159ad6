package com.gomflow.smartagent.stats;

import com.gomflow.smartagent.domain.DecisionOutcome;
import com.gomflow.smartagent.domain.PaymentExtraction;
import com.gomflow.smartagent.domain.ReasonCode;
import com.gomflow.smartagent.domain.VerificationDecision;
import com.gomflow.smartagent.dto.DetectionStats;
import com.gomflow.smartagent.repository.PaymentExtractionRepository;
import com.gomflow.smartagent.repository.VerificationDecisionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read model over extractions and their initial (automated) decisions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationStatisticsService {

    static final Duration DEFAULT_RANGE = Duration.ofDays(30);

    private final PaymentExtractionRepository extractionRepository;
    private final VerificationDecisionRepository decisionRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public DetectionStats getStats(Instant from, Instant to) {
        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(DEFAULT_RANGE);
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Stats range start " + start + " is after end " + end);
        }

        List<PaymentExtraction> extractions = extractionRepository.findByCreatedAtBetween(start, end);
        List<VerificationDecision> decisions = decisionRepository.findByInitialDecisionTrueAndDecidedAtBetween(start, end);

        Map<DecisionOutcome, Long> byOutcome = decisions.stream()
                .collect(Collectors.groupingBy(VerificationDecision::getOutcome, Collectors.counting()));
        long failed = decisions.stream().filter(d -> d.hasReason(ReasonCode.PROCESSING_FAILED)).count();
        // a lost claim keeps its candidate id but is not a match
        long matched = decisions.stream()
                .filter(d -> d.getOutcome().isApproved() && d.getMatchedCandidateId() != null)
                .count();
        long autoApproved = byOutcome.getOrDefault(DecisionOutcome.AUTO_APPROVED, 0L);
        long totalProcessed = decisions.size();

        DetectionStats stats = DetectionStats.builder()
                .from(start)
                .to(end)
                .totalProcessed(totalProcessed)
                .successfulExtractions(extractions.stream().filter(PaymentExtraction::hasData).count())
                .successfulMatches(matched)
                .autoApproved(autoApproved)
                .conditionallyApproved(byOutcome.getOrDefault(DecisionOutcome.CONDITIONAL_APPROVED, 0L))
                .requiresReview(byOutcome.getOrDefault(DecisionOutcome.MANUAL_REVIEW, 0L))
                .rejected(byOutcome.getOrDefault(DecisionOutcome.REJECTED, 0L))
                .failedProcessing(failed)
                .averageConfidence(extractions.stream()
                        .mapToDouble(PaymentExtraction::getOverallConfidence).average().orElse(0.0))
                .averageProcessingTimeMs(extractions.stream()
                        .mapToLong(PaymentExtraction::getProcessingTimeMs).average().orElse(0.0))
                .autoApprovalRate(totalProcessed == 0 ? 0.0 : (double) autoApproved / totalProcessed)
                .byPlatform(countBy(extractions, e -> e.getSourcePlatform() != null
                        ? e.getSourcePlatform().getValue() : null))
                .byCurrency(countBy(extractions, PaymentExtraction::getPrimaryCurrency))
                .byPaymentMethod(countBy(extractions, PaymentExtraction::getPrimaryMethod))
                .build();

        log.debug("Computed stats for {} - {}: processed={}, autoApproved={}", start, end, totalProcessed, autoApproved);
        return stats;
    }

    private static Map<String, Long> countBy(List<PaymentExtraction> extractions,
                                             Function<PaymentExtraction, String> key) {
        return extractions.stream()
                .map(key)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), TreeMap::new, Collectors.counting()));
    }
}
