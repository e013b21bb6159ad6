package com.gomflow.smartagent.matching;

import com.gomflow.smartagent.config.SmartAgentProperties;
import com.gomflow.smartagent.domain.ExtractedPayment;
import com.gomflow.smartagent.domain.MatchCandidate;
import com.gomflow.smartagent.domain.PaymentExtraction;
import com.gomflow.smartagent.domain.PaymentMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Scores pending submissions against a fused payment reading.
 *
 * Score components reuse the fusion weights: amount, reference, method, timestamp and image
 * quality. A candidate is auto-approve eligible only when its score clears the configured bar
 * and the amount is exact; ties at the top are never resolved automatically.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentMatchingEngine {

    static final double TIE_EPSILON = 1e-9;
    private static final double BUYER_NAME_SIMILARITY = 0.5;

    private final SmartAgentProperties properties;
    private final Clock clock;

    public PaymentMatch match(PaymentExtraction extraction, List<MatchCandidate> candidates) {
        if (extraction.primaryPayment().isEmpty()) {
            return PaymentMatch.noCandidates(extraction.getId(), clock.instant());
        }
        return match(extraction.getId(), extraction.getCandidates(), extraction.getImageQuality(), candidates);
    }

    public PaymentMatch match(UUID extractionId, ExtractedPayment payment, double imageQuality,
                              List<MatchCandidate> candidates) {
        return match(extractionId, List.of(payment), imageQuality, candidates);
    }

    /**
     * Scores every reading against every pending candidate and keeps each candidate's best score.
     * Readings are ranked, the first being the fused primary; on equal scores the earlier reading wins.
     */
    public PaymentMatch match(UUID extractionId, List<ExtractedPayment> payments, double imageQuality,
                              List<MatchCandidate> candidates) {
        Instant now = clock.instant();
        Map<String, ScoredCandidate> bestByCandidate = new LinkedHashMap<>();
        for (int index = 0; index < payments.size(); index++) {
            ExtractedPayment payment = payments.get(index);
            MatchReason reading = index == 0 ? MatchReason.PRIMARY_READING : MatchReason.SECONDARY_READING;
            for (MatchCandidate candidate : filter(payment, candidates, now)) {
                ScoredCandidate scored = score(payment, imageQuality, candidate, now, reading);
                bestByCandidate.merge(candidate.id(), scored,
                        (existing, incoming) -> incoming.score() > existing.score() ? incoming : existing);
            }
        }
        if (bestByCandidate.isEmpty()) {
            log.info("No eligible candidates for extraction {} across {} readings", extractionId, payments.size());
            return PaymentMatch.noCandidates(extractionId, now);
        }

        List<ScoredCandidate> scored = bestByCandidate.values().stream()
                .sorted(Comparator.comparingDouble(ScoredCandidate::score).reversed()
                        .thenComparing(ScoredCandidate::candidateId))
                .collect(Collectors.toList());

        ScoredCandidate top = scored.get(0);
        double floor = properties.getMatching().getMatchFloor();
        if (top.score() < floor) {
            log.info("Extraction {} unmatched: best score {} below floor {}", extractionId, top.score(), floor);
            return new PaymentMatch(extractionId, scored, null, false, true, PaymentMatch.MatchStatus.UNMATCHED, now);
        }

        if (scored.size() > 1 && Math.abs(top.score() - scored.get(1).score()) < TIE_EPSILON) {
            log.warn("Extraction {} ambiguous: candidates {} and {} tie at {}", extractionId,
                    top.candidateId(), scored.get(1).candidateId(), top.score());
            return new PaymentMatch(extractionId, scored, null, true, true, PaymentMatch.MatchStatus.AMBIGUOUS, now);
        }

        log.info("Extraction {} matched candidate {} with score {} (eligible={}, secondary={})", extractionId,
                top.candidateId(), top.score(), top.autoApproveEligible(), top.fromSecondaryReading());
        return new PaymentMatch(extractionId, scored, top, false, !top.autoApproveEligible(),
                PaymentMatch.MatchStatus.MATCHED, now);
    }

    private List<MatchCandidate> filter(ExtractedPayment payment, List<MatchCandidate> candidates, Instant now) {
        if (candidates == null || candidates.isEmpty() || payment.currency() == null) {
            return List.of();
        }
        Instant windowStart = now.minus(properties.getMatching().getCandidateWindow());
        return candidates.stream()
                .filter(MatchCandidate::isPending)
                .filter(candidate -> payment.currency().equalsIgnoreCase(candidate.currency()))
                .filter(candidate -> candidate.createdAt() == null || !candidate.createdAt().isBefore(windowStart))
                .collect(Collectors.toList());
    }

    ScoredCandidate score(ExtractedPayment payment, double imageQuality, MatchCandidate candidate, Instant now,
                          MatchReason reading) {
        SmartAgentProperties.ScoringWeights weights = properties.getWeights();
        SmartAgentProperties.Matching settings = properties.getMatching();
        List<MatchReason> reasons = new ArrayList<>();
        reasons.add(reading);
        double score = 0.0;

        boolean amountExact = sameAmount(payment.amount(), candidate.expectedAmount(), settings.getAmountTolerance());
        if (amountExact) {
            score += weights.getAmount();
            reasons.add(MatchReason.AMOUNT_EXACT);
        } else {
            reasons.add(MatchReason.AMOUNT_MISMATCH);
        }

        boolean referenceExact = false;
        String extractedReference = normalize(payment.reference());
        String expectedReference = normalize(candidate.expectedReference());
        if (extractedReference == null || expectedReference == null) {
            reasons.add(MatchReason.REFERENCE_MISSING);
        } else if (extractedReference.equals(expectedReference)) {
            referenceExact = true;
            score += weights.getReference();
            reasons.add(MatchReason.REFERENCE_EXACT);
        } else if (extractedReference.contains(expectedReference) || expectedReference.contains(extractedReference)) {
            score -= settings.getPartialReferencePenalty();
            reasons.add(MatchReason.REFERENCE_PARTIAL);
        } else {
            reasons.add(MatchReason.REFERENCE_MISMATCH);
        }

        Optional<PaymentMethod> method = PaymentMethod.fromCode(payment.method());
        if (method.isEmpty()) {
            score += weights.getMethod() * 0.5;
            reasons.add(MatchReason.METHOD_UNKNOWN);
        } else if (methodAccepted(method.get(), candidate)) {
            score += weights.getMethod();
            reasons.add(MatchReason.METHOD_ACCEPTED);
        } else {
            reasons.add(MatchReason.METHOD_NOT_ACCEPTED);
        }

        if (payment.timestamp() == null) {
            score += weights.getTimestamp() * 0.5;
            reasons.add(MatchReason.TIMESTAMP_MISSING);
        } else if (timestampValid(payment.timestamp(), candidate, now)) {
            score += weights.getTimestamp();
            reasons.add(MatchReason.TIMESTAMP_VALID);
        } else {
            reasons.add(MatchReason.TIMESTAMP_INVALID);
        }

        score += weights.getImageQuality() * Math.max(0.0, Math.min(1.0, imageQuality));

        if (nameSimilarity(payment.sender(), candidate.buyerIdentity()) >= BUYER_NAME_SIMILARITY) {
            reasons.add(MatchReason.BUYER_NAME_MATCH);
        }

        score = Math.max(0.0, Math.min(1.0, score));
        // a secondary reading can point a reviewer at a submission but never approves one
        boolean eligible = reading == MatchReason.PRIMARY_READING
                && amountExact && score >= settings.getAutoApproveScore();
        return new ScoredCandidate(candidate.id(), score, reasons, eligible, amountExact, referenceExact,
                candidate.expectedAmount());
    }

    private static boolean methodAccepted(PaymentMethod method, MatchCandidate candidate) {
        List<String> accepted = candidate.acceptedMethodsOrEmpty();
        if (accepted.isEmpty()) {
            return method.settlesIn(candidate.currency());
        }
        return accepted.stream()
                .map(PaymentMethod::fromCode)
                .flatMap(Optional::stream)
                .anyMatch(acceptedMethod -> acceptedMethod == method);
    }

    private boolean timestampValid(Instant timestamp, MatchCandidate candidate, Instant now) {
        var skew = properties.getMatching().getTimestampSkew();
        if (timestamp.isAfter(now.plus(skew))) {
            return false;
        }
        return candidate.createdAt() == null || !timestamp.isBefore(candidate.createdAt().minus(skew));
    }

    /**
     * Jaccard similarity over lower-cased name tokens.
     */
    static double nameSimilarity(String left, String right) {
        Set<String> a = tokens(left);
        Set<String> b = tokens(right);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> tokens(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(value.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toSet());
    }

    private static String normalize(String reference) {
        if (reference == null || reference.isBlank()) {
            return null;
        }
        return reference.trim().toUpperCase(Locale.ROOT);
    }

    static boolean sameAmount(BigDecimal left, BigDecimal right, BigDecimal tolerance) {
        return left != null && right != null && left.subtract(right).abs().compareTo(tolerance) <= 0;
    }
}
