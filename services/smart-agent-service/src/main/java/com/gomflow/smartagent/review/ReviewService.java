package com.gomflow.smartagent.review;

import com.gomflow.smartagent.client.ClaimRequest;
import com.gomflow.smartagent.client.OrderStoreGateway;
import com.gomflow.smartagent.domain.DecisionOutcome;
import com.gomflow.smartagent.domain.ExtractedPayment;
import com.gomflow.smartagent.domain.ManualCorrections;
import com.gomflow.smartagent.domain.MatchCandidate;
import com.gomflow.smartagent.domain.PaymentExtraction;
import com.gomflow.smartagent.domain.Provenance;
import com.gomflow.smartagent.domain.ReasonCode;
import com.gomflow.smartagent.domain.VerificationDecision;
import com.gomflow.smartagent.domain.VerificationJob;
import com.gomflow.smartagent.dto.ReviewRequest;
import com.gomflow.smartagent.events.VerificationEventPublisher;
import com.gomflow.smartagent.exception.ExtractionNotFoundException;
import com.gomflow.smartagent.exception.InvalidReviewRequestException;
import com.gomflow.smartagent.exception.NoCandidatesFoundException;
import com.gomflow.smartagent.matching.PaymentMatch;
import com.gomflow.smartagent.matching.PaymentMatchingEngine;
import com.gomflow.smartagent.matching.ScoredCandidate;
import com.gomflow.smartagent.repository.PaymentExtractionRepository;
import com.gomflow.smartagent.repository.VerificationDecisionRepository;
import com.gomflow.smartagent.repository.VerificationJobRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies reviewer actions. Every action records a new decision linked to the one it
 * supersedes; earlier decisions and the extraction itself are never changed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewService {

    private final PaymentExtractionRepository extractionRepository;
    private final VerificationDecisionRepository decisionRepository;
    private final VerificationJobRepository jobRepository;
    private final PaymentMatchingEngine matchingEngine;
    private final OrderStoreGateway orderStoreGateway;
    private final VerificationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Transactional
    public VerificationDecision review(ReviewRequest request) {
        if (request == null || request.getExtractionId() == null || request.getAction() == null) {
            throw new InvalidReviewRequestException("Extraction ID and action are required");
        }
        if (request.getReviewerId() == null || request.getReviewerId().isBlank()) {
            throw new InvalidReviewRequestException("Reviewer ID is required");
        }

        UUID extractionId = request.getExtractionId();
        VerificationDecision latest = decisionRepository.findFirstByExtractionIdOrderByDecidedAtDesc(extractionId)
                .orElseThrow(() -> new ExtractionNotFoundException(extractionId));
        VerificationJob job = jobRepository.findByExtractionId(extractionId)
                .orElseThrow(() -> new ExtractionNotFoundException(extractionId));
        Optional<PaymentExtraction> extraction = extractionRepository.findById(extractionId);

        VerificationDecision decision = switch (request.getAction()) {
            case APPROVE -> approve(request, latest, extraction);
            case REJECT -> reject(request, latest, extraction);
            case MODIFY -> modify(request, latest, extraction);
        };

        meterRegistry.counter("smart_agent.reviews", "action", request.getAction().name(),
                "outcome", decision.getOutcome().getValue()).increment();
        log.info("Reviewer {} recorded {} for extraction {} (supersedes {})", request.getReviewerId(),
                decision.getOutcome(), extractionId, latest.getId());

        eventPublisher.publishDecision(job, decision);
        return decision;
    }

    private VerificationDecision approve(ReviewRequest request, VerificationDecision latest,
                                         Optional<PaymentExtraction> extraction) {
        String candidateId = request.getApprovedCandidateId() != null
                ? request.getApprovedCandidateId()
                : latest.getMatchedCandidateId();
        if (candidateId == null || candidateId.isBlank()) {
            throw new InvalidReviewRequestException("approvedCandidateId is required when no candidate was matched");
        }

        UUID decisionId = UUID.randomUUID();
        Optional<ExtractedPayment> primary = extraction.flatMap(PaymentExtraction::primaryPayment);
        claim(candidateId, request.getExtractionId(), decisionId, DecisionOutcome.MANUALLY_APPROVED, primary);

        return save(decisionId, request, latest, DecisionOutcome.MANUALLY_APPROVED, candidateId, 1.0,
                ReasonCode.REVIEWER_APPROVED, null);
    }

    private VerificationDecision reject(ReviewRequest request, VerificationDecision latest,
                                        Optional<PaymentExtraction> extraction) {
        double confidence = extraction.map(PaymentExtraction::getOverallConfidence).orElse(0.0);
        return save(UUID.randomUUID(), request, latest, DecisionOutcome.REJECTED, null, confidence,
                ReasonCode.REVIEWER_REJECTED, null);
    }

    /**
     * Re-matches the corrected reading. Only an exact-amount match, or a candidate the reviewer
     * names, is claimed; anything else stays in review with the corrections attached.
     */
    private VerificationDecision modify(ReviewRequest request, VerificationDecision latest,
                                        Optional<PaymentExtraction> extraction) {
        ManualCorrections corrections = request.getCorrections() == null
                ? null
                : request.getCorrections().toManualCorrections();
        if (corrections == null || corrections.isEmpty()) {
            throw new InvalidReviewRequestException("Corrections are required for MODIFY");
        }

        ExtractedPayment corrected = extraction.flatMap(PaymentExtraction::primaryPayment)
                .map(payment -> payment.correctedWith(corrections))
                .orElseGet(() -> fromCorrections(corrections));
        if (corrected.amount() == null || corrected.currency() == null) {
            throw new InvalidReviewRequestException("Amount and currency are required when nothing was extracted");
        }
        corrected = corrected.withConfidence(1.0, corrected.provenance());

        double imageQuality = extraction.map(PaymentExtraction::getImageQuality).orElse(0.0);
        PaymentMatch match = matchingEngine.match(request.getExtractionId(), corrected, imageQuality,
                candidatesFor(corrected.currency()));

        String candidateId = request.getApprovedCandidateId();
        if (candidateId == null) {
            candidateId = match.best()
                    .filter(ScoredCandidate::amountExact)
                    .map(ScoredCandidate::candidateId)
                    .orElse(null);
        }

        UUID decisionId = UUID.randomUUID();
        if (candidateId == null) {
            log.info("Corrected extraction {} still has no usable match ({})", request.getExtractionId(),
                    match.status());
            return save(decisionId, request, latest, DecisionOutcome.MANUAL_REVIEW, null, 1.0,
                    ReasonCode.CORRECTED_UNMATCHED, corrections);
        }

        claim(candidateId, request.getExtractionId(), decisionId, DecisionOutcome.MANUALLY_APPROVED,
                Optional.of(corrected));
        return save(decisionId, request, latest, DecisionOutcome.MANUALLY_APPROVED, candidateId, 1.0,
                ReasonCode.REVIEWER_CORRECTED, corrections);
    }

    private List<MatchCandidate> candidatesFor(String currency) {
        try {
            return orderStoreGateway.findCandidates(currency);
        } catch (NoCandidatesFoundException e) {
            log.info("No candidates for corrected payment: {}", e.getMessage());
            return List.of();
        }
    }

    private void claim(String candidateId, UUID extractionId, UUID decisionId, DecisionOutcome outcome,
                       Optional<ExtractedPayment> payment) {
        orderStoreGateway.claim(candidateId, new ClaimRequest(
                extractionId,
                decisionId,
                outcome.getValue(),
                payment.map(ExtractedPayment::amount).orElse(null),
                payment.map(ExtractedPayment::reference).orElse(null)));
    }

    private VerificationDecision save(UUID decisionId, ReviewRequest request, VerificationDecision latest,
                                      DecisionOutcome outcome, String candidateId, double confidence,
                                      ReasonCode reasonCode, ManualCorrections corrections) {
        return decisionRepository.save(VerificationDecision.builder()
                .id(decisionId)
                .extractionId(request.getExtractionId())
                .jobId(latest.getJobId())
                .outcome(outcome)
                .matchedCandidateId(candidateId)
                .confidence(confidence)
                .reasonCodes(List.of(reasonCode))
                .decidedBy(request.getReviewerId())
                .initialDecision(false)
                .supersedesDecisionId(latest.getId())
                .corrections(corrections)
                .notes(request.getNotes())
                .decidedAt(clock.instant())
                .build());
    }

    private static ExtractedPayment fromCorrections(ManualCorrections corrections) {
        return new ExtractedPayment(corrections.amount(), corrections.currency(), corrections.method(),
                null, null, corrections.reference(), null, 1.0, Provenance.COMBINED);
    }
}
