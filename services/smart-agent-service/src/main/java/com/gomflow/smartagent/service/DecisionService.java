package com.gomflow.smartagent.service;

import com.gomflow.smartagent.client.ClaimRequest;
import com.gomflow.smartagent.client.OrderStoreGateway;
import com.gomflow.smartagent.decision.DecisionEngine;
import com.gomflow.smartagent.decision.DecisionInput;
import com.gomflow.smartagent.decision.DecisionTable;
import com.gomflow.smartagent.domain.DecisionOutcome;
import com.gomflow.smartagent.domain.ExtractedPayment;
import com.gomflow.smartagent.domain.PaymentExtraction;
import com.gomflow.smartagent.domain.ReasonCode;
import com.gomflow.smartagent.domain.VerificationDecision;
import com.gomflow.smartagent.domain.VerificationJob;
import com.gomflow.smartagent.events.VerificationEventPublisher;
import com.gomflow.smartagent.exception.ConcurrentClaimConflictException;
import com.gomflow.smartagent.matching.PaymentMatch;
import com.gomflow.smartagent.repository.VerificationDecisionRepository;
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
 * Records the automated decision for an extraction.
 *
 * Approvals are only recorded after the order store accepted the claim on the matched
 * submission; a lost claim race turns the approval into a manual review.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecisionService {

    private final DecisionEngine decisionEngine;
    private final OrderStoreGateway orderStoreGateway;
    private final VerificationDecisionRepository decisionRepository;
    private final VerificationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Transactional
    public VerificationDecision decide(VerificationJob job, PaymentExtraction extraction, PaymentMatch match) {
        Optional<VerificationDecision> existing =
                decisionRepository.findFirstByExtractionIdAndInitialDecisionTrue(extraction.getId());
        if (existing.isPresent()) {
            log.info("Extraction {} already decided as {}, reusing", extraction.getId(),
                    existing.get().getOutcome());
            return existing.get();
        }

        DecisionTable.Verdict verdict = decisionEngine.decide(extraction, match);
        UUID decisionId = UUID.randomUUID();
        DecisionOutcome outcome = verdict.outcome();
        List<ReasonCode> reasons = verdict.reasonCodes();
        String candidateId = verdict.matchedCandidateId();

        if (outcome.isApproved() && candidateId != null) {
            try {
                ExtractedPayment primary = extraction.primaryPayment().orElse(null);
                orderStoreGateway.claim(candidateId, new ClaimRequest(
                        extraction.getId(),
                        decisionId,
                        outcome.getValue(),
                        primary != null ? primary.amount() : null,
                        primary != null ? primary.reference() : null));
            } catch (ConcurrentClaimConflictException e) {
                log.warn("Lost claim on submission {} for extraction {}, sending to review",
                        candidateId, extraction.getId());
                outcome = DecisionOutcome.MANUAL_REVIEW;
                reasons = List.of(ReasonCode.CONCURRENT_CLAIM_CONFLICT);
            }
        }

        VerificationDecision decision = decisionRepository.save(VerificationDecision.builder()
                .id(decisionId)
                .extractionId(extraction.getId())
                .jobId(job.getId())
                .outcome(outcome)
                .matchedCandidateId(candidateId)
                .confidence(extraction.getOverallConfidence())
                .reasonCodes(reasons)
                .decidedBy(VerificationDecision.SYSTEM)
                .initialDecision(true)
                .decidedAt(clock.instant())
                .build());

        meterRegistry.counter("smart_agent.decisions", "outcome", outcome.getValue()).increment();
        log.info("Decision for extraction {}: {} {} (rule={}, candidate={}, confidence={})", extraction.getId(),
                outcome, reasons, verdict.ruleName(), candidateId, extraction.getOverallConfidence());

        eventPublisher.publishDecision(job, decision);
        return decision;
    }

    /**
     * Manual review decision for a job that could not be processed. Idempotent per extraction.
     */
    @Transactional
    public VerificationDecision recordProcessingFailure(VerificationJob job, String error) {
        Optional<VerificationDecision> existing =
                decisionRepository.findFirstByExtractionIdAndInitialDecisionTrue(job.getExtractionId());
        if (existing.isPresent()) {
            return existing.get();
        }

        DecisionTable.Verdict verdict = decisionEngine.evaluate(DecisionInput.processingFailure());
        VerificationDecision decision = decisionRepository.save(VerificationDecision.builder()
                .id(UUID.randomUUID())
                .extractionId(job.getExtractionId())
                .jobId(job.getId())
                .outcome(verdict.outcome())
                .confidence(0.0)
                .reasonCodes(verdict.reasonCodes())
                .decidedBy(VerificationDecision.SYSTEM)
                .initialDecision(true)
                .notes(error)
                .decidedAt(clock.instant())
                .build());

        meterRegistry.counter("smart_agent.decisions", "outcome", decision.getOutcome().getValue()).increment();
        log.warn("Recorded processing failure decision for extraction {}: {}", job.getExtractionId(), error);

        eventPublisher.publishDecision(job, decision);
        return decision;
    }
}
