package com.gomflow.smartagent.service;

import com.gomflow.smartagent.client.OrderStoreGateway;
import com.gomflow.smartagent.domain.MatchCandidate;
import com.gomflow.smartagent.domain.PaymentExtraction;
import com.gomflow.smartagent.domain.PipelineStage;
import com.gomflow.smartagent.domain.ProcessingJob;
import com.gomflow.smartagent.domain.SubmissionContext;
import com.gomflow.smartagent.domain.VerificationDecision;
import com.gomflow.smartagent.domain.VerificationJob;
import com.gomflow.smartagent.events.VerificationEventPublisher;
import com.gomflow.smartagent.exception.NoCandidatesFoundException;
import com.gomflow.smartagent.fusion.ExtractionFusionEngine;
import com.gomflow.smartagent.fusion.ExtractionOutcomes;
import com.gomflow.smartagent.matching.PaymentMatch;
import com.gomflow.smartagent.matching.PaymentMatchingEngine;
import com.gomflow.smartagent.repository.PaymentExtractionRepository;
import com.gomflow.smartagent.repository.VerificationDecisionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Takes one job through extraction, fusion, matching and decision.
 *
 * Safe to re-run for the same job: a stored extraction is reused instead of calling the
 * recognizers again, and an existing initial decision ends the run immediately.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentVerificationPipeline {

    private final ExtractionCoordinator extractionCoordinator;
    private final ExtractionFusionEngine fusionEngine;
    private final PaymentMatchingEngine matchingEngine;
    private final OrderStoreGateway orderStoreGateway;
    private final DecisionService decisionService;
    private final VerificationJobTracker jobTracker;
    private final VerificationEventPublisher eventPublisher;
    private final PaymentExtractionRepository extractionRepository;
    private final VerificationDecisionRepository decisionRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public VerificationDecision process(ProcessingJob job) {
        Optional<VerificationDecision> existing =
                decisionRepository.findFirstByExtractionIdAndInitialDecisionTrue(job.extractionId());
        if (existing.isPresent()) {
            log.info("Job {} already decided, skipping", job.id());
            jobTracker.advance(job.id(), PipelineStage.DECIDED);
            return existing.get();
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        VerificationJob tracked = jobTracker.advance(job.id(), PipelineStage.EXTRACTING);
        if (job.attempt() <= 1) {
            eventPublisher.publishProcessingStarted(tracked);
        }

        PaymentExtraction extraction = extractionRepository.findById(job.extractionId())
                .orElseGet(() -> extractAndFuse(job));
        tracked = jobTracker.advance(job.id(), PipelineStage.FUSED);
        if (extraction.hasData()) {
            eventPublisher.publishPaymentDetected(tracked, extraction);
        }

        tracked = jobTracker.advance(job.id(), PipelineStage.MATCHING);
        PaymentMatch match = match(job, extraction);

        VerificationDecision decision = decisionService.decide(tracked, extraction, match);
        jobTracker.advance(job.id(), PipelineStage.DECIDED);

        sample.stop(meterRegistry.timer("smart_agent.jobs.duration"));
        meterRegistry.counter("smart_agent.jobs.completed", "outcome", decision.getOutcome().getValue()).increment();
        return decision;
    }

    private PaymentExtraction extractAndFuse(ProcessingJob job) {
        long start = clock.millis();
        ExtractionOutcomes outcomes = extractionCoordinator.extract(job);
        PaymentExtraction extraction = fusionEngine.fuse(job, outcomes, clock.millis() - start);
        return extractionRepository.save(extraction);
    }

    private PaymentMatch match(ProcessingJob job, PaymentExtraction extraction) {
        if (!extraction.hasData()) {
            return PaymentMatch.noCandidates(extraction.getId(), clock.instant());
        }
        try {
            List<MatchCandidate> candidates = orderStoreGateway.findCandidates(extraction.getPrimaryCurrency());
            return matchingEngine.match(extraction, narrowToSubmission(job, candidates));
        } catch (NoCandidatesFoundException e) {
            log.info("No candidates for extraction {}: {}", extraction.getId(), e.getMessage());
            return PaymentMatch.noCandidates(extraction.getId(), clock.instant());
        } catch (RuntimeException e) {
            log.warn("Candidate lookup failed for extraction {}: {}", extraction.getId(), e.getMessage());
            meterRegistry.counter("smart_agent.jobs.lookup_failed").increment();
            return PaymentMatch.lookupFailed(extraction.getId(), clock.instant());
        }
    }

    /**
     * A caller that named its submission is verifying that one; other candidates are ignored
     * unless the named submission is no longer pending.
     */
    private static List<MatchCandidate> narrowToSubmission(ProcessingJob job, List<MatchCandidate> candidates) {
        Optional<String> submissionId = job.context()
                .map(SubmissionContext::submissionId)
                .filter(id -> !id.isBlank());
        if (submissionId.isEmpty()) {
            return candidates;
        }
        List<MatchCandidate> named = candidates.stream()
                .filter(candidate -> submissionId.get().equals(candidate.id()))
                .toList();
        return named.isEmpty() ? candidates : named;
    }
}
