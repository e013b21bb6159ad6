package com.gomflow.smartagent.intake;

import com.gomflow.smartagent.dispatch.JobDispatcher;
import com.gomflow.smartagent.domain.PipelineStage;
import com.gomflow.smartagent.domain.ProcessingJob;
import com.gomflow.smartagent.domain.SourcePlatform;
import com.gomflow.smartagent.domain.VerificationJob;
import com.gomflow.smartagent.dto.IntakeRequest;
import com.gomflow.smartagent.dto.SubmissionReceipt;
import com.gomflow.smartagent.exception.IntakeUnavailableException;
import com.gomflow.smartagent.repository.VerificationJobRepository;
import com.gomflow.smartagent.service.VerificationJobTracker;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for proof uploads: validates and normalises the image, answers duplicates from
 * the dedup window and hands new work to the dispatcher.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImageIntakeService {

    private final ImagePreprocessor imagePreprocessor;
    private final FingerprintRegistry fingerprintRegistry;
    private final VerificationJobTracker jobTracker;
    private final VerificationJobRepository jobRepository;
    private final JobDispatcher jobDispatcher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public SubmissionReceipt submit(IntakeRequest request) {
        if (request.sourcePlatform() == null) {
            throw new IllegalArgumentException("Source platform is required");
        }
        if (!jobDispatcher.isAccepting()) {
            throw new IntakeUnavailableException("Service is shutting down, not accepting submissions");
        }

        PreparedImage image = imagePreprocessor.prepare(request.imageBytes());
        UUID jobId = UUID.randomUUID();
        UUID extractionId = UUID.randomUUID();

        Optional<FingerprintRegistry.PriorSubmission> prior =
                fingerprintRegistry.claim(image.fingerprint(), jobId, extractionId);
        if (prior.isPresent()) {
            return duplicateReceipt(prior.get(), request.sourcePlatform());
        }

        ProcessingJob job = new ProcessingJob(jobId, extractionId, image, request.sourcePlatform(),
                request.submittedBy(), request.priority(), request.submissionContext(), clock.instant(), 1);
        boolean created = false;
        boolean enqueued;
        try {
            jobTracker.create(job);
            created = true;
            enqueued = jobDispatcher.enqueue(job);
        } catch (RuntimeException e) {
            // the fingerprint must not point at a job that was never stored or queued
            log.error("Failed to register job {} for fingerprint {}, releasing claim", jobId, image.fingerprint(), e);
            fingerprintRegistry.release(image.fingerprint());
            if (created) {
                jobRepository.deleteById(jobId);
            }
            throw e;
        }

        if (!enqueued) {
            fingerprintRegistry.release(image.fingerprint());
            jobRepository.deleteById(jobId);
            throw new IntakeUnavailableException("Service is shutting down, not accepting submissions");
        }

        meterRegistry.counter("smart_agent.intake.accepted",
                "platform", request.sourcePlatform().getValue(),
                "priority", job.priority().name()).increment();
        log.info("Accepted {} proof from {}: jobId={}, extractionId={}, priority={}",
                request.sourcePlatform().getValue(), request.submittedBy(), jobId, extractionId, job.priority());

        return SubmissionReceipt.builder()
                .jobId(jobId)
                .extractionId(extractionId)
                .duplicate(false)
                .status(PipelineStage.RECEIVED)
                .build();
    }

    private SubmissionReceipt duplicateReceipt(FingerprintRegistry.PriorSubmission prior, SourcePlatform platform) {
        meterRegistry.counter("smart_agent.intake.duplicates", "platform", platform.getValue()).increment();
        PipelineStage stage = jobRepository.findByExtractionId(prior.extractionId())
                .map(VerificationJob::getStage)
                .orElse(PipelineStage.RECEIVED);
        log.info("Duplicate proof answered with prior extraction {} (stage={})", prior.extractionId(), stage);

        return SubmissionReceipt.builder()
                .jobId(prior.jobId())
                .extractionId(prior.extractionId())
                .duplicate(true)
                .status(stage)
                .build();
    }
}
