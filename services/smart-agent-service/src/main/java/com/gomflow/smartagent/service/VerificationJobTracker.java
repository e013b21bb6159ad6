package com.gomflow.smartagent.service;

import com.gomflow.smartagent.domain.PipelineStage;
import com.gomflow.smartagent.domain.ProcessingJob;
import com.gomflow.smartagent.domain.VerificationJob;
import com.gomflow.smartagent.repository.VerificationJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists job progress through the pipeline stages.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationJobTracker {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final VerificationJobRepository jobRepository;
    private final Clock clock;

    @Transactional
    public VerificationJob create(ProcessingJob job) {
        VerificationJob tracked = VerificationJob.builder()
                .id(job.id())
                .extractionId(job.extractionId())
                .fingerprint(job.image().fingerprint())
                .sourcePlatform(job.sourcePlatform())
                .priority(job.priority())
                .submittedBy(job.submittedBy())
                .stage(PipelineStage.RECEIVED)
                .attempts(0)
                .createdAt(clock.instant())
                .build();
        return jobRepository.save(tracked);
    }

    @Transactional
    public VerificationJob advance(UUID jobId, PipelineStage stage) {
        VerificationJob job = load(jobId);
        if (job.advanceTo(stage)) {
            log.debug("Job {} moved to {}", jobId, stage);
            return jobRepository.save(job);
        }
        log.debug("Job {} stays at {}, ignoring move to {}", jobId, job.getStage(), stage);
        return job;
    }

    @Transactional
    public VerificationJob recordAttemptFailure(UUID jobId, int attempt, Throwable error) {
        VerificationJob job = load(jobId);
        job.setAttempts(attempt);
        job.setLastError(truncate(describe(error)));
        return jobRepository.save(job);
    }

    @Transactional
    public VerificationJob markDeadLettered(UUID jobId, int attempts, String error) {
        VerificationJob job = load(jobId);
        job.setAttempts(attempts);
        job.setLastError(truncate(error));
        job.advanceTo(PipelineStage.DEAD_LETTERED);
        return jobRepository.save(job);
    }

    @Transactional(readOnly = true)
    public Optional<VerificationJob> find(UUID jobId) {
        return jobRepository.findById(jobId);
    }

    private VerificationJob load(UUID jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalStateException("Verification job not found: " + jobId));
    }

    static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }
}
