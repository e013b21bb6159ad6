package com.gomflow.smartagent.service;

import com.gomflow.smartagent.domain.DeadLetterJob;
import com.gomflow.smartagent.domain.ProcessingJob;
import com.gomflow.smartagent.domain.VerificationDecision;
import com.gomflow.smartagent.domain.VerificationJob;
import com.gomflow.smartagent.repository.DeadLetterJobRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;

/**
 * Parks jobs that exhausted their retries. The extraction still ends with a decision,
 * a manual review flagged as a processing failure.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeadLetterService {

    private static final int MAX_MESSAGE_LENGTH = 2000;

    private final DeadLetterJobRepository deadLetterJobRepository;
    private final VerificationJobTracker jobTracker;
    private final DecisionService decisionService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Transactional
    public VerificationDecision deadLetter(ProcessingJob job, int attempts, Throwable cause) {
        String message = cause != null ? truncate(VerificationJobTracker.describe(cause)) : "Processing abandoned";

        if (!deadLetterJobRepository.existsByJobId(job.id())) {
            deadLetterJobRepository.save(DeadLetterJob.builder()
                    .jobId(job.id())
                    .extractionId(job.extractionId())
                    .attempts(attempts)
                    .errorMessage(message)
                    .stackTrace(cause != null ? getStackTrace(cause) : null)
                    .status(DeadLetterJob.Status.PENDING_REVIEW)
                    .createdAt(clock.instant())
                    .build());
        }

        VerificationJob tracked = jobTracker.markDeadLettered(job.id(), attempts, message);
        VerificationDecision decision = decisionService.recordProcessingFailure(tracked, message);

        meterRegistry.counter("smart_agent.jobs.dead_lettered").increment();
        log.error("Job {} dead-lettered after {} attempts: {}", job.id(), attempts, message);
        return decision;
    }

    private static String getStackTrace(Throwable throwable) {
        StringWriter sw = new StringWriter();
        throwable.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    private static String truncate(String value) {
        return value.length() <= MAX_MESSAGE_LENGTH ? value : value.substring(0, MAX_MESSAGE_LENGTH);
    }
}
