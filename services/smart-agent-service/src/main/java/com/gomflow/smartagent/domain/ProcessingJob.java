package com.gomflow.smartagent.domain;

import com.gomflow.smartagent.intake.PreparedImage;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Unit of work handed from intake to the dispatcher. The extraction id is assigned up front
 * so that duplicates of an in-flight upload can be answered immediately.
 */
public record ProcessingJob(
        UUID id,
        UUID extractionId,
        PreparedImage image,
        SourcePlatform sourcePlatform,
        String submittedBy,
        JobPriority priority,
        SubmissionContext submissionContext,
        Instant createdAt,
        int attempt
) {

    public ProcessingJob {
        if (id == null || extractionId == null) {
            throw new IllegalArgumentException("Job and extraction ids are required");
        }
        if (image == null) {
            throw new IllegalArgumentException("Prepared image is required");
        }
        if (priority == null) {
            priority = JobPriority.NORMAL;
        }
        if (submissionContext != null && submissionContext.isEmpty()) {
            submissionContext = null;
        }
    }

    public Optional<SubmissionContext> context() {
        return Optional.ofNullable(submissionContext);
    }

    public ProcessingJob withAttempt(int nextAttempt) {
        return new ProcessingJob(id, extractionId, image, sourcePlatform, submittedBy, priority,
                submissionContext, createdAt, nextAttempt);
    }
}
