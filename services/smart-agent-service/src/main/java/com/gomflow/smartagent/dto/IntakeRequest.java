package com.gomflow.smartagent.dto;

import com.gomflow.smartagent.domain.JobPriority;
import com.gomflow.smartagent.domain.SourcePlatform;
import com.gomflow.smartagent.domain.SubmissionContext;

/**
 * Raw upload plus the metadata intake needs to build a job.
 */
public record IntakeRequest(
        byte[] imageBytes,
        SourcePlatform sourcePlatform,
        JobPriority priority,
        String submittedBy,
        SubmissionContext submissionContext
) {
}
