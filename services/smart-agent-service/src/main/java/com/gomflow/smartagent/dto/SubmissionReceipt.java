package com.gomflow.smartagent.dto;

import com.gomflow.smartagent.domain.PipelineStage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Acknowledgement returned to the submitter. The outcome arrives later as an event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionReceipt {

    private UUID jobId;
    private UUID extractionId;
    private boolean duplicate;
    private PipelineStage status;
}
