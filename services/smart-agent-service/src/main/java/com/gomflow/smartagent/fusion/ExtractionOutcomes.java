package com.gomflow.smartagent.fusion;

import com.gomflow.smartagent.port.PortOutcome;
import com.gomflow.smartagent.recognition.OcrResult;
import com.gomflow.smartagent.vision.VisionExtraction;

/**
 * Both port results for one job, joined before fusion.
 */
public record ExtractionOutcomes(PortOutcome<OcrResult> recognition, PortOutcome<VisionExtraction> extraction) {

    public ExtractionOutcomes {
        if (recognition == null || extraction == null) {
            throw new IllegalArgumentException("Both port outcomes are required");
        }
    }
}
