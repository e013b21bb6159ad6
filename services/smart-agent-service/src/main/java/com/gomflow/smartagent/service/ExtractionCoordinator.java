package com.gomflow.smartagent.service;

import com.gomflow.smartagent.domain.ProcessingJob;
import com.gomflow.smartagent.fusion.ExtractionOutcomes;
import com.gomflow.smartagent.port.PortOutcome;
import com.gomflow.smartagent.recognition.OcrResult;
import com.gomflow.smartagent.recognition.RecognitionPort;
import com.gomflow.smartagent.vision.ExtractionTaskHint;
import com.gomflow.smartagent.vision.StructuredExtractionPort;
import com.gomflow.smartagent.vision.VisionExtraction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs both recognizers for a job concurrently and reports each as a tagged outcome.
 * A failing recognizer never fails the job; fusion works with whatever came back.
 */
@Slf4j
@Service
public class ExtractionCoordinator {

    private final RecognitionPort recognitionPort;
    private final StructuredExtractionPort structuredExtractionPort;
    private final Executor extractionExecutor;

    public ExtractionCoordinator(RecognitionPort recognitionPort,
                                 StructuredExtractionPort structuredExtractionPort,
                                 @Qualifier("extractionExecutor") Executor extractionExecutor) {
        this.recognitionPort = recognitionPort;
        this.structuredExtractionPort = structuredExtractionPort;
        this.extractionExecutor = extractionExecutor;
    }

    public ExtractionOutcomes extract(ProcessingJob job) {
        ExtractionTaskHint hint = ExtractionTaskHint.forJob(job);
        CompletableFuture<PortOutcome<VisionExtraction>> vision =
                CompletableFuture.supplyAsync(() -> runVision(job, hint), extractionExecutor);

        PortOutcome<OcrResult> recognition = runRecognition(job);
        PortOutcome<VisionExtraction> extraction;
        try {
            extraction = vision.join();
        } catch (CompletionException e) {
            log.error("Vision extraction task failed for {}", job.extractionId(), e.getCause());
            extraction = PortOutcome.unavailable(String.valueOf(e.getCause()));
        }

        log.info("Extraction outcomes for {}: recognition={}, vision={}", job.extractionId(),
                recognition.getStatus(), extraction.getStatus());
        return new ExtractionOutcomes(recognition, extraction);
    }

    private PortOutcome<OcrResult> runRecognition(ProcessingJob job) {
        try {
            OcrResult result = recognitionPort.extractText(job.image());
            if (result == null || result.isBlank()) {
                return PortOutcome.degraded(result, "No legible text recognized");
            }
            return PortOutcome.ok(result);
        } catch (RuntimeException e) {
            log.warn("Recognition unavailable for {}: {}", job.extractionId(), e.getMessage());
            return PortOutcome.unavailable(e.getMessage());
        }
    }

    private PortOutcome<VisionExtraction> runVision(ProcessingJob job, ExtractionTaskHint hint) {
        try {
            VisionExtraction result = structuredExtractionPort.extractStructured(job.image(), hint);
            if (result == null || !result.hasAnyField()) {
                return PortOutcome.degraded(result, "No payment fields extracted");
            }
            return PortOutcome.ok(result);
        } catch (RuntimeException e) {
            log.warn("Vision extraction unavailable for {}: {}", job.extractionId(), e.getMessage());
            return PortOutcome.unavailable(e.getMessage());
        }
    }
}
