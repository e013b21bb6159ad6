package com.gomflow.smartagent;

import com.gomflow.smartagent.domain.JobPriority;
import com.gomflow.smartagent.domain.MatchCandidate;
import com.gomflow.smartagent.domain.PipelineStage;
import com.gomflow.smartagent.domain.ProcessingJob;
import com.gomflow.smartagent.domain.SourcePlatform;
import com.gomflow.smartagent.domain.SubmissionContext;
import com.gomflow.smartagent.domain.VerificationJob;
import com.gomflow.smartagent.intake.ImageFormat;
import com.gomflow.smartagent.intake.PreparedImage;
import com.gomflow.smartagent.recognition.OcrResult;
import com.gomflow.smartagent.vision.VisionExtraction;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * Shared builders for unit tests. Times are anchored to {@link #NOW}, which is
 * 12:00 in Manila.
 */
public final class TestFixtures {

    public static final Instant NOW = Instant.parse("2026-03-15T04:00:00Z");
    public static final String REFERENCE = "BP2024-001";

    private TestFixtures() {
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static PreparedImage preparedImage(String fingerprint) {
        return new PreparedImage(new byte[]{1, 2, 3}, new byte[]{4, 5, 6}, 800, 1200, ImageFormat.PNG,
                fingerprint, 2048L);
    }

    public static ProcessingJob job() {
        return job(JobPriority.NORMAL, null);
    }

    public static ProcessingJob job(JobPriority priority) {
        return job(priority, null);
    }

    public static ProcessingJob job(JobPriority priority, SubmissionContext context) {
        return new ProcessingJob(UUID.randomUUID(), UUID.randomUUID(), preparedImage("fp-" + UUID.randomUUID()),
                SourcePlatform.WHATSAPP, "buyer-42", priority, context, NOW, 1);
    }

    public static VerificationJob trackedJob(ProcessingJob job, PipelineStage stage) {
        return VerificationJob.builder()
                .id(job.id())
                .extractionId(job.extractionId())
                .fingerprint(job.image().fingerprint())
                .sourcePlatform(job.sourcePlatform())
                .priority(job.priority())
                .submittedBy(job.submittedBy())
                .stage(stage)
                .createdAt(NOW)
                .build();
    }

    /**
     * OCR text of a GCash receipt for the given amount.
     */
    public static OcrResult gcashReceiptText(String amount) {
        String text = "GCash\n"
                + "Express Send\n"
                + "Amount: ₱" + amount + "\n"
                + "Ref No. " + REFERENCE + "\n"
                + "Mar 15, 2026 11:42 AM";
        return new OcrResult(text, 0.92, List.of(), List.of(), "eng");
    }

    public static VisionExtraction gcashVision(String amount) {
        return new VisionExtraction("GCash Express Send receipt",
                new VisionExtraction.Fields("GCash", new BigDecimal(amount), "PHP", "Maria Santos", "GOMFLOW",
                        REFERENCE, "2026-03-15T11:42:00", null),
                0.95, "Clear GCash receipt", "gpt-4o", false);
    }

    public static MatchCandidate candidate(String id, String amount) {
        return new MatchCandidate(id, REFERENCE, new BigDecimal(amount), "PHP", "Maria Santos",
                MatchCandidate.STATUS_PENDING, NOW.minus(Duration.ofDays(1)), List.of("gcash"));
    }
}
