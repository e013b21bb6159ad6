package com.gomflow.smartagent.controller;

import com.gomflow.smartagent.dispatch.DispatcherStatus;
import com.gomflow.smartagent.dispatch.JobDispatcher;
import com.gomflow.smartagent.domain.JobPriority;
import com.gomflow.smartagent.domain.SourcePlatform;
import com.gomflow.smartagent.domain.SubmissionContext;
import com.gomflow.smartagent.dto.DecisionResponse;
import com.gomflow.smartagent.dto.DetectionStats;
import com.gomflow.smartagent.dto.ExtractionResponse;
import com.gomflow.smartagent.dto.IntakeRequest;
import com.gomflow.smartagent.dto.ReviewRequest;
import com.gomflow.smartagent.dto.SubmissionReceipt;
import com.gomflow.smartagent.exception.InvalidImageException;
import com.gomflow.smartagent.intake.ImageIntakeService;
import com.gomflow.smartagent.review.ReviewService;
import com.gomflow.smartagent.service.VerificationQueryService;
import com.gomflow.smartagent.stats.VerificationStatisticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/smart-agent")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Smart Agent", description = "Payment proof verification")
public class SmartAgentController {

    private final ImageIntakeService intakeService;
    private final ReviewService reviewService;
    private final VerificationQueryService queryService;
    private final VerificationStatisticsService statisticsService;
    private final JobDispatcher jobDispatcher;

    @PostMapping(value = "/process", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Submit a payment proof image for verification")
    public ResponseEntity<SubmissionReceipt> process(
            @RequestPart("image") MultipartFile image,
            @RequestParam("sourcePlatform") String sourcePlatform,
            @RequestParam(value = "priority", required = false) String priority,
            @RequestParam(value = "submittedBy", required = false) String submittedBy,
            @RequestParam(value = "expectedAmount", required = false) BigDecimal expectedAmount,
            @RequestParam(value = "currency", required = false) String currency,
            @RequestParam(value = "referenceCode", required = false) String referenceCode,
            @RequestParam(value = "buyerIdentity", required = false) String buyerIdentity,
            @RequestParam(value = "submissionId", required = false) String submissionId,
            @RequestParam(value = "orderId", required = false) String orderId) {
        log.info("Received payment proof from {} ({} bytes)", sourcePlatform, image.getSize());

        byte[] bytes;
        try {
            bytes = image.getBytes();
        } catch (IOException e) {
            throw new InvalidImageException("Could not read uploaded image", e);
        }

        SubmissionContext context = new SubmissionContext(expectedAmount, currency, referenceCode,
                buyerIdentity, submissionId, orderId);
        SubmissionReceipt receipt = intakeService.submit(new IntakeRequest(
                bytes,
                SourcePlatform.fromValue(sourcePlatform),
                JobPriority.fromValue(priority),
                submittedBy,
                context));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(receipt);
    }

    @PostMapping("/review")
    @Operation(summary = "Record a reviewer decision for an extraction")
    public ResponseEntity<DecisionResponse> review(@Valid @RequestBody ReviewRequest request) {
        log.info("Review {} for extraction {} by {}", request.getAction(), request.getExtractionId(),
                request.getReviewerId());
        return ResponseEntity.ok(DecisionResponse.from(reviewService.review(request)));
    }

    @GetMapping("/extractions/{extractionId}")
    @Operation(summary = "Get a fused extraction")
    public ResponseEntity<ExtractionResponse> getExtraction(@PathVariable UUID extractionId) {
        return ResponseEntity.ok(ExtractionResponse.from(queryService.getExtraction(extractionId)));
    }

    @GetMapping("/extractions/{extractionId}/decisions")
    @Operation(summary = "Get the decision audit trail of an extraction")
    public ResponseEntity<List<DecisionResponse>> getDecisions(@PathVariable UUID extractionId) {
        return ResponseEntity.ok(queryService.getDecisions(extractionId).stream()
                .map(DecisionResponse::from)
                .toList());
    }

    @GetMapping("/status")
    @Operation(summary = "Get dispatcher queue and worker status")
    public ResponseEntity<DispatcherStatus> getStatus() {
        return ResponseEntity.ok(jobDispatcher.snapshot());
    }

    @GetMapping("/stats")
    @Operation(summary = "Get verification statistics")
    public ResponseEntity<DetectionStats> getStats(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return ResponseEntity.ok(statisticsService.getStats(from, to));
    }
}
