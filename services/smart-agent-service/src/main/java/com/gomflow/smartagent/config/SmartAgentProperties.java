package com.gomflow.smartagent.config;

import com.gomflow.smartagent.port.RetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Type-safe configuration for the smart agent pipeline.
 *
 * Every threshold that decides money-moving outcomes lives here rather than
 * at call sites, so operators can tune it per environment.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "smart-agent")
public class SmartAgentProperties {

    @Valid
    private Intake intake = new Intake();

    @Valid
    private Ports ports = new Ports();

    @Valid
    private ScoringWeights weights = new ScoringWeights();

    @Valid
    private Fusion fusion = new Fusion();

    @Valid
    private Matching matching = new Matching();

    @Valid
    private Decision decision = new Decision();

    @Valid
    private Dispatcher dispatcher = new Dispatcher();

    @Valid
    private Events events = new Events();

    @AssertTrue(message = "smart-agent.fusion.single-source-ceiling must be below smart-agent.decision.auto-approve")
    public boolean isSingleSourceCeilingBelowAutoApprove() {
        return fusion.getSingleSourceCeiling() < decision.getAutoApprove();
    }

    @AssertTrue(message = "decision thresholds must satisfy reject-floor <= conditional <= auto-approve")
    public boolean isDecisionBandsOrdered() {
        return decision.getRejectFloor() <= decision.getConditional()
                && decision.getConditional() <= decision.getAutoApprove();
    }

    @AssertTrue(message = "smart-agent.dispatcher.reserved-high-priority-workers must leave at least one shared worker")
    public boolean isReservedSliceSmallerThanPool() {
        return dispatcher.getReservedHighPriorityWorkers() < dispatcher.getWorkers();
    }

    @Data
    public static class Intake {
        @Positive
        private long maxImageBytes = 10_485_760L;

        @NotEmpty
        private List<String> allowedFormats = new ArrayList<>(List.of("jpeg", "png"));

        @Min(1)
        private int minWidth = 200;

        @Min(1)
        private int minHeight = 200;

        @Min(1)
        private int maxWidth = 2048;

        @Min(1)
        private int maxHeight = 2048;

        /** Upper bound on decoded width x height, checked from the image header before decoding. */
        @Positive
        private long maxPixels = 40_000_000L;

        @DecimalMin("0.1")
        @DecimalMax("1.0")
        private float jpegQuality = 0.85f;

        @NotNull
        private Duration dedupWindow = Duration.ofHours(24);
    }

    @Data
    public static class Ports {
        @Min(1)
        private int executorThreads = 16;

        @Valid
        private Recognition recognition = new Recognition();

        @Valid
        private Vision vision = new Vision();
    }

    @Data
    public static class Recognition {
        @NotBlank
        private String url = "http://localhost:8884/tesseract";

        private String languages = "eng+fil+msa";

        /** Tesseract word confidence cut-off, 0-100 scale. */
        private double wordConfidenceThreshold = 60;

        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        @Valid
        private RetrySettings retry = new RetrySettings();
    }

    @Data
    public static class Vision {
        @NotBlank
        private String url = "https://api.openai.com/v1/chat/completions";

        private String apiKey;

        @NotBlank
        private String model = "gpt-4o";

        @Positive
        private int maxTokens = 1500;

        @NotNull
        private Duration timeout = Duration.ofSeconds(45);

        @Valid
        private RetrySettings retry = new RetrySettings();
    }

    @Data
    public static class RetrySettings {
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration baseDelay = Duration.ofMillis(500);

        @NotNull
        private Duration maxDelay = Duration.ofSeconds(8);

        @DecimalMin("1.0")
        private double multiplier = 2.0;

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, baseDelay, maxDelay, multiplier);
        }
    }

    /**
     * Signal weights shared by fusion confidence and candidate scoring.
     */
    @Data
    public static class ScoringWeights {
        private double amount = 0.30;
        private double reference = 0.25;
        private double method = 0.20;
        private double timestamp = 0.15;
        private double imageQuality = 0.10;

        @AssertTrue(message = "scoring weights must sum to 1.0")
        public boolean isNormalized() {
            return Math.abs(amount + reference + method + timestamp + imageQuality - 1.0) < 1e-6;
        }
    }

    @Data
    public static class Fusion {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double singleSourceCeiling = 0.80;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double suggestThreshold = 0.60;

        private double corroborationBoost = 0.05;
        private double amountContradictionPenalty = 0.20;
        private double referenceContradictionPenalty = 0.10;

        @Min(1)
        private int maxDistinctAmounts = 3;

        @NotNull
        private Duration maxProofAge = Duration.ofDays(30);

        @NotNull
        private Duration futureSkew = Duration.ofMinutes(10);

        @NotNull
        private BigDecimal minAmount = new BigDecimal("1.00");

        @NotNull
        private BigDecimal maxAmount = new BigDecimal("100000.00");

        @NotBlank
        private String defaultCurrency = "PHP";

        @NotBlank
        private String zone = "Asia/Manila";
    }

    @Data
    public static class Matching {
        @NotNull
        private BigDecimal amountTolerance = new BigDecimal("0.01");

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double matchFloor = 0.60;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double autoApproveScore = 0.85;

        private double partialReferencePenalty = 0.25;

        @NotNull
        private Duration candidateWindow = Duration.ofDays(14);

        @NotNull
        private Duration timestampSkew = Duration.ofMinutes(10);
    }

    @Data
    public static class Decision {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double autoApprove = 0.90;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double conditional = 0.75;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double rejectFloor = 0.30;

        /** Reject when both recognizers agree on an amount that contradicts the referenced order. */
        private boolean rejectConfirmedMismatch = true;
    }

    @Data
    public static class Dispatcher {
        @Min(2)
        private int workers = 6;

        @Min(0)
        private int reservedHighPriorityWorkers = 2;

        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration retryBackoff = Duration.ofSeconds(5);

        @NotNull
        private Duration maxRetryBackoff = Duration.ofSeconds(60);

        @NotNull
        private Duration candidateLookupTimeout = Duration.ofSeconds(10);

        @NotNull
        private Duration emitTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration pollInterval = Duration.ofMillis(250);

        @NotNull
        private Duration shutdownGrace = Duration.ofSeconds(60);
    }

    @Data
    public static class Events {
        @NotBlank
        private String topic = "payment-verification-events";

        @NotBlank
        private String dlqSuffix = ".dlq";

        private List<String> alwaysNotify = new ArrayList<>(List.of("web"));

        @NotNull
        private Duration replayInterval = Duration.ofMinutes(1);
    }
}
