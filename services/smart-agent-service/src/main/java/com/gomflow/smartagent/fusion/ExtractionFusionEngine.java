package com.gomflow.smartagent.fusion;

import com.gomflow.smartagent.config.SmartAgentProperties;
import com.gomflow.smartagent.domain.ExtractedPayment;
import com.gomflow.smartagent.domain.ExtractionFlag;
import com.gomflow.smartagent.domain.PaymentExtraction;
import com.gomflow.smartagent.domain.PaymentMethod;
import com.gomflow.smartagent.domain.ProcessingJob;
import com.gomflow.smartagent.domain.Provenance;
import com.gomflow.smartagent.domain.SubmissionContext;
import com.gomflow.smartagent.port.PortOutcome;
import com.gomflow.smartagent.recognition.OcrFindings;
import com.gomflow.smartagent.recognition.OcrPaymentParser;
import com.gomflow.smartagent.recognition.OcrResult;
import com.gomflow.smartagent.vision.VisionExtraction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Merges the recognition and vision results into one {@link PaymentExtraction}.
 *
 * The vision model's typed fields lead; OCR text corroborates or contradicts them. When only
 * one source produced an amount the result is capped below the auto-approve threshold and
 * flagged for review. Fusion never fails: with nothing readable it records a zero-confidence
 * extraction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExtractionFusionEngine {

    private static final Pattern REFERENCE_FORMAT = Pattern.compile("^(?=.*\\d)[A-Z0-9][A-Z0-9\\-]{5,29}$");

    private final OcrPaymentParser ocrPaymentParser;
    private final SmartAgentProperties properties;
    private final Clock clock;

    public PaymentExtraction fuse(ProcessingJob job, ExtractionOutcomes outcomes, long processingTimeMs) {
        SmartAgentProperties.Fusion settings = properties.getFusion();
        Set<ExtractionFlag> flags = EnumSet.noneOf(ExtractionFlag.class);
        recordPortFlags(outcomes, flags);

        OcrResult ocr = outcomes.recognition().getValue().orElse(null);
        VisionExtraction vision = outcomes.extraction().getValue().orElse(null);
        OcrFindings findings = ocr != null ? ocrPaymentParser.parse(ocr) : OcrFindings.empty();

        String fallbackCurrency = job.context()
                .map(SubmissionContext::currency)
                .filter(currency -> !currency.isBlank())
                .map(currency -> currency.toUpperCase(Locale.ROOT))
                .orElse(settings.getDefaultCurrency());

        ExtractedPayment visionPayment = vision != null ? fromVision(vision, fallbackCurrency) : null;
        List<ExtractedPayment> ocrPayments = ocr != null ? fromOcr(ocr, findings, fallbackCurrency) : List.of();
        double legibility = ocr != null ? ocr.confidence() : vision != null ? vision.confidence() * 0.5 : 0.0;

        ExtractedPayment primary;
        boolean corroborationAvailable;
        if (visionPayment != null) {
            primary = visionPayment;
            corroborationAvailable = ocr != null;
        } else if (!ocrPayments.isEmpty()) {
            primary = ocrPayments.get(0);
            corroborationAvailable = false;
        } else {
            return noData(job, outcomes, flags, legibility, processingTimeMs);
        }

        double confidence = signalsFor(primary, legibility).weighted(properties.getWeights());
        if (corroborationAvailable) {
            confidence += corroborate(primary, findings, flags);
        } else {
            flags.add(ExtractionFlag.SINGLE_SOURCE);
        }
        confidence = clamp(confidence);
        if (flags.contains(ExtractionFlag.SINGLE_SOURCE)) {
            confidence = Math.min(confidence, settings.getSingleSourceCeiling());
        }

        Provenance provenance = flags.contains(ExtractionFlag.AMOUNT_CORROBORATED) ? Provenance.COMBINED
                : primary.provenance();
        primary = primary.withConfidence(confidence, provenance);

        List<ExtractedPayment> candidates = rankCandidates(primary, ocrPayments);
        if (candidates.size() > settings.getMaxDistinctAmounts()) {
            flags.add(ExtractionFlag.MULTIPLE_AMOUNTS);
        }

        boolean requiresReview = confidence < settings.getSuggestThreshold()
                || flags.stream().anyMatch(ExtractionFlag::isReviewForcing);

        log.info("Fused extraction {}: amount={} {}, method={}, confidence={}, flags={}, requiresReview={}",
                job.extractionId(), primary.amount(), primary.currency(), primary.method(),
                String.format("%.3f", confidence), flags, requiresReview);

        return PaymentExtraction.builder()
                .id(job.extractionId())
                .jobId(job.id())
                .fingerprint(job.image().fingerprint())
                .sourcePlatform(job.sourcePlatform())
                .ocr(outcomes.recognition().getRawValue().orElse(null))
                .vision(outcomes.extraction().getRawValue().orElse(null))
                .candidates(candidates)
                .overallConfidence(confidence)
                .imageQuality(clamp(legibility))
                .requiresReview(requiresReview)
                .flags(flags)
                .primaryCurrency(primary.currency())
                .primaryMethod(primary.method())
                .processingTimeMs(processingTimeMs)
                .createdAt(clock.instant())
                .build();
    }

    private void recordPortFlags(ExtractionOutcomes outcomes, Set<ExtractionFlag> flags) {
        PortOutcome<OcrResult> recognition = outcomes.recognition();
        PortOutcome<VisionExtraction> extraction = outcomes.extraction();
        if (recognition.isDegraded()) {
            flags.add(ExtractionFlag.OCR_DEGRADED);
        } else if (recognition.isUnavailable()) {
            flags.add(ExtractionFlag.OCR_UNAVAILABLE);
        }
        if (extraction.isDegraded()) {
            flags.add(ExtractionFlag.VISION_DEGRADED);
        } else if (extraction.isUnavailable()) {
            flags.add(ExtractionFlag.VISION_UNAVAILABLE);
        }
        extraction.getValue()
                .filter(VisionExtraction::fallbackParsed)
                .ifPresent(vision -> flags.add(ExtractionFlag.VISION_FALLBACK_PARSE));
    }

    private PaymentExtraction noData(ProcessingJob job, ExtractionOutcomes outcomes, Set<ExtractionFlag> flags,
                                     double legibility, long processingTimeMs) {
        flags.add(ExtractionFlag.NO_DATA_EXTRACTED);
        log.warn("No payment data extracted for {}: recognition={}, extraction={}",
                job.extractionId(), outcomes.recognition(), outcomes.extraction());

        return PaymentExtraction.builder()
                .id(job.extractionId())
                .jobId(job.id())
                .fingerprint(job.image().fingerprint())
                .sourcePlatform(job.sourcePlatform())
                .ocr(outcomes.recognition().getRawValue().orElse(null))
                .vision(outcomes.extraction().getRawValue().orElse(null))
                .candidates(new ArrayList<>())
                .overallConfidence(0.0)
                .imageQuality(clamp(legibility))
                .requiresReview(true)
                .flags(flags)
                .processingTimeMs(processingTimeMs)
                .createdAt(clock.instant())
                .build();
    }

    private ExtractedPayment fromVision(VisionExtraction vision, String fallbackCurrency) {
        VisionExtraction.Fields fields = vision.fields();
        if (fields.amount() == null || !withinBounds(fields.amount())) {
            return null;
        }

        Optional<PaymentMethod> method = PaymentMethod.identify(fields.method())
                .or(() -> PaymentMethod.identify(fields.bankName()));
        String currency = firstNonBlank(
                fields.currency(),
                method.flatMap(PaymentMethod::homeCurrency).orElse(null),
                fallbackCurrency);

        return new ExtractedPayment(
                fields.amount(),
                currency,
                method.map(PaymentMethod::getCode).orElse(blankToNull(fields.method())),
                blankToNull(fields.sender()),
                blankToNull(fields.recipient()),
                normalizeReference(fields.reference()),
                TimestampParser.parse(fields.timestamp(), zone()).orElse(null),
                vision.confidence(),
                Provenance.VISION);
    }

    private List<ExtractedPayment> fromOcr(OcrResult ocr, OcrFindings findings, String fallbackCurrency) {
        Optional<PaymentMethod> method = findings.primaryMethod();
        String reference = findings.references().isEmpty() ? null : findings.references().get(0);
        String methodCurrency = method.flatMap(PaymentMethod::homeCurrency).orElse(null);

        List<ExtractedPayment> payments = new ArrayList<>();
        for (OcrFindings.OcrAmount amount : findings.amounts()) {
            payments.add(new ExtractedPayment(
                    amount.amount(),
                    firstNonBlank(amount.currency(), methodCurrency, fallbackCurrency),
                    method.map(PaymentMethod::getCode).orElse(null),
                    null,
                    null,
                    reference,
                    null,
                    ocr.confidence(),
                    Provenance.OCR));
        }
        return payments;
    }

    ConfidenceSignals signalsFor(ExtractedPayment payment, double legibility) {
        return new ConfidenceSignals(
                amountPrecision(payment.amount()),
                referenceValidity(payment.reference()),
                methodIdentifiability(payment.method()),
                timestampPlausibility(payment.timestamp()),
                clamp(legibility));
    }

    private double corroborate(ExtractedPayment primary, OcrFindings findings, Set<ExtractionFlag> flags) {
        SmartAgentProperties.Fusion settings = properties.getFusion();
        double adjustment = 0.0;

        if (primary.reference() != null) {
            if (findings.containsReference(primary.reference())) {
                adjustment += settings.getCorroborationBoost();
                flags.add(ExtractionFlag.REFERENCE_CORROBORATED);
            } else if (!findings.references().isEmpty()) {
                adjustment -= settings.getReferenceContradictionPenalty();
                flags.add(ExtractionFlag.REFERENCE_CONTRADICTION);
            }
        }

        if (findings.containsAmount(primary.amount())) {
            adjustment += settings.getCorroborationBoost();
            flags.add(ExtractionFlag.AMOUNT_CORROBORATED);
        } else if (!findings.amounts().isEmpty()) {
            adjustment -= settings.getAmountContradictionPenalty();
            flags.add(ExtractionFlag.AMOUNT_CONTRADICTION);
        }
        return adjustment;
    }

    /**
     * Candidates keyed on amount and currency, keeping the most confident reading of each.
     * The primary reading always leads.
     */
    private List<ExtractedPayment> rankCandidates(ExtractedPayment primary, List<ExtractedPayment> ocrPayments) {
        Map<String, ExtractedPayment> byKey = new LinkedHashMap<>();
        String primaryKey = candidateKey(primary);
        for (ExtractedPayment payment : ocrPayments) {
            String key = candidateKey(payment);
            if (key.equals(primaryKey)) {
                continue;
            }
            byKey.merge(key, payment, (existing, incoming) ->
                    incoming.confidence() > existing.confidence() ? incoming : existing);
        }

        List<ExtractedPayment> ranked = new ArrayList<>();
        ranked.add(primary);
        byKey.values().stream()
                .sorted(Comparator.comparingDouble(ExtractedPayment::confidence).reversed())
                .forEach(ranked::add);
        return ranked;
    }

    private static String candidateKey(ExtractedPayment payment) {
        return payment.amount().setScale(2, RoundingMode.HALF_UP).toPlainString() + "_" + payment.currency();
    }

    private double amountPrecision(BigDecimal amount) {
        if (amount == null || !withinBounds(amount)) {
            return 0.0;
        }
        return amount.stripTrailingZeros().scale() <= 2 ? 1.0 : 0.5;
    }

    private static double referenceValidity(String reference) {
        if (reference == null || reference.isBlank()) {
            return 0.0;
        }
        return REFERENCE_FORMAT.matcher(reference).matches() ? 1.0 : 0.5;
    }

    private static double methodIdentifiability(String method) {
        if (method == null || method.isBlank()) {
            return 0.0;
        }
        return PaymentMethod.fromCode(method).isPresent() ? 1.0 : 0.5;
    }

    private double timestampPlausibility(Instant timestamp) {
        if (timestamp == null) {
            return 0.5;
        }
        SmartAgentProperties.Fusion settings = properties.getFusion();
        Instant now = clock.instant();
        if (timestamp.isAfter(now.plus(settings.getFutureSkew()))) {
            return 0.0;
        }
        if (timestamp.isBefore(now.minus(settings.getMaxProofAge()))) {
            return 0.0;
        }
        return 1.0;
    }

    private boolean withinBounds(BigDecimal amount) {
        SmartAgentProperties.Fusion settings = properties.getFusion();
        return amount.compareTo(settings.getMinAmount()) >= 0 && amount.compareTo(settings.getMaxAmount()) <= 0;
    }

    private ZoneId zone() {
        return ZoneId.of(properties.getFusion().getZone());
    }

    private static String normalizeReference(String reference) {
        if (reference == null || reference.isBlank()) {
            return null;
        }
        return reference.trim().replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.toUpperCase(Locale.ROOT);
            }
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
