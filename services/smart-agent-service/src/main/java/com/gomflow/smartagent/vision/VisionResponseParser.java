package com.gomflow.smartagent.vision;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the model's chat answer into a {@link VisionExtraction}.
 *
 * The model is asked for JSON but does not always comply, so a labelled-line fallback reads
 * free text answers; those get a fixed confidence of {@value #FALLBACK_CONFIDENCE}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VisionResponseParser {

    static final double FALLBACK_CONFIDENCE = 0.6;
    static final double DEFAULT_CONFIDENCE = 0.8;

    private static final Pattern METHOD = Pattern.compile("(?i)payment method[:\\s]*([^\\n,]+)");
    private static final Pattern AMOUNT = Pattern.compile("(?i)amount[:\\s]*(?:₱|PHP|RM|MYR)?\\s?(\\d+(?:,\\d{3})*(?:\\.\\d{1,2})?)");
    private static final Pattern SENDER = Pattern.compile("(?i)sender[:\\s]*([^\\n,]+)");
    private static final Pattern RECIPIENT = Pattern.compile("(?i)recipient[:\\s]*([^\\n,]+)");
    private static final Pattern TRANSACTION_ID = Pattern.compile("(?i)transaction\\s?id[:\\s]*([^\\n,\\s]+)");
    private static final Pattern REFERENCE = Pattern.compile("(?i)reference(?:\\s+number)?[:\\s]*([^\\n,\\s]+)");
    private static final Pattern TIMESTAMP = Pattern.compile("(?i)\\b(?:timestamp|date)[:\\s]*([^\\n]+)");

    private final ObjectMapper objectMapper;

    public VisionExtraction parse(String content, String modelId) {
        if (content == null || content.isBlank()) {
            return new VisionExtraction("", VisionExtraction.Fields.empty(), 0.0, "Empty model answer", modelId, false);
        }

        String json = extractJsonObject(content);
        if (json != null) {
            try {
                return fromJson(objectMapper.readTree(json), content, modelId);
            } catch (JsonProcessingException e) {
                log.warn("Vision answer looked like JSON but did not parse, falling back to text parsing: {}",
                        e.getOriginalMessage());
            }
        } else {
            log.warn("Vision answer not in JSON format, parsing manually");
        }
        return fromText(content, modelId);
    }

    private VisionExtraction fromJson(JsonNode node, String content, String modelId) {
        String reference = firstText(node, "referenceNumber", "transactionId", "reference");
        VisionExtraction.Fields fields = new VisionExtraction.Fields(
                firstText(node, "paymentMethod", "method"),
                amountOf(node.path("amount")),
                normalizeCurrency(firstText(node, "currency")),
                firstText(node, "senderInfo", "sender"),
                firstText(node, "recipientInfo", "recipient"),
                reference,
                firstText(node, "timestamp"),
                firstText(node, "bankName"));

        double confidence = node.hasNonNull("confidence")
                ? normalizeConfidence(node.path("confidence").asDouble(DEFAULT_CONFIDENCE))
                : DEFAULT_CONFIDENCE;
        String rationale = firstText(node, "reasoning", "rationale");

        return new VisionExtraction(content, fields, confidence,
                rationale != null ? rationale : "AI analysis completed", modelId, false);
    }

    private VisionExtraction fromText(String content, String modelId) {
        String transactionId = group(TRANSACTION_ID, content);
        String reference = group(REFERENCE, content);

        VisionExtraction.Fields fields = new VisionExtraction.Fields(
                group(METHOD, content),
                parseAmount(group(AMOUNT, content)),
                currencyMentionedIn(content),
                group(SENDER, content),
                group(RECIPIENT, content),
                reference != null ? reference : transactionId,
                group(TIMESTAMP, content),
                null);

        return new VisionExtraction(content, fields, FALLBACK_CONFIDENCE,
                "Manual parsing of AI response", modelId, true);
    }

    /**
     * Strips markdown fences and surrounding prose, keeping the outermost object.
     */
    static String extractJsonObject(String content) {
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return content.substring(start, end + 1);
    }

    private static String firstText(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                String text = value.asText().trim();
                if (!text.isEmpty() && !"null".equalsIgnoreCase(text)) {
                    return text;
                }
            }
        }
        return null;
    }

    private static BigDecimal amountOf(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        return parseAmount(node.asText().replaceAll("[^0-9.,]", ""));
    }

    static BigDecimal parseAmount(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(raw.replace(",", ""));
        } catch (NumberFormatException e) {
            log.debug("Unparseable amount in vision answer: {}", raw);
            return null;
        }
    }

    static String normalizeCurrency(String raw) {
        if (raw == null) {
            return null;
        }
        String upper = raw.trim().toUpperCase(Locale.ROOT);
        if (upper.contains("₱") || upper.contains("PHP") || upper.contains("PESO")) {
            return "PHP";
        }
        if (upper.equals("RM") || upper.contains("MYR") || upper.contains("RINGGIT")) {
            return "MYR";
        }
        return upper.length() == 3 ? upper : null;
    }

    private static String currencyMentionedIn(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        if (content.contains("₱") || lower.contains("php") || lower.contains("peso")) {
            return "PHP";
        }
        if (content.contains("RM") || lower.contains("myr") || lower.contains("ringgit")) {
            return "MYR";
        }
        return null;
    }

    /**
     * Models answer on either a 0-1 or a 0-100 scale.
     */
    private static double normalizeConfidence(double value) {
        double normalized = value > 1.0 ? value / 100.0 : value;
        return Math.max(0.0, Math.min(1.0, normalized));
    }

    private static String group(Pattern pattern, String content) {
        Matcher matcher = pattern.matcher(content);
        if (!matcher.find()) {
            return null;
        }
        String value = matcher.group(1).trim();
        return value.isEmpty() ? null : value;
    }
}
