package com.gomflow.smartagent.recognition;

import com.gomflow.smartagent.config.SmartAgentProperties;
import com.gomflow.smartagent.domain.PaymentMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based parsing of payment facts from OCR text: amounts, reference codes and the
 * wallet or bank named on the receipt.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OcrPaymentParser {

    static final int MAX_RESULTS = 5;

    private static final String NUMBER = "(\\d{1,3}(?:,\\d{3})+(?:\\.\\d{1,2})?|\\d+(?:\\.\\d{1,2})?)";

    private static final Pattern CURRENCY_AMOUNT = Pattern.compile(
            "(?<![A-Za-z])(₱|PHP|Php|RM|MYR)\\s?" + NUMBER + "(?![\\d,])");

    private static final Pattern LABELLED_AMOUNT = Pattern.compile(
            "(?i)\\b(?:total\\s+)?(?:amount|amt|total)(?:\\s+(?:paid|sent|transferred))?\\s*[:\\-]?\\s*"
                    + "(₱|PHP|RM|MYR)?\\s?" + NUMBER + "(?![\\d,])");

    private static final Pattern PLAIN_NUMBER = Pattern.compile(
            "(?<![A-Za-z0-9.,\\-])" + NUMBER + "(?![A-Za-z0-9\\-]|[.,]\\d)");

    private static final List<Pattern> REFERENCE_PATTERNS = List.of(
            Pattern.compile("(?i:\\b(?:ref(?:erence)?|txn|transaction)(?:\\s*(?:no\\.?|number|id|#))?)\\s*[:#]?\\s*"
                    + "((?=[A-Za-z0-9\\-]*\\d)[A-Za-z0-9][A-Za-z0-9\\-]{7,19})"),
            Pattern.compile("\\b([A-Z]{2,3}-[A-Z0-9]{6,12})\\b"));

    private final SmartAgentProperties properties;

    public OcrFindings parse(OcrResult ocr) {
        if (ocr == null || ocr.isBlank()) {
            return OcrFindings.empty();
        }
        String text = ocr.text();

        List<PaymentMethod> methods = PaymentMethod.identifyAll(text);
        String methodCurrency = methods.isEmpty() ? null : methods.get(0).homeCurrency().orElse(null);

        List<OcrFindings.OcrAmount> amounts = extractAmounts(text, methodCurrency);
        List<BigDecimal> numbers = extractNumbers(text);
        List<String> references = extractReferences(text);

        log.debug("Parsed OCR text: amounts={}, references={}, methods={}",
                amounts.size(), references.size(), methods.size());

        return new OcrFindings(
                amounts,
                numbers,
                references,
                methods.size() > MAX_RESULTS ? methods.subList(0, MAX_RESULTS) : methods,
                text.replaceAll("\\s+", "").toUpperCase(Locale.ROOT));
    }

    private List<OcrFindings.OcrAmount> extractAmounts(String text, String methodCurrency) {
        Set<OcrFindings.OcrAmount> found = new LinkedHashSet<>();
        collectAmounts(CURRENCY_AMOUNT.matcher(text), methodCurrency, found);
        collectAmounts(LABELLED_AMOUNT.matcher(text), methodCurrency, found);
        return limit(new ArrayList<>(found));
    }

    private void collectAmounts(Matcher matcher, String fallbackCurrency, Set<OcrFindings.OcrAmount> found) {
        while (matcher.find()) {
            BigDecimal amount = toAmount(matcher.group(2));
            if (amount == null || !withinBounds(amount)) {
                continue;
            }
            String currency = currencyFor(matcher.group(1));
            found.add(new OcrFindings.OcrAmount(amount, currency != null ? currency : fallbackCurrency));
        }
    }

    private List<BigDecimal> extractNumbers(String text) {
        Set<BigDecimal> numbers = new LinkedHashSet<>();
        Matcher matcher = PLAIN_NUMBER.matcher(text);
        while (matcher.find()) {
            BigDecimal number = toAmount(matcher.group(1));
            if (number != null && withinBounds(number)) {
                numbers.add(number);
            }
        }
        return new ArrayList<>(numbers);
    }

    private List<String> extractReferences(String text) {
        Set<String> references = new LinkedHashSet<>();
        for (Pattern pattern : REFERENCE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                references.add(matcher.group(1).toUpperCase(Locale.ROOT));
            }
        }
        return limit(new ArrayList<>(references));
    }

    private boolean withinBounds(BigDecimal amount) {
        SmartAgentProperties.Fusion fusion = properties.getFusion();
        return amount.compareTo(fusion.getMinAmount()) >= 0 && amount.compareTo(fusion.getMaxAmount()) <= 0;
    }

    static BigDecimal toAmount(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(raw.replace(",", "").trim()).setScale(2, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String currencyFor(String symbol) {
        if (symbol == null) {
            return null;
        }
        switch (symbol.toUpperCase(Locale.ROOT)) {
            case "₱":
            case "PHP":
                return "PHP";
            case "RM":
            case "MYR":
                return "MYR";
            default:
                return null;
        }
    }

    private static <T> List<T> limit(List<T> values) {
        return values.size() > MAX_RESULTS ? new ArrayList<>(values.subList(0, MAX_RESULTS)) : values;
    }
}
