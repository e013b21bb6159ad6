package com.gomflow.smartagent.recognition;

import com.gomflow.smartagent.domain.PaymentMethod;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Payment facts parsed out of raw OCR text.
 *
 * {@code amounts} holds currency-tagged or labelled amounts; {@code numbers} holds every
 * plain number seen, used only to corroborate a figure read elsewhere.
 */
public record OcrFindings(
        List<OcrAmount> amounts,
        List<BigDecimal> numbers,
        List<String> references,
        List<PaymentMethod> methods,
        String normalizedText
) {

    public static OcrFindings empty() {
        return new OcrFindings(List.of(), List.of(), List.of(), List.of(), "");
    }

    public boolean isEmpty() {
        return amounts.isEmpty() && references.isEmpty() && methods.isEmpty();
    }

    /**
     * Checks the tagged amounts when OCR found any; plain numbers count only when it found none,
     * so a balance or fee line cannot corroborate a figure the tagged amount disagrees with.
     */
    public boolean containsAmount(BigDecimal amount) {
        if (amount == null) {
            return false;
        }
        if (!amounts.isEmpty()) {
            return amounts.stream().anyMatch(found -> found.amount().compareTo(amount) == 0);
        }
        return numbers.stream().anyMatch(number -> number.compareTo(amount) == 0);
    }

    /**
     * True when the reference appears anywhere in the text, ignoring case and whitespace.
     */
    public boolean containsReference(String reference) {
        if (reference == null || reference.isBlank()) {
            return false;
        }
        String needle = reference.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        return normalizedText.contains(needle);
    }

    public Optional<PaymentMethod> primaryMethod() {
        return methods.isEmpty() ? Optional.empty() : Optional.of(methods.get(0));
    }

    public record OcrAmount(BigDecimal amount, String currency) {
    }
}
