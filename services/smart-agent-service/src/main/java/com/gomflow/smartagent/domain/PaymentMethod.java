package com.gomflow.smartagent.domain;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * E-wallets and banks recognised on payment proofs, with the keywords that identify them
 * and the currencies they settle in.
 */
public enum PaymentMethod {
    GCASH("gcash", Set.of("PHP"), List.of("gcash", "g-cash", "globe cash", "globe gcash")),
    PAYMAYA("paymaya", Set.of("PHP"), List.of("paymaya", "pay maya", "maya")),
    BPI("bpi", Set.of("PHP"), List.of("bpi", "bank of the philippine islands")),
    BDO("bdo", Set.of("PHP"), List.of("bdo", "banco de oro")),
    METROBANK("metrobank", Set.of("PHP"), List.of("metrobank", "metro bank")),
    MAYBANK("maybank", Set.of("MYR"), List.of("maybank", "maybank2u", "m2u")),
    CIMB("cimb", Set.of("MYR"), List.of("cimb", "cimb bank", "cimb clicks")),
    TOUCH_N_GO("tng", Set.of("MYR"), List.of("touch n go", "touch 'n go", "touchngo", "tng ewallet", "tng")),
    BOOST("boost", Set.of("MYR"), List.of("boost")),
    GRABPAY("grabpay", Set.of("PHP", "MYR"), List.of("grabpay", "grab pay"));

    private final String code;
    private final Set<String> currencies;
    private final List<String> keywords;
    private final List<Pattern> keywordPatterns;

    PaymentMethod(String code, Set<String> currencies, List<String> keywords) {
        this.code = code;
        this.currencies = currencies;
        this.keywords = keywords;
        this.keywordPatterns = keywords.stream()
                .map(keyword -> Pattern.compile("(?<![a-z0-9])" + Pattern.quote(keyword) + "(?![a-z0-9])"))
                .toList();
    }

    public String getCode() {
        return code;
    }

    public Set<String> getCurrencies() {
        return currencies;
    }

    public boolean settlesIn(String currency) {
        return currency != null && currencies.contains(currency.toUpperCase(Locale.ROOT));
    }

    /**
     * Home currency when the method settles in exactly one.
     */
    public Optional<String> homeCurrency() {
        return currencies.size() == 1 ? Optional.of(currencies.iterator().next()) : Optional.empty();
    }

    public boolean mentionedIn(String lowerCaseText) {
        return matchedKeywordLength(lowerCaseText) > 0;
    }

    private int matchedKeywordLength(String lowerCaseText) {
        int longest = 0;
        for (int i = 0; i < keywordPatterns.size(); i++) {
            if (keywordPatterns.get(i).matcher(lowerCaseText).find()) {
                longest = Math.max(longest, keywords.get(i).length());
            }
        }
        return longest;
    }

    /**
     * Finds the method named in free text, preferring the most specific keyword.
     */
    public static Optional<PaymentMethod> identify(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(method -> method.mentionedIn(lower))
                .max(Comparator.comparingInt(method -> method.matchedKeywordLength(lower)));
    }

    /**
     * All methods named in free text, in declaration order.
     */
    public static List<PaymentMethod> identifyAll(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(method -> method.mentionedIn(lower))
                .toList();
    }

    public static Optional<PaymentMethod> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(method -> method.code.equals(normalized))
                .findFirst()
                .or(() -> identify(code));
    }
}
