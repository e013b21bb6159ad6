package com.gomflow.smartagent.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Channel a payment proof was uploaded through.
 */
public enum SourcePlatform {
    WHATSAPP("whatsapp"),
    TELEGRAM("telegram"),
    DISCORD("discord"),
    WEB("web");

    private final String value;

    SourcePlatform(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static SourcePlatform fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Source platform is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(platform -> platform.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported source platform: " + value));
    }
}
