package com.gomflow.smartagent.domain;

import java.util.Arrays;
import java.util.Locale;

public enum JobPriority {
    HIGH,
    NORMAL,
    LOW;

    /**
     * Lenient parse for caller-supplied values; anything unrecognised is NORMAL.
     */
    public static JobPriority fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(priority -> priority.name().equals(normalized))
                .findFirst()
                .orElse(NORMAL);
    }
}
