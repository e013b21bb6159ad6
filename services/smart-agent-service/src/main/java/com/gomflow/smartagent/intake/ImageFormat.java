package com.gomflow.smartagent.intake;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Upload formats recognised by their leading magic bytes.
 */
public enum ImageFormat {
    JPEG("jpeg", new int[]{0xFF, 0xD8, 0xFF}),
    PNG("png", new int[]{0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A}),
    WEBP("webp", new int[]{0x52, 0x49, 0x46, 0x46});

    private final String value;
    private final int[] signature;

    ImageFormat(String value, int[] signature) {
        this.value = value;
        this.signature = signature;
    }

    public String getValue() {
        return value;
    }

    public static Optional<ImageFormat> detect(byte[] bytes) {
        if (bytes == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(format -> format.matches(bytes))
                .findFirst();
    }

    public static Optional<ImageFormat> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("jpg".equals(normalized)) {
            return Optional.of(JPEG);
        }
        return Arrays.stream(values())
                .filter(format -> format.value.equals(normalized))
                .findFirst();
    }

    private boolean matches(byte[] bytes) {
        if (bytes.length < signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if ((bytes[i] & 0xFF) != signature[i]) {
                return false;
            }
        }
        if (this == WEBP) {
            // RIFF container, WEBP fourcc at offset 8
            return bytes.length >= 12 && bytes[8] == 'W' && bytes[9] == 'E' && bytes[10] == 'B' && bytes[11] == 'P';
        }
        return true;
    }
}
