package com.gomflow.smartagent.intake;

import java.util.Base64;

/**
 * Validated, normalised upload. {@code normalizedBytes} is an RGB JPEG sent to the vision
 * model; {@code recognitionBytes} is a grayscale, contrast-stretched JPEG for OCR.
 */
public record PreparedImage(
        byte[] normalizedBytes,
        byte[] recognitionBytes,
        int width,
        int height,
        ImageFormat originalFormat,
        String fingerprint,
        long originalSize
) {

    public String normalizedBase64() {
        return Base64.getEncoder().encodeToString(normalizedBytes);
    }

    public String recognitionBase64() {
        return Base64.getEncoder().encodeToString(recognitionBytes);
    }

    @Override
    public String toString() {
        return "PreparedImage{" + width + "x" + height + ", format=" + originalFormat
                + ", fingerprint=" + fingerprint + ", originalSize=" + originalSize + "}";
    }
}
