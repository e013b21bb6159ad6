package com.gomflow.smartagent.recognition;

import java.util.List;

/**
 * Text read from an image. Confidences are normalised to [0, 1].
 */
public record OcrResult(
        String text,
        double confidence,
        List<Word> words,
        List<Block> blocks,
        String language
) {

    public OcrResult {
        text = text != null ? text : "";
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        words = words != null ? List.copyOf(words) : List.of();
        blocks = blocks != null ? List.copyOf(blocks) : List.of();
    }

    public static OcrResult empty(String language) {
        return new OcrResult("", 0.0, List.of(), List.of(), language);
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    public record Word(String text, double confidence, BoundingBox bbox) {
    }

    public record Block(String text, double confidence, BoundingBox bbox) {
    }

    public record BoundingBox(int x0, int y0, int x1, int y1) {
    }
}
