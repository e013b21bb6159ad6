package com.gomflow.smartagent.domain;

/**
 * Facts fusion records about how an extraction was produced. Review-forcing flags always
 * route the extraction to a human, whatever its confidence.
 */
public enum ExtractionFlag {
    NO_DATA_EXTRACTED(true),
    SINGLE_SOURCE(true),
    AMOUNT_CONTRADICTION(true),
    REFERENCE_CONTRADICTION(true),
    MULTIPLE_AMOUNTS(true),
    AMOUNT_CORROBORATED(false),
    REFERENCE_CORROBORATED(false),
    OCR_DEGRADED(false),
    OCR_UNAVAILABLE(false),
    VISION_DEGRADED(false),
    VISION_UNAVAILABLE(false),
    VISION_FALLBACK_PARSE(false);

    private final boolean reviewForcing;

    ExtractionFlag(boolean reviewForcing) {
        this.reviewForcing = reviewForcing;
    }

    public boolean isReviewForcing() {
        return reviewForcing;
    }
}
