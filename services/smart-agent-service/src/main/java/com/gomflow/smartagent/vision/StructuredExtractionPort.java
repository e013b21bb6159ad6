package com.gomflow.smartagent.vision;

import com.gomflow.smartagent.intake.PreparedImage;

/**
 * Vision-language model asked to read payment fields off a proof image.
 *
 * Implementations retry on their own and throw
 * {@link com.gomflow.smartagent.exception.ExtractionUnavailableException} once they give up.
 */
public interface StructuredExtractionPort {

    VisionExtraction extractStructured(PreparedImage image, ExtractionTaskHint taskHint);
}
