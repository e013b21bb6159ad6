package com.gomflow.smartagent.recognition;

import com.gomflow.smartagent.intake.PreparedImage;

/**
 * Optical character recognition over a prepared proof image.
 *
 * Implementations retry on their own and throw
 * {@link com.gomflow.smartagent.exception.RecognitionUnavailableException} once they give up.
 */
public interface RecognitionPort {

    OcrResult extractText(PreparedImage image);
}
