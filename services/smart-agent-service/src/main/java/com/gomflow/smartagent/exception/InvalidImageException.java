package com.gomflow.smartagent.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Uploaded image was rejected at intake. The caller has to re-submit.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidImageException extends SmartAgentException {

    public InvalidImageException(String message) {
        super(message);
    }

    public InvalidImageException(String message, Throwable cause) {
        super(message, cause);
    }
}
