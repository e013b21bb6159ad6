package com.gomflow.smartagent.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The dispatcher stopped accepting work, typically during shutdown.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class IntakeUnavailableException extends SmartAgentException {

    public IntakeUnavailableException(String message) {
        super(message);
    }
}
