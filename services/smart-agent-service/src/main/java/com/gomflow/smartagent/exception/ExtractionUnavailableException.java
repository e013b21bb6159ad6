package com.gomflow.smartagent.exception;

public class ExtractionUnavailableException extends SmartAgentException {

    public ExtractionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
