package com.gomflow.smartagent.exception;

public class ProcessingTimeoutException extends SmartAgentException {

    public ProcessingTimeoutException(String message) {
        super(message);
    }

    public ProcessingTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
