package com.gomflow.smartagent.exception;

public class RecognitionUnavailableException extends SmartAgentException {

    public RecognitionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
