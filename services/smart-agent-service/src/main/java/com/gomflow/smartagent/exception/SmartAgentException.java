package com.gomflow.smartagent.exception;

/**
 * Base exception for smart agent errors
 */
public class SmartAgentException extends RuntimeException {

    public SmartAgentException(String message) {
        super(message);
    }

    public SmartAgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
