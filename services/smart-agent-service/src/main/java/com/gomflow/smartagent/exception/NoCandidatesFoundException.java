package com.gomflow.smartagent.exception;

/**
 * No pending submission fits the extracted payment. Routed to manual review, never surfaced.
 */
public class NoCandidatesFoundException extends SmartAgentException {

    public NoCandidatesFoundException(String message) {
        super(message);
    }
}
