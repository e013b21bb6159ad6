package com.gomflow.smartagent.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The order store refused a claim because a competing decision got to the submission first.
 */
@Getter
@ResponseStatus(HttpStatus.CONFLICT)
public class ConcurrentClaimConflictException extends SmartAgentException {

    private final String candidateId;

    public ConcurrentClaimConflictException(String candidateId, Throwable cause) {
        super("Submission " + candidateId + " was already claimed", cause);
        this.candidateId = candidateId;
    }
}
