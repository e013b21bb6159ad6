package com.gomflow.smartagent.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidReviewRequestException extends SmartAgentException {

    public InvalidReviewRequestException(String message) {
        super(message);
    }
}
