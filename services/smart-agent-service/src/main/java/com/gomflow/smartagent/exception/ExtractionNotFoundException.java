package com.gomflow.smartagent.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ExtractionNotFoundException extends SmartAgentException {

    public ExtractionNotFoundException(UUID extractionId) {
        super("Extraction not found: " + extractionId);
    }
}
