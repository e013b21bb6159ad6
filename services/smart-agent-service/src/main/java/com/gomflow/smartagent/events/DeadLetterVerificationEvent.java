package com.gomflow.smartagent.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterVerificationEvent {

    private VerificationEvent originalEvent;
    private String originalTopic;
    private String errorMessage;
    private Instant failureTimestamp;
}
