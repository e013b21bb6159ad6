package com.gomflow.smartagent.dto;

public enum ReviewAction {
    APPROVE,
    REJECT,
    MODIFY
}
