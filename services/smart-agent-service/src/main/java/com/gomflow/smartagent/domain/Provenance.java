package com.gomflow.smartagent.domain;

public enum Provenance {
    OCR,
    VISION,
    COMBINED
}
