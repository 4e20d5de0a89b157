package com.ledgerly.backend.enums;

public enum ExtractionMethod {
    DETERMINISTIC("deterministic"),
    AI_ASSISTED("ai-assisted"),
    HYBRID("hybrid");

    private final String code;

    ExtractionMethod(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
