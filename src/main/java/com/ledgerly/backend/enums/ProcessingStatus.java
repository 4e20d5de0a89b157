package com.ledgerly.backend.enums;

public enum ProcessingStatus {
    COMPLETED,
    FAILED
}
