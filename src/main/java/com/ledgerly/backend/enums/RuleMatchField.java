package com.ledgerly.backend.enums;

public enum RuleMatchField {
    DESCRIPTION,
    MERCHANT,
    BOTH
}
