package com.ledgerly.backend.services.documents.model;

import java.util.Set;

public record DocumentClassification(
        String documentType,
        String documentTypeName,
        int typeConfidence,
        Set<String> matchedPatterns,
        String bankId,
        String bankName,
        int bankConfidence
) {

    public static final String UNKNOWN = "unknown";
    public static final String UNKNOWN_BANK_NAME = "Desconocido";

    public DocumentClassification {
        matchedPatterns = matchedPatterns == null ? Set.of() : Set.copyOf(matchedPatterns);
    }

    public boolean isTypeResolved() {
        return !UNKNOWN.equals(documentType);
    }

    public boolean isBankResolved() {
        return !UNKNOWN.equals(bankId);
    }

    public boolean isProcessable() {
        return isTypeResolved() || isBankResolved();
    }
}
