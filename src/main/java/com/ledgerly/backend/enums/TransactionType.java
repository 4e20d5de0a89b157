package com.ledgerly.backend.enums;

import java.math.BigDecimal;

public enum TransactionType {
    DEBIT,
    CREDIT;

    /**
     * Sinal manda: negativo é débito, qualquer outro valor é crédito.
     */
    public static TransactionType fromAmount(BigDecimal amount) {
        if (amount != null && amount.signum() < 0) return DEBIT;
        return CREDIT;
    }
}
