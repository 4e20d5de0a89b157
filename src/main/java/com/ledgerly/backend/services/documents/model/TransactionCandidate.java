package com.ledgerly.backend.services.documents.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

import com.ledgerly.backend.enums.TransactionType;

import lombok.Builder;
import lombok.Value;

/**
 * Transação extraída de um documento, ainda não persistida.
 * Os estágios seguintes (moeda, categoria, revisão) geram cópias via {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class TransactionCandidate {

    LocalDate date;
    String description;
    String merchant;
    BigDecimal amount;
    String referenceNumber;
    BigDecimal balance;
    Map<String, String> rawSource;
    double extractionConfidence;
    String currency;

    UUID categoryId;
    BigDecimal amountInReferenceCurrency;
    BigDecimal exchangeRate;
    LocalDate exchangeRateDate;
    boolean needsReview;
    boolean processedByAi;

    /**
     * Derivado do sinal do valor; nunca diverge dele.
     */
    public TransactionType getType() {
        return TransactionType.fromAmount(amount);
    }

    public boolean hasReference() {
        return referenceNumber != null && !referenceNumber.isBlank();
    }
}
