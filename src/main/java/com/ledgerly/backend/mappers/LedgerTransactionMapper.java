package com.ledgerly.backend.mappers;

import java.util.UUID;

import com.ledgerly.backend.entities.LedgerTransaction;
import com.ledgerly.backend.services.documents.model.TransactionCandidate;

public class LedgerTransactionMapper {

    private static final int MAX_DESCRIPTION = 500;
    private static final int MAX_REFERENCE = 100;
    private static final int MAX_SHORT_TEXT = 100;

    private LedgerTransactionMapper() {}

    public static LedgerTransaction toEntity(TransactionCandidate candidate,
                                             UUID documentId,
                                             UUID ownerId,
                                             String bankName,
                                             String referenceCurrency,
                                             String rawSourceJson) {
        return LedgerTransaction.builder()
                .ownerId(ownerId)
                .documentId(documentId)
                .transactionDate(candidate.getDate())
                .description(truncate(candidate.getDescription(), MAX_DESCRIPTION))
                .merchant(truncate(candidate.getMerchant(), MAX_SHORT_TEXT))
                .amount(candidate.getAmount())
                .type(candidate.getType())
                .balance(candidate.getBalance())
                .referenceNumber(storedReference(candidate))
                .currency(candidate.getCurrency())
                .amountInReferenceCurrency(candidate.getAmountInReferenceCurrency())
                .referenceCurrency(candidate.getAmountInReferenceCurrency() != null ? referenceCurrency : null)
                .exchangeRate(candidate.getExchangeRate())
                .exchangeRateDate(candidate.getExchangeRateDate())
                .categoryId(candidate.getCategoryId())
                .bankName(truncate(bankName, MAX_SHORT_TEXT))
                .rawSource(rawSourceJson)
                .extractionConfidence(candidate.getExtractionConfidence())
                .needsReview(candidate.isNeedsReview())
                .processedByAi(candidate.isProcessedByAi())
                .build();
    }

    /**
     * Referência como fica gravada (sem espaços nas pontas, no máximo 100 caracteres).
     * A deduplicação compara sempre esta forma.
     */
    public static String storedReference(TransactionCandidate candidate) {
        if (candidate == null || !candidate.hasReference()) return null;
        return truncate(candidate.getReferenceNumber().trim(), MAX_REFERENCE);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) return value;
        return value.substring(0, max);
    }
}
