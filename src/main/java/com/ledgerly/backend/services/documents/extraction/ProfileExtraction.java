package com.ledgerly.backend.services.documents.extraction;

import java.time.LocalDate;
import java.util.List;

import com.ledgerly.backend.services.documents.model.TransactionCandidate;

/**
 * Saída bruta de um extrator, antes do cálculo de confiança do documento.
 */
record ProfileExtraction(List<TransactionCandidate> candidates, int skippedRows, LocalDate statementDate) {
}
