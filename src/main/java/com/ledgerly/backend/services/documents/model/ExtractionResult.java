package com.ledgerly.backend.services.documents.model;

import java.time.LocalDate;
import java.util.List;

import com.ledgerly.backend.enums.ExtractionMethod;

public record ExtractionResult(
        List<TransactionCandidate> candidates,
        String bankNameGuess,
        LocalDate statementDate,
        int pipelineConfidence,
        ExtractionMethod method,
        String profileId,
        int skippedRows
) {

    public ExtractionResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        if (method == null) method = ExtractionMethod.DETERMINISTIC;
    }

    public static ExtractionResult empty(String profileId, String bankNameGuess, int skippedRows) {
        return new ExtractionResult(List.of(), bankNameGuess, null, 0, ExtractionMethod.DETERMINISTIC, profileId, skippedRows);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public ExtractionResult withMethod(ExtractionMethod newMethod) {
        return new ExtractionResult(candidates, bankNameGuess, statementDate, pipelineConfidence, newMethod, profileId, skippedRows);
    }

    public ExtractionResult withCandidates(List<TransactionCandidate> newCandidates) {
        return new ExtractionResult(newCandidates, bankNameGuess, statementDate, pipelineConfidence, method, profileId, skippedRows);
    }
}
