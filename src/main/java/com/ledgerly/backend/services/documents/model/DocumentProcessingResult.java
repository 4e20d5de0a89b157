package com.ledgerly.backend.services.documents.model;

import java.util.Set;
import java.util.UUID;

import com.ledgerly.backend.enums.ExtractionMethod;
import com.ledgerly.backend.enums.PipelineCondition;
import com.ledgerly.backend.enums.ProcessingStatus;

/**
 * Resultado de um documento processado. Em caso de falha, {@code error} explica o motivo
 * e nenhuma transação do documento foi gravada.
 */
public record DocumentProcessingResult(
        UUID documentId,
        ProcessingStatus status,
        int insertedCount,
        int duplicateCount,
        int pipelineConfidence,
        ExtractionMethod method,
        boolean needsReview,
        String bankNameGuess,
        String documentType,
        Set<PipelineCondition> conditions,
        String error
) {

    public DocumentProcessingResult {
        conditions = conditions == null ? Set.of() : Set.copyOf(conditions);
    }

    public static DocumentProcessingResult failed(UUID documentId, Set<PipelineCondition> conditions, String error) {
        return new DocumentProcessingResult(documentId, ProcessingStatus.FAILED, 0, 0, 0,
                ExtractionMethod.DETERMINISTIC, false, null, null, conditions, error);
    }

    public boolean isSuccess() {
        return status == ProcessingStatus.COMPLETED;
    }
}
