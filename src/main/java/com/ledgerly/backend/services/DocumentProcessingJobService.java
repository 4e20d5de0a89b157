package com.ledgerly.backend.services;

import java.util.concurrent.CompletableFuture;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import com.ledgerly.backend.services.documents.model.DocumentProcessingResult;
import com.ledgerly.backend.services.documents.model.SourceDocument;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Executa o processamento fora da thread do chamador (upload), no pool dedicado.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentProcessingJobService {

    private final DocumentProcessingService documentProcessingService;

    @Async("documentProcessingTaskExecutor")
    public CompletableFuture<DocumentProcessingResult> processAsync(SourceDocument document) {
        if (document == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("document é obrigatório"));
        }
        try {
            return CompletableFuture.completedFuture(documentProcessingService.processDocument(document));
        } catch (Exception e) {
            log.error("[ProcessingJob] failed document={}", document.id(), e);
            return CompletableFuture.completedFuture(
                    DocumentProcessingResult.failed(document.id(), null, e.getMessage()));
        }
    }
}
