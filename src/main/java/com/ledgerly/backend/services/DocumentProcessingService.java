package com.ledgerly.backend.services;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.ledgerly.backend.classification.CategorizationService;
import com.ledgerly.backend.enums.PipelineCondition;
import com.ledgerly.backend.enums.ProcessingStatus;
import com.ledgerly.backend.services.currency.CurrencyNormalizer;
import com.ledgerly.backend.services.documents.DocumentProcessingException;
import com.ledgerly.backend.services.documents.classifier.DocumentClassifier;
import com.ledgerly.backend.services.documents.escalation.EscalationController;
import com.ledgerly.backend.services.documents.escalation.EscalationOutcome;
import com.ledgerly.backend.services.documents.extraction.ExtractionEngine;
import com.ledgerly.backend.services.documents.model.DocumentClassification;
import com.ledgerly.backend.services.documents.model.DocumentProcessingResult;
import com.ledgerly.backend.services.documents.model.ExtractionResult;
import com.ledgerly.backend.services.documents.model.ParsedContent;
import com.ledgerly.backend.services.documents.model.SourceDocument;
import com.ledgerly.backend.services.documents.model.TransactionCandidate;
import com.ledgerly.backend.services.documents.parsing.ContentParser;
import com.ledgerly.backend.services.documents.parsing.UnsupportedFormatException;
import com.ledgerly.backend.services.ledger.DeduplicationGate;
import com.ledgerly.backend.services.ledger.DeduplicationResult;
import com.ledgerly.backend.services.ledger.LedgerTransactionWriter;
import com.ledgerly.backend.services.ledger.WriteReport;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Processa um documento de ponta a ponta:
 * parse -> classificação -> extração -> escalonamento -> dedup -> moeda -> categorização -> gravação.
 *
 * Formato não suportado, arquivo ilegível e qualquer exceção inesperada de um estágio viram
 * status FAILED com o motivo em {@code error}; nunca propagam ao chamador. As demais condições
 * são apenas reportadas em {@link DocumentProcessingResult#conditions()}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentProcessingService {

    private final ContentParser contentParser;
    private final DocumentClassifier documentClassifier;
    private final ExtractionEngine extractionEngine;
    private final EscalationController escalationController;
    private final DeduplicationGate deduplicationGate;
    private final CurrencyNormalizer currencyNormalizer;
    private final CategorizationService categorizationService;
    private final LedgerTransactionWriter transactionWriter;

    public DocumentProcessingResult processDocument(SourceDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("document é obrigatório");
        }

        Set<PipelineCondition> conditions = EnumSet.noneOf(PipelineCondition.class);
        try {
            return runPipeline(document, conditions);
        } catch (RuntimeException e) {
            conditions.add(PipelineCondition.PROCESSING_ERROR);
            log.error("[Processor] Unexpected failure document={}", document.id(), e);
            return DocumentProcessingResult.failed(document.id(), conditions, "Falha no processamento: " + e.getMessage());
        }
    }

    private DocumentProcessingResult runPipeline(SourceDocument document, Set<PipelineCondition> conditions) {
        log.info("[Processor] Start document={} owner={} file={} mediaType={} bytes={}",
                document.id(), document.ownerId(), document.originalName(), document.mediaType(),
                document.content().length);

        ParsedContent content;
        try {
            content = contentParser.parse(document.content(), document.mediaType(), document.originalName());
        } catch (UnsupportedFormatException e) {
            conditions.add(PipelineCondition.UNSUPPORTED_FORMAT);
            log.warn("[Processor] Unsupported format document={}: {}", document.id(), e.getMessage());
            return DocumentProcessingResult.failed(document.id(), conditions, e.getMessage());
        } catch (DocumentProcessingException e) {
            log.error("[Processor] Could not decode document={}", document.id(), e);
            return DocumentProcessingResult.failed(document.id(), conditions, e.getMessage());
        }

        DocumentClassification classification = documentClassifier.classify(content.text());
        if (!classification.isTypeResolved() || !classification.isBankResolved()) {
            conditions.add(PipelineCondition.CLASSIFICATION_INCONCLUSIVE);
        }

        ExtractionResult deterministic = extractionEngine.extract(content, classification, document.originalName());
        if (deterministic.skippedRows() > 0) {
            conditions.add(PipelineCondition.ROW_PARSE_SKIPPED);
        }

        EscalationOutcome escalation = escalationController.resolve(
                deterministic, content, document.originalName(), document.ownerId());
        if (escalation.escalationUnavailable()) {
            conditions.add(PipelineCondition.ESCALATION_UNAVAILABLE);
        }
        ExtractionResult extraction = escalation.result();

        DeduplicationResult dedup = deduplicationGate.filter(document.ownerId(), extraction.candidates());
        if (dedup.duplicateCount() > 0) {
            conditions.add(PipelineCondition.DUPLICATE_REFERENCE);
        }

        List<TransactionCandidate> normalized = currencyNormalizer.normalizeAll(dedup.fresh());
        if (normalized.stream().anyMatch(c -> c.getAmountInReferenceCurrency() == null)) {
            conditions.add(PipelineCondition.CURRENCY_CONVERSION_UNAVAILABLE);
        }

        List<TransactionCandidate> categorized = categorizationService.categorizeAll(document.ownerId(), normalized);

        String bankName = resolveBankName(extraction, classification);

        WriteReport written;
        try {
            written = transactionWriter.insertAll(document.id(), document.ownerId(), bankName,
                    currencyNormalizer.referenceCurrency(), categorized);
        } catch (RuntimeException e) {
            log.error("[Processor] Insert failed document={}", document.id(), e);
            return DocumentProcessingResult.failed(document.id(), conditions, "Falha ao gravar transações: " + e.getMessage());
        }
        if (written.conflicts() > 0) {
            conditions.add(PipelineCondition.DUPLICATE_REFERENCE);
        }
        if (written.rejected() > 0) {
            conditions.add(PipelineCondition.ROW_PERSIST_REJECTED);
        }

        int duplicates = dedup.duplicateCount() + written.conflicts();
        log.info("[Processor] Done document={} type={} bank={} method={} confidence={} inserted={} duplicates={} review={} conditions={}",
                document.id(), classification.documentType(), bankName, extraction.method().code(),
                extraction.pipelineConfidence(), written.inserted(), duplicates, escalation.needsReview(), conditions);

        return new DocumentProcessingResult(
                document.id(),
                ProcessingStatus.COMPLETED,
                written.inserted(),
                duplicates,
                extraction.pipelineConfidence(),
                extraction.method(),
                escalation.needsReview(),
                bankName,
                classification.documentType(),
                conditions,
                null
        );
    }

    static String resolveBankName(ExtractionResult extraction, DocumentClassification classification) {
        if (extraction.bankNameGuess() != null && !extraction.bankNameGuess().isBlank()) {
            return extraction.bankNameGuess();
        }
        if (classification.isBankResolved()) {
            return classification.bankName();
        }
        return null;
    }
}
