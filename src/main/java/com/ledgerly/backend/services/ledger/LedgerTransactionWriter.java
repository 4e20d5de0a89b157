package com.ledgerly.backend.services.ledger;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerly.backend.entities.LedgerTransaction;
import com.ledgerly.backend.mappers.LedgerTransactionMapper;
import com.ledgerly.backend.repositories.LedgerTransactionRepository;
import com.ledgerly.backend.services.documents.model.TransactionCandidate;

import lombok.extern.slf4j.Slf4j;

/**
 * Grava o lote em uma transação própria. Se a unicidade (owner, referência) rejeitar o lote,
 * grava linha a linha: conflitos de referência contam como duplicadas, outras violações
 * como linhas rejeitadas. Se o lote falhar por outro motivo, o erro sobe e nada é gravado.
 */
@Component
@Slf4j
public class LedgerTransactionWriter {

    private static final String REFERENCE_CONSTRAINT = "uk_ledger_transactions_owner_reference";
    private static final String UNIQUE_VIOLATION = "23505";

    private final LedgerTransactionRepository repository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate requiresNew;

    public LedgerTransactionWriter(LedgerTransactionRepository repository,
                                   ObjectMapper objectMapper,
                                   PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public WriteReport insertAll(UUID documentId,
                                 UUID ownerId,
                                 String bankName,
                                 String referenceCurrency,
                                 List<TransactionCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) return new WriteReport(0, 0);

        try {
            List<LedgerTransaction> batch = toEntities(candidates, documentId, ownerId, bankName, referenceCurrency);
            requiresNew.executeWithoutResult(status -> repository.saveAllAndFlush(batch));
            log.info("[Ledger] Inserted batch of {} transactions owner={} document={}", batch.size(), ownerId, documentId);
            return new WriteReport(batch.size(), 0);
        } catch (DataIntegrityViolationException e) {
            if (!isReferenceConflict(e)) throw e;
            log.warn("[Ledger] Batch insert hit a reference conflict (owner={}); retrying row by row", ownerId);
        }

        int inserted = 0;
        int conflicts = 0;
        int rejected = 0;
        for (TransactionCandidate candidate : candidates) {
            LedgerTransaction entity = LedgerTransactionMapper.toEntity(
                    candidate, documentId, ownerId, bankName, referenceCurrency, writeRawSource(candidate.getRawSource()));
            try {
                requiresNew.executeWithoutResult(status -> repository.saveAndFlush(entity));
                inserted++;
            } catch (DataIntegrityViolationException e) {
                if (isReferenceConflict(e)) {
                    conflicts++;
                    log.warn("[Ledger] Late duplicate owner={} ref={}", ownerId, entity.getReferenceNumber());
                } else {
                    rejected++;
                    log.error("[Ledger] Row rejected owner={} ref={} date={}: {}",
                            ownerId, entity.getReferenceNumber(), entity.getTransactionDate(), rootMessage(e));
                }
            }
        }

        log.info("[Ledger] Row-by-row insert owner={} inserted={} conflicts={} rejected={}",
                ownerId, inserted, conflicts, rejected);
        return new WriteReport(inserted, conflicts, rejected);
    }

    /**
     * Violação da unicidade (owner, referência). Reconhecida pelo nome da constraint ou,
     * quando o driver não o informa, pelo SQLSTATE 23505: é a única unique da tabela além da PK UUID.
     */
    static boolean isReferenceConflict(Throwable e) {
        boolean uniqueViolation = false;
        for (Throwable t = e; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains(REFERENCE_CONSTRAINT)) {
                return true;
            }
            if (t instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                uniqueViolation = true;
            }
            if (t.getCause() == t) break;
        }
        return uniqueViolation;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) root = root.getCause();
        return root.getMessage();
    }

    private List<LedgerTransaction> toEntities(List<TransactionCandidate> candidates, UUID documentId, UUID ownerId,
                                               String bankName, String referenceCurrency) {
        List<LedgerTransaction> entities = new ArrayList<>();
        for (TransactionCandidate candidate : candidates) {
            entities.add(LedgerTransactionMapper.toEntity(
                    candidate, documentId, ownerId, bankName, referenceCurrency, writeRawSource(candidate.getRawSource())));
        }
        return entities;
    }

    private String writeRawSource(Map<String, String> rawSource) {
        if (rawSource == null || rawSource.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(rawSource);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize raw source", e);
        }
    }
}
