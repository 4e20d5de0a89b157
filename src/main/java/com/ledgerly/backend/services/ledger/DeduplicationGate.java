package com.ledgerly.backend.services.ledger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ledgerly.backend.mappers.LedgerTransactionMapper;
import com.ledgerly.backend.repositories.LedgerTransactionRepository;
import com.ledgerly.backend.services.documents.model.TransactionCandidate;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Remove candidatos cuja referência já existe para o usuário.
 * Sem referência não há chave natural: o candidato sempre passa.
 * A mesma referência repetida dentro do lote também conta como duplicada.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeduplicationGate {

    private final LedgerTransactionRepository repository;

    @Transactional(readOnly = true)
    public DeduplicationResult filter(UUID ownerId, List<TransactionCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) return new DeduplicationResult(List.of(), 0);

        Set<String> incoming = new HashSet<>();
        for (TransactionCandidate c : candidates) {
            if (c.hasReference()) incoming.add(LedgerTransactionMapper.storedReference(c));
        }

        Set<String> existing = incoming.isEmpty()
                ? Set.of()
                : repository.findExistingReferenceNumbers(ownerId, incoming);

        List<TransactionCandidate> fresh = new ArrayList<>();
        Set<String> seenInBatch = new HashSet<>();
        int duplicates = 0;

        for (TransactionCandidate c : candidates) {
            if (!c.hasReference()) {
                fresh.add(c);
                continue;
            }
            String reference = LedgerTransactionMapper.storedReference(c);
            if (existing.contains(reference) || !seenInBatch.add(reference)) {
                duplicates++;
                log.debug("[Dedup] Duplicate reference owner={} ref={}", ownerId, reference);
                continue;
            }
            fresh.add(c);
        }

        log.info("[Dedup] owner={} candidates={} fresh={} duplicates={}", ownerId, candidates.size(), fresh.size(), duplicates);
        return new DeduplicationResult(fresh, duplicates);
    }
}
