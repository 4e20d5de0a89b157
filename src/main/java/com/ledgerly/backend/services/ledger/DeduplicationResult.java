package com.ledgerly.backend.services.ledger;

import java.util.List;

import com.ledgerly.backend.services.documents.model.TransactionCandidate;

public record DeduplicationResult(List<TransactionCandidate> fresh, int duplicateCount) {

    public DeduplicationResult {
        fresh = fresh == null ? List.of() : List.copyOf(fresh);
    }
}
