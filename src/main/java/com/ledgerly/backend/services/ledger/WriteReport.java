package com.ledgerly.backend.services.ledger;

/**
 * @param conflicts linhas rejeitadas pela unicidade (owner, referência): duplicadas tardias
 * @param rejected linhas recusadas pelo banco por outro motivo (NOT NULL, CHECK) na gravação linha a linha
 */
public record WriteReport(int inserted, int conflicts, int rejected) {

    public WriteReport(int inserted, int conflicts) {
        this(inserted, conflicts, 0);
    }
}
