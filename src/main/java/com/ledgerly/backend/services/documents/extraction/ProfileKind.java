package com.ledgerly.backend.services.documents.extraction;

public enum ProfileKind {
    /** Colunas separadas de débito e crédito. */
    SPLIT_DEBIT_CREDIT(true),
    /** Uma coluna de valor com sinal, acompanhada de saldo. */
    SIGNED_AMOUNT_WITH_BALANCE(true),
    /** Colunas reconhecidas por sinônimos. */
    GENERIC_COLUMNS(true),
    /** Linhas de texto reconhecidas por padrões do banco. */
    LINE_PATTERN(false),
    /** Qualquer linha com uma data e um valor monetário. */
    GENERIC_LINE(false);

    private final boolean tabular;

    ProfileKind(boolean tabular) {
        this.tabular = tabular;
    }

    public boolean isTabular() {
        return tabular;
    }
}
