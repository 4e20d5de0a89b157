package com.ledgerly.backend.services.documents.extraction;

public enum ColumnRole {
    DATE,
    DESCRIPTION,
    BRANCH_DESCRIPTION,
    AMOUNT,
    DEBIT,
    CREDIT,
    BALANCE,
    REFERENCE,
    OPERATION_CODE
}
