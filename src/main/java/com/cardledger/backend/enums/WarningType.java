package com.cardledger.backend.enums;

public enum WarningType {
    STATEMENT_OVERLAP,
    TRANSACTION_OVERLAP
}
