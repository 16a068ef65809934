package com.cardledger.backend.enums;

public enum ImportState {
    CHECKING_FINGERPRINT,
    CHECKING_FUZZY,
    AWAITING_CONFIRMATION,
    COMMITTED,
    REJECTED_DUPLICATE,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMMITTED || this == REJECTED_DUPLICATE || this == CANCELLED;
    }
}
