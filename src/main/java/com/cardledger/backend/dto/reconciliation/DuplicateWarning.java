package com.cardledger.backend.dto.reconciliation;

import com.cardledger.backend.enums.WarningType;

/**
 * Advisory duplicate signal. Does not block by itself; the caller confirms or cancels.
 */
public record DuplicateWarning(
        WarningType type,
        String message,
        Long statementId,
        double ratio
) {
}
