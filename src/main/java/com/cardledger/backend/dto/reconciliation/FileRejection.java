package com.cardledger.backend.dto.reconciliation;

import java.time.LocalDateTime;

/**
 * A file excluded from the batch because its exact bytes were already imported.
 */
public record FileRejection(
        String filename,
        String fingerprint,
        Long statementId,
        String issuer,
        String period,
        LocalDateTime importedAt
) {
}
