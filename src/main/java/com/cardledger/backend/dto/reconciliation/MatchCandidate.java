package com.cardledger.backend.dto.reconciliation;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A stored statement whose period matches and whose positive total is within tolerance.
 * Never persisted.
 */
public record MatchCandidate(
        Long statementId,
        String issuer,
        String period,
        LocalDateTime importedAt,
        BigDecimal storedTotal,
        double diffRatio,
        boolean issuerMatch
) {
}
