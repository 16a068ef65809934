package com.cardledger.backend.config;

import java.math.BigDecimal;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tolerances used by the duplicate checks. The defaults were tuned against real OCR output,
 * change them only with evidence.
 *
 * @param statementTolerance    max relative difference between statement totals (0.05 = 5%)
 * @param overlapRatioThreshold soft-match ratio at which a batch needs confirmation
 * @param amountSlack           absolute amount difference still considered the same transaction
 * @param recencyYears          transactions older than this many years are dropped as sample rows
 * @param checkTimeout          upper bound for each of the two duplicate checks
 */
@ConfigurationProperties(prefix = "cardledger.reconciliation")
public record ReconciliationProperties(
        BigDecimal statementTolerance,
        Double overlapRatioThreshold,
        BigDecimal amountSlack,
        Integer recencyYears,
        Duration checkTimeout
) {
    public ReconciliationProperties {
        if (statementTolerance == null) {
            statementTolerance = new BigDecimal("0.05");
        }
        if (overlapRatioThreshold == null) {
            overlapRatioThreshold = 0.5;
        }
        if (amountSlack == null) {
            amountSlack = BigDecimal.ONE;
        }
        if (recencyYears == null) {
            recencyYears = 3;
        }
        if (checkTimeout == null) {
            checkTimeout = Duration.ofSeconds(30);
        }
    }

    public static ReconciliationProperties defaults() {
        return new ReconciliationProperties(null, null, null, null, null);
    }
}
