package com.cardledger.backend.services.reconciliation;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.cardledger.backend.dto.reconciliation.CandidateTransaction;

public final class BillingPeriods {

    private BillingPeriods() {
    }

    /**
     * {@code YYYY-MM} of the latest dated transaction, empty when none carries a date.
     */
    public static Optional<String> latestPeriod(List<CandidateTransaction> transactions) {
        if (transactions == null) {
            return Optional.empty();
        }
        return transactions.stream()
                .filter(Objects::nonNull)
                .map(CandidateTransaction::transactionDate)
                .filter(Objects::nonNull)
                .max(LocalDate::compareTo)
                .map(d -> YearMonth.from(d).toString());
    }

    public static BigDecimal positiveTotal(List<CandidateTransaction> transactions) {
        BigDecimal total = BigDecimal.ZERO;
        if (transactions == null) {
            return total;
        }
        for (CandidateTransaction tx : transactions) {
            if (tx != null && tx.isPositive()) {
                total = total.add(tx.amount());
            }
        }
        return total;
    }
}
