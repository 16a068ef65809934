package com.cardledger.backend.dto.reconciliation;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.cardledger.backend.enums.SpendingCategory;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A validated, not yet stored transaction of the batch under review.
 */
public record CandidateTransaction(
        LocalDate transactionDate,
        LocalDate postingDate,
        String description,
        BigDecimal amount,
        SpendingCategory category,
        String subcategory
) {

    public CandidateTransaction {
        if (category == null) {
            category = SpendingCategory.OTHER;
        }
        subcategory = category.validSubcategory(subcategory);
    }

    @JsonIgnore
    public boolean isPositive() {
        return amount != null && amount.signum() > 0;
    }
}
