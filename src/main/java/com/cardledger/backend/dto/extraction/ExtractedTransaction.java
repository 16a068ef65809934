package com.cardledger.backend.dto.extraction;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ExtractedTransaction(
        LocalDate transactionDate,
        LocalDate postingDate,
        String description,
        BigDecimal amount,
        boolean payment
) {
}
