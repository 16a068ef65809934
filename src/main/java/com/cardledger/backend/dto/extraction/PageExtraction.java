package com.cardledger.backend.dto.extraction;

import java.util.List;

/**
 * Typed result for one page. A failed page carries no transactions and no metadata.
 */
public record PageExtraction(
        List<ExtractedTransaction> transactions,
        Integer cutoffDay,
        String issuerName,
        String cardName,
        boolean failed
) {

    public PageExtraction {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }

    public static PageExtraction failedPage() {
        return new PageExtraction(List.of(), null, null, null, true);
    }
}
