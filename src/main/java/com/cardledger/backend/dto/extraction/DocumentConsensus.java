package com.cardledger.backend.dto.extraction;

public record DocumentConsensus(
        Integer cutoffDay,
        String issuerName,
        String cardName,
        String suggestedIssuer
) {

    public static DocumentConsensus empty() {
        return new DocumentConsensus(null, null, null, null);
    }
}
