package com.cardledger.backend.dto.extraction;

public record BatchConsensus(Integer cutoffDay, String suggestedIssuer) {
}
