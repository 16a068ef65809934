package com.cardledger.backend.services.reconciliation;

import java.util.List;
import java.util.Objects;

import org.springframework.stereotype.Component;

import com.cardledger.backend.dto.extraction.BatchConsensus;
import com.cardledger.backend.dto.extraction.DocumentConsensus;
import com.cardledger.backend.dto.extraction.PageExtraction;

/**
 * Collapses per-page metadata into one value per field. Pages must be given in document order,
 * the order only matters for breaking ties.
 */
@Component
public class ConsensusAggregator {

    public DocumentConsensus aggregate(List<PageExtraction> pages) {
        if (pages == null || pages.isEmpty()) {
            return DocumentConsensus.empty();
        }
        List<PageExtraction> observed = pages.stream().filter(Objects::nonNull).toList();

        Integer cutoffDay = MajorityVote.mostFrequent(observed.stream().map(PageExtraction::cutoffDay).toList())
                .orElse(null);
        String issuer = MajorityVote.mostFrequent(observed.stream().map(p -> trimToNull(p.issuerName())).toList())
                .orElse(null);
        String card = MajorityVote.mostFrequent(observed.stream().map(p -> trimToNull(p.cardName())).toList())
                .orElse(null);

        return new DocumentConsensus(cutoffDay, issuer, card, composeSuggestion(issuer, card));
    }

    /**
     * Batch-level vote over the documents of a multi-file import.
     */
    public BatchConsensus combine(List<DocumentConsensus> documents) {
        if (documents == null || documents.isEmpty()) {
            return new BatchConsensus(null, null);
        }
        List<DocumentConsensus> observed = documents.stream().filter(Objects::nonNull).toList();
        Integer cutoffDay = MajorityVote.mostFrequent(observed.stream().map(DocumentConsensus::cutoffDay).toList())
                .orElse(null);
        String suggestion = MajorityVote.mostFrequent(observed.stream().map(DocumentConsensus::suggestedIssuer).toList())
                .orElse(null);
        return new BatchConsensus(cutoffDay, suggestion);
    }

    /**
     * The label the user typed wins; the suggestion only fills an empty label.
     */
    public String resolveIssuer(String userLabel, String suggestion) {
        String label = trimToNull(userLabel);
        return label != null ? label : trimToNull(suggestion);
    }

    static String composeSuggestion(String issuer, String card) {
        if (issuer != null && card != null) {
            return issuer + " " + card;
        }
        return issuer != null ? issuer : card;
    }

    private static String trimToNull(String value) {
        if (value == null) return null;
        String v = value.trim();
        return v.isEmpty() ? null : v;
    }
}
