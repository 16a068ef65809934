package com.cardledger.backend.services.classification;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.cardledger.backend.dto.extraction.ExtractedTransaction;
import com.cardledger.backend.dto.reconciliation.CandidateTransaction;
import com.cardledger.backend.enums.SpendingCategory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the labeler and keeps only labels from the fixed vocabulary.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategoryLabelingService {

    private final CategoryLabeler categoryLabeler;

    public List<CandidateTransaction> label(List<ExtractedTransaction> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            return List.of();
        }
        List<String> descriptions = transactions.stream().map(ExtractedTransaction::description).toList();

        List<SpendingCategory> categories = categorize(descriptions);
        List<String> subcategories = subcategorize(descriptions, categories);

        List<CandidateTransaction> out = new ArrayList<>(transactions.size());
        for (int i = 0; i < transactions.size(); i++) {
            ExtractedTransaction tx = transactions.get(i);
            out.add(new CandidateTransaction(
                    tx.transactionDate(),
                    tx.postingDate(),
                    tx.description(),
                    tx.amount(),
                    categories.get(i),
                    subcategories.get(i)
            ));
        }
        return out;
    }

    private List<SpendingCategory> categorize(List<String> descriptions) {
        List<String> labels;
        try {
            labels = categoryLabeler.label(descriptions);
        } catch (RuntimeException e) {
            log.warn("[Labeling] category labeling failed, using {}: {}", SpendingCategory.OTHER, e.getMessage());
            labels = List.of();
        }
        List<SpendingCategory> out = new ArrayList<>(descriptions.size());
        for (int i = 0; i < descriptions.size(); i++) {
            String label = labels != null && i < labels.size() ? labels.get(i) : null;
            out.add(SpendingCategory.fromLabel(label));
        }
        return out;
    }

    private List<String> subcategorize(List<String> descriptions, List<SpendingCategory> categories) {
        List<String> labels;
        try {
            labels = categoryLabeler.sublabel(descriptions, categories.stream().map(SpendingCategory::getLabel).toList());
        } catch (RuntimeException e) {
            log.warn("[Labeling] subcategory labeling failed, leaving them empty: {}", e.getMessage());
            labels = List.of();
        }
        List<String> out = new ArrayList<>(descriptions.size());
        for (int i = 0; i < descriptions.size(); i++) {
            String label = labels != null && i < labels.size() ? labels.get(i) : null;
            out.add(categories.get(i).validSubcategory(label));
        }
        return out;
    }
}
