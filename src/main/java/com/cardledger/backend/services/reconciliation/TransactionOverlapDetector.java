package com.cardledger.backend.services.reconciliation;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.cardledger.backend.config.ReconciliationProperties;
import com.cardledger.backend.dto.reconciliation.CandidateTransaction;
import com.cardledger.backend.dto.reconciliation.OverlapResult;
import com.cardledger.backend.repositories.StatementTransactionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Counts how many positive-amount candidates already exist in storage.
 *
 * <p>Exact match: same date, same description, amount within the slack.
 * Soft match: same date and amount within the slack, description ignored. The soft ratio is the
 * one the decision uses because merchant text is where OCR errs most.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionOverlapDetector {

    private final StatementTransactionRepository transactionRepository;
    private final ReconciliationProperties properties;

    @Transactional(readOnly = true)
    public OverlapResult findOverlap(List<CandidateTransaction> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return OverlapResult.none(0);
        }

        BigDecimal slack = properties.amountSlack();
        int positiveCount = 0;
        int exactCount = 0;
        int softCount = 0;

        for (CandidateTransaction candidate : candidates) {
            if (candidate == null || !candidate.isPositive()) {
                continue;
            }
            positiveCount++;
            if (candidate.transactionDate() == null) {
                continue;
            }

            BigDecimal low = candidate.amount().subtract(slack);
            BigDecimal high = candidate.amount().add(slack);
            try {
                if (transactionRepository.existsExactMatch(candidate.transactionDate(), candidate.description(), low, high)) {
                    exactCount++;
                }
                if (transactionRepository.existsSoftMatch(candidate.transactionDate(), low, high)) {
                    softCount++;
                }
            } catch (RuntimeException e) {
                log.warn("[Overlap] lookup failed for date={} amount={}, treating as no match: {}",
                        candidate.transactionDate(), candidate.amount(), e.getMessage());
            }
        }

        if (positiveCount == 0) {
            return OverlapResult.none(candidates.size());
        }

        double ratio = (double) softCount / positiveCount;
        log.info("[Overlap] exact={} soft={} positive={} total={} ratio={}",
                exactCount, softCount, positiveCount, candidates.size(), ratio);
        return new OverlapResult(exactCount, softCount, ratio, candidates.size(), positiveCount);
    }
}
