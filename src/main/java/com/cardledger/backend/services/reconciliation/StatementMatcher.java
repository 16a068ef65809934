package com.cardledger.backend.services.reconciliation;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.cardledger.backend.config.ReconciliationProperties;
import com.cardledger.backend.dto.reconciliation.MatchCandidate;
import com.cardledger.backend.entities.Statement;
import com.cardledger.backend.entities.StatementTransaction;
import com.cardledger.backend.repositories.StatementRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds stored statements of the same period whose positive total is close to the incoming one.
 * The issuer is only reported, never filtered on: OCR spells issuer names inconsistently.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatementMatcher {

    private final StatementRepository statementRepository;
    private final ReconciliationProperties properties;

    @Transactional(readOnly = true)
    public List<MatchCandidate> findSimilar(String issuer, String period, BigDecimal totalAmount) {
        return findSimilar(issuer, period, totalAmount, properties.statementTolerance());
    }

    @Transactional(readOnly = true)
    public List<MatchCandidate> findSimilar(String issuer, String period, BigDecimal totalAmount, BigDecimal tolerance) {
        if (period == null || period.isBlank()) {
            return List.of();
        }
        BigDecimal incoming = totalAmount == null ? BigDecimal.ZERO : totalAmount;

        List<MatchCandidate> results = new ArrayList<>();
        for (Statement statement : statementRepository.findByPeriod(period)) {
            try {
                MatchCandidate candidate = compare(statement, issuer, incoming, tolerance);
                if (candidate != null) {
                    results.add(candidate);
                }
            } catch (RuntimeException e) {
                log.warn("[StatementMatcher] statement id={} could not be compared, treating as no match: {}",
                        statement.getId(), e.getMessage());
            }
        }

        log.info("[StatementMatcher] period={} incomingTotal={} candidates={}", period, incoming, results.size());
        return results;
    }

    private MatchCandidate compare(Statement statement, String issuer, BigDecimal incoming, BigDecimal tolerance) {
        BigDecimal stored = positiveTotal(statement);
        boolean issuerMatch = Objects.equals(statement.getIssuer(), issuer);

        if (stored.signum() == 0 && incoming.signum() == 0) {
            return toCandidate(statement, stored, 0.0, issuerMatch);
        }
        if (stored.signum() == 0) {
            return null;
        }

        BigDecimal denominator = stored.abs().max(BigDecimal.ONE);
        BigDecimal diffRatio = incoming.subtract(stored).abs().divide(denominator, MathContext.DECIMAL64);
        if (diffRatio.compareTo(tolerance) > 0) {
            return null;
        }
        return toCandidate(statement, stored, diffRatio.doubleValue(), issuerMatch);
    }

    // Credits and payments are not part of a statement's spend total.
    static BigDecimal positiveTotal(Statement statement) {
        BigDecimal total = BigDecimal.ZERO;
        if (statement.getTransactions() == null) {
            return total;
        }
        for (StatementTransaction tx : statement.getTransactions()) {
            BigDecimal amount = tx.getAmount();
            if (amount != null && amount.signum() > 0) {
                total = total.add(amount);
            }
        }
        return total;
    }

    private static MatchCandidate toCandidate(Statement statement, BigDecimal stored, double ratio, boolean issuerMatch) {
        return new MatchCandidate(
                statement.getId(),
                statement.getIssuer(),
                statement.getPeriod(),
                statement.getImportedAt(),
                stored,
                ratio,
                issuerMatch
        );
    }
}
