package com.cardledger.backend.services;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.YearMonth;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.cardledger.backend.dto.reconciliation.CandidateTransaction;
import com.cardledger.backend.dto.reconciliation.ImportSession;
import com.cardledger.backend.entities.Statement;
import com.cardledger.backend.entities.StatementTransaction;
import com.cardledger.backend.repositories.StatementRepository;
import com.cardledger.backend.services.reconciliation.BillingPeriods;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes one statement and all of its transactions in a single transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatementCommitService {

    private final StatementRepository statementRepository;
    private final Clock clock;

    @Transactional
    public Statement commit(ImportSession session, String issuer) {
        Statement statement = new Statement();
        statement.setFilename(String.join(", ", session.getFilenames()));
        statement.setIssuer(issuer);
        statement.setPeriod(BillingPeriods.latestPeriod(session.getTransactions())
                .orElseGet(() -> YearMonth.now(clock).toString()));
        statement.setImportedAt(LocalDateTime.now(clock));
        statement.setTransactionCount(session.getTransactions().size());
        statement.setCutoffDay(session.getCutoffDay());
        statement.setFileHash(session.getFingerprints().isEmpty()
                ? null
                : String.join(Statement.HASH_SEPARATOR, session.getFingerprints()));

        for (CandidateTransaction candidate : session.getTransactions()) {
            StatementTransaction tx = new StatementTransaction();
            tx.setTransactionDate(candidate.transactionDate());
            tx.setPostingDate(candidate.postingDate());
            tx.setDescription(candidate.description());
            tx.setAmount(candidate.amount());
            tx.setCategory(candidate.category());
            tx.setSubcategory(candidate.subcategory());
            tx.setIssuer(issuer);
            statement.addTransaction(tx);
        }

        // Flush inside the transaction so constraint violations surface here and roll everything back.
        Statement saved = statementRepository.saveAndFlush(statement);
        log.info("[Commit] statement id={} issuer='{}' period={} transactions={}",
                saved.getId(), issuer, saved.getPeriod(), saved.getTransactionCount());
        return saved;
    }
}
