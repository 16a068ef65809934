package com.cardledger.backend.services;

import java.time.Clock;
import java.time.YearMonth;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.cardledger.backend.dto.StatementResponseDTO;
import com.cardledger.backend.dto.TransactionResponseDTO;
import com.cardledger.backend.entities.Statement;
import com.cardledger.backend.entities.StatementTransaction;
import com.cardledger.backend.exceptions.BadRequestException;
import com.cardledger.backend.exceptions.ResourceNotFoundException;
import com.cardledger.backend.repositories.StatementRepository;
import com.cardledger.backend.repositories.StatementTransactionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class StatementService {

    private final StatementRepository statementRepository;
    private final StatementTransactionRepository transactionRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<StatementResponseDTO> listStatements() {
        return statementRepository.findAllByOrderByImportedAtDesc().stream()
                .map(StatementResponseDTO::from)
                .toList();
    }

    /**
     * Issuers seen before, most recently imported first.
     */
    @Transactional(readOnly = true)
    public List<String> previousIssuers() {
        return statementRepository.findIssuersByMostRecentImport().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }

    @Transactional
    public void delete(Long statementId) {
        Statement statement = statementRepository.findById(statementId)
                .orElseThrow(() -> new ResourceNotFoundException("Statement not found: " + statementId));
        statementRepository.delete(statement);
        log.info("[Statements] deleted statement id={} with {} transactions",
                statementId, statement.getTransactions().size());
    }

    /**
     * @param period {@code all}, {@code current_month}, {@code last_month}, {@code 3_months} or
     *               {@code 6_months}; the last two keep the N most recent months that have data
     */
    @Transactional(readOnly = true)
    public List<TransactionResponseDTO> listTransactions(String period) {
        List<StatementTransaction> all = transactionRepository.findAllWithStatement();
        return filterByPeriod(all, period == null ? "all" : period).stream()
                .map(TransactionResponseDTO::from)
                .toList();
    }

    List<StatementTransaction> filterByPeriod(List<StatementTransaction> all, String period) {
        YearMonth now = YearMonth.now(clock);
        switch (period) {
            case "all":
                return all;
            case "current_month":
                return inMonths(all, Set.of(now));
            case "last_month":
                return inMonths(all, Set.of(now.minusMonths(1)));
            case "3_months":
                return inMonths(all, mostRecentMonths(all, 3));
            case "6_months":
                return inMonths(all, mostRecentMonths(all, 6));
            default:
                throw new BadRequestException("Unknown period filter: " + period);
        }
    }

    private static Set<YearMonth> mostRecentMonths(List<StatementTransaction> all, int n) {
        return all.stream()
                .map(StatementTransaction::getTransactionDate)
                .filter(Objects::nonNull)
                .map(YearMonth::from)
                .distinct()
                .sorted((a, b) -> b.compareTo(a))
                .limit(n)
                .collect(Collectors.toSet());
    }

    private static List<StatementTransaction> inMonths(List<StatementTransaction> all, Set<YearMonth> months) {
        return all.stream()
                .filter(t -> t.getTransactionDate() != null && months.contains(YearMonth.from(t.getTransactionDate())))
                .toList();
    }
}
