package com.cardledger.backend.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.cardledger.backend.entities.StatementTransaction;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class TransactionResponseDTO {

    private Long id;
    private Long statementId;
    private String period;
    private Integer cutoffDay;
    private LocalDate transactionDate;
    private String description;
    private BigDecimal amount;
    private String category;
    private String subcategory;
    private String issuer;

    public static TransactionResponseDTO from(StatementTransaction tx) {
        var statement = tx.getStatement();
        return new TransactionResponseDTO(
                tx.getId(),
                statement != null ? statement.getId() : null,
                statement != null ? statement.getPeriod() : null,
                statement != null ? statement.getCutoffDay() : null,
                tx.getTransactionDate(),
                tx.getDescription(),
                tx.getAmount(),
                tx.getCategory() != null ? tx.getCategory().getLabel() : null,
                tx.getSubcategory(),
                tx.getIssuer()
        );
    }
}
