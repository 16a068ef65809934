package com.cardledger.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.cardledger.backend.enums.SpendingCategory;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "statement_transactions", indexes = {
        @Index(name = "idx_statement_transactions_statement_id", columnList = "statement_id"),
        @Index(name = "idx_statement_transactions_trans_date", columnList = "trans_date")
})
@Getter
@Setter
@NoArgsConstructor
public class StatementTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "statement_id", nullable = false)
    private Statement statement;

    @Column(name = "trans_date")
    private LocalDate transactionDate;

    @Column(name = "posting_date")
    private LocalDate postingDate;

    @Column(nullable = false, length = Statement.UNBOUNDED_TEXT)
    private String description;

    // Positive = expense, zero or negative = credit / cashback / adjustment.
    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private SpendingCategory category = SpendingCategory.OTHER;

    @Column(length = 100)
    private String subcategory;

    @Column(length = 200)
    private String issuer;
}
