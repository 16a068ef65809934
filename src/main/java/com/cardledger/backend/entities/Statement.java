package com.cardledger.backend.entities;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.OneToMany;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "statements", indexes = {
        @Index(name = "idx_statements_period", columnList = "period")
})
@Getter
@Setter
@NoArgsConstructor
public class Statement {

    public static final String HASH_SEPARATOR = ",";

    // TEXT in the migration; the length only sizes the column Hibernate generates for tests.
    static final int UNBOUNDED_TEXT = 100_000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = UNBOUNDED_TEXT)
    private String filename;

    @Column(length = 200)
    private String issuer;

    // YYYY-MM of the latest transaction date, set once at commit.
    @Column(nullable = false, length = 7)
    private String period;

    @Column(name = "imported_at", nullable = false)
    private LocalDateTime importedAt;

    @Column(name = "tx_count", nullable = false)
    private int transactionCount;

    @Column(name = "cutoff_day")
    private Integer cutoffDay;

    // One SHA-256 per physical file of the batch, comma-joined.
    @Column(name = "file_hash", length = UNBOUNDED_TEXT)
    private String fileHash;

    @OneToMany(mappedBy = "statement", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<StatementTransaction> transactions = new ArrayList<>();

    public void addTransaction(StatementTransaction tx) {
        if (tx == null) return;
        tx.setStatement(this);
        this.transactions.add(tx);
    }

    public List<String> fileHashes() {
        if (fileHash == null || fileHash.isBlank()) {
            return List.of();
        }
        return Arrays.stream(fileHash.split(HASH_SEPARATOR))
                .map(String::trim)
                .filter(h -> !h.isEmpty())
                .toList();
    }
}
