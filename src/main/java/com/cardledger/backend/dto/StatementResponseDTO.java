package com.cardledger.backend.dto;

import java.time.LocalDateTime;

import com.cardledger.backend.entities.Statement;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class StatementResponseDTO {

    private Long id;
    private String filename;
    private String issuer;
    private String period;
    private LocalDateTime importedAt;
    private int transactionCount;
    private Integer cutoffDay;

    public static StatementResponseDTO from(Statement statement) {
        if (statement == null) {
            return null;
        }
        return new StatementResponseDTO(
                statement.getId(),
                statement.getFilename(),
                statement.getIssuer(),
                statement.getPeriod(),
                statement.getImportedAt(),
                statement.getTransactionCount(),
                statement.getCutoffDay()
        );
    }
}
