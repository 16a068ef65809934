package com.cardledger.backend.services.extraction;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.cardledger.backend.dto.extraction.ExtractedTransaction;
import com.cardledger.backend.dto.extraction.PageExtraction;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Converts the extractor's loosely typed JSON into validated records. Nothing past this class
 * sees raw extractor output.
 */
@Component
@Slf4j
public class ExtractionBoundary {

    public PageExtraction toPageExtraction(JsonNode node) {
        if (node == null || node.isNull() || !node.isObject()) {
            return new PageExtraction(List.of(), null, null, null, false);
        }

        List<ExtractedTransaction> transactions = new ArrayList<>();
        JsonNode rows = node.path("transactions");
        if (rows.isArray()) {
            for (JsonNode row : rows) {
                ExtractedTransaction tx = toTransaction(row);
                if (tx != null) {
                    transactions.add(tx);
                }
            }
        }

        return new PageExtraction(
                transactions,
                cutoffDay(node.get("cutoff_day")),
                text(node.get("bank_name")),
                text(node.get("card_name")),
                false
        );
    }

    ExtractedTransaction toTransaction(JsonNode row) {
        if (row == null || !row.isObject()) {
            return null;
        }
        String description = text(row.get("description"));
        BigDecimal amount = amount(row.get("amount"));
        if (description == null || amount == null) {
            log.debug("[Extraction] dropping row without description or amount: {}", row);
            return null;
        }
        return new ExtractedTransaction(
                date(row.get("trans_date")),
                date(row.get("posting_date")),
                description,
                amount,
                row.path("is_payment").asBoolean(false)
        );
    }

    static Integer cutoffDay(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        int day;
        if (node.isIntegralNumber()) {
            day = node.asInt();
        } else if (node.isTextual()) {
            try {
                day = Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return day >= 1 && day <= 31 ? day : null;
    }

    static BigDecimal amount(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            String raw = node.asText().replace(",", "").trim();
            if (raw.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(raw);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    // Unparseable dates become null; the row itself is kept.
    static LocalDate date(JsonNode node) {
        String raw = text(node);
        if (raw == null) {
            return null;
        }
        try {
            return LocalDate.parse(raw.length() > 10 ? raw.substring(0, 10) : raw);
        } catch (DateTimeParseException e) {
            log.debug("[Extraction] unparseable date '{}'", raw);
            return null;
        }
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String v = node.asText().trim();
        return v.isEmpty() ? null : v;
    }
}
