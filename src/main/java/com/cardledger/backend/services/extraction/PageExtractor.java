package com.cardledger.backend.services.extraction;

import com.cardledger.backend.dto.extraction.RenderedPage;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * External extraction service (OCR / LLM). Returns the raw JSON it produced for one page:
 *
 * <pre>
 * {"transactions": [{"trans_date": "2024-05-03", "posting_date": "2024-05-05",
 *                    "description": "...", "amount": 120.50, "is_payment": false}],
 *  "cutoff_day": 20, "bank_name": "...", "card_name": "..."}
 * </pre>
 *
 * Implementations own their timeouts and retries.
 */
public interface PageExtractor {

    JsonNode extract(RenderedPage page);
}
