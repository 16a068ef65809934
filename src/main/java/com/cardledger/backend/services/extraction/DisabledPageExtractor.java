package com.cardledger.backend.services.extraction;

import com.cardledger.backend.dto.extraction.RenderedPage;
import com.fasterxml.jackson.databind.JsonNode;

public class DisabledPageExtractor implements PageExtractor {

    @Override
    public JsonNode extract(RenderedPage page) {
        throw new IllegalStateException("No page extractor configured. Register a PageExtractor bean to enable imports");
    }
}
