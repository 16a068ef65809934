package com.cardledger.backend.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "cardledger.extraction")
public record ExtractionProperties(
        Integer renderDpi,
        Integer maxPages,
        Duration pageTimeout,
        Integer corePoolSize,
        Integer maxPoolSize
) {
    public ExtractionProperties {
        if (renderDpi == null) {
            renderDpi = 150;
        }
        if (maxPages == null) {
            maxPages = 50;
        }
        if (pageTimeout == null) {
            pageTimeout = Duration.ofSeconds(90);
        }
        if (corePoolSize == null) {
            corePoolSize = 2;
        }
        if (maxPoolSize == null) {
            maxPoolSize = 4;
        }
    }

    public static ExtractionProperties defaults() {
        return new ExtractionProperties(null, null, null, null, null);
    }
}
