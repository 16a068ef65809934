package com.cardledger.backend.services.extraction;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.cardledger.backend.services.classification.CategoryLabeler;
import com.cardledger.backend.services.classification.DefaultCategoryLabeler;

import lombok.extern.slf4j.Slf4j;

/**
 * Fallback collaborators, replaced by any application-provided bean.
 */
@Configuration
@Slf4j
public class ExtractionConfiguration {

    @Bean
    @ConditionalOnMissingBean(PageExtractor.class)
    public PageExtractor disabledPageExtractor() {
        log.info("[Extraction] No PageExtractor provided; imports will report every page as failed");
        return new DisabledPageExtractor();
    }

    @Bean
    @ConditionalOnMissingBean(CategoryLabeler.class)
    public CategoryLabeler defaultCategoryLabeler() {
        return new DefaultCategoryLabeler();
    }
}
