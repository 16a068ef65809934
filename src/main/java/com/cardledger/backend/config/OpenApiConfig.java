package com.cardledger.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI cardLedgerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("CardLedger API")
                        .description("Credit-card statement import: duplicate checks, review and commit.")
                        .version("v1"));
    }
}
