package com.al.obstranslator.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration.
 * Access Swagger UI at: /swagger-ui.html
 * Access OpenAPI JSON at: /v3/api-docs
 */
@Configuration
public class OpenApiConfig {

        @Value("${spring.application.name:obs-translator}")
        private String applicationName;

        @Bean
        public OpenAPI customOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title(applicationName + " API")
                                                .version("1.0.0")
                                                .description("""
                                                                Translates instrument FITS header cards into standardized observation attributes.

                                                                ## Features
                                                                - **Field translation**: trivial, constant and computed fields resolved per header
                                                                - **Exposure identifiers**: time-derived exposure and detector-exposure ids
                                                                - **Batch translation**: parallel translation of up to 100 headers
                                                                - **Instrument description**: id bounds, detectors and filters for registry setup
                                                                """))
                                .tags(List.of(
                                                new Tag().name("Translation")
                                                                .description("Header translation endpoints"),
                                                new Tag().name("Instrument")
                                                                .description("Instrument description endpoints")));
        }
}
