package com.example.pricing_import.extraction;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Extraction client wiring.
 * - default profile: ColumnMappingExtractionClient is the only ExtractionClient
 * - real profile: RealExtractionClient (@Primary); column mapping stays available for useAiExtraction=false
 */
@Configuration
public class ExtractionClientConfig {

    @Bean
    public ColumnMappingExtractionClient columnMappingExtractionClient() {
        return new ColumnMappingExtractionClient();
    }
}
