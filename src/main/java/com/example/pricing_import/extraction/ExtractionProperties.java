package com.example.pricing_import.extraction;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "extraction")
public class ExtractionProperties {

    // retry / backoff
    @Min(1)
    private int maxAttempts = 3;
    @NotNull
    private Duration initialBackoff = Duration.ofMillis(500);
    @DecimalMin("1.0")
    private double backoffMultiplier = 2.0;
    @NotNull
    private Duration maxBackoff = Duration.ofSeconds(8);

    // worker pool
    @Min(1)
    @Max(32)
    private int concurrency = 4;
    @Min(1)
    @Max(200)
    private int rowsPerRequest = 1;

    /** Per adapter call, not per batch. */
    @NotNull
    private Duration callTimeout = Duration.ofSeconds(60);

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceFloor = 0.3;

    // remote model endpoint (profile "real")
    private String apiBase = "https://api.openai.com/v1";
    private String apiKey;
    private String model = "gpt-4o-mini";

    public boolean isApiKeyConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
