package com.example.pricing_import.imports;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "pricing-import")
public class PricingImportProperties {

    /** Below this record confidence the AI category hint is ignored. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double hintConfidenceFloor = 0.5;

    /** Name similarity at or above which two rows of one supplier and unit are the same product. */
    @DecimalMin("0.5")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.88;

    @NotNull
    private DuplicatePolicy duplicatePolicy = DuplicatePolicy.SKIP;

    /** Used when neither the request nor the row names a supplier. */
    private String defaultSupplier;
}
