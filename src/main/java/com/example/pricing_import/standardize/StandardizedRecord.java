package com.example.pricing_import.standardize;

import java.math.BigDecimal;

import lombok.Builder;

/**
 * Extracted record after normalization.
 *
 * @param supplier     supplier identifier as given (row or batch), may be null
 * @param supplierKey  resolved supplier code (lower case), or the lower-cased identifier when unknown
 * @param unitResolved false when the unit did not match the vocabulary and was passed through
 */
@Builder(toBuilder = true)
public record StandardizedRecord(
        int position,
        String productName,
        String normalizedName,
        BigDecimal price,
        String currency,
        String unit,
        boolean unitResolved,
        String supplier,
        String supplierKey,
        String supplierSku,
        String categoryHint,
        boolean freeSample,
        double confidence) {
}
