package com.example.pricing_import.extraction;

import lombok.Builder;

/**
 * Best-effort fields recovered from one raw row. Never mutated; standardization produces a new record.
 */
@Builder
public record ExtractedRecord(
        int rowPosition,
        String productName,
        String unitPrice, // raw text, parsed later
        boolean numericPrice, // unitPrice came from a numeric cell and is already canonical
        String unit,
        String categoryHint,
        String supplierSku,
        String currency,
        String supplier,
        boolean freeSample,
        double confidence) {

    public ExtractedRecord {
        if (Double.isNaN(confidence) || confidence < 0) {
            confidence = 0;
        } else if (confidence > 1) {
            confidence = 1;
        }
    }
}
