package com.example.pricing_import.extraction;

/**
 * Adapter answer for one row. {@code record == null} is the explicit "no extraction" signal.
 */
public record ExtractionResult(int rowPosition, ExtractedRecord record) {

    public static ExtractionResult none(int rowPosition) {
        return new ExtractionResult(rowPosition, null);
    }

    public boolean extracted() {
        return record != null;
    }
}
