package com.example.pricing_import.extraction;

import com.example.pricing_import.imports.RowReason;

/**
 * Pipeline-side outcome of extraction for one row: a usable record or a rejection reason.
 */
public record RowExtraction(int rowPosition, ExtractedRecord record, RowReason reason, String detail) {

    public static RowExtraction ok(ExtractedRecord record) {
        return new RowExtraction(record.rowPosition(), record, null, null);
    }

    public static RowExtraction rejected(int rowPosition, RowReason reason, String detail) {
        return new RowExtraction(rowPosition, null, reason, detail);
    }

    public boolean isOk() {
        return record != null && reason == null;
    }
}
