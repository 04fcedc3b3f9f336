package com.example.pricing_import.standardize;

import com.example.pricing_import.imports.RowReason;

public record StandardizationResult(int position, StandardizedRecord record, RowReason reason, String detail) {

    static StandardizationResult ok(StandardizedRecord record) {
        return new StandardizationResult(record.position(), record, null, null);
    }

    static StandardizationResult rejected(int position, RowReason reason, String detail) {
        return new StandardizationResult(position, null, reason, detail);
    }

    public boolean isOk() {
        return record != null;
    }
}
