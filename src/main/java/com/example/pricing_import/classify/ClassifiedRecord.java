package com.example.pricing_import.classify;

import com.example.pricing_import.standardize.StandardizedRecord;

public record ClassifiedRecord(StandardizedRecord record, Category category, ClassificationSource source) {

    public int position() {
        return record.position();
    }
}
