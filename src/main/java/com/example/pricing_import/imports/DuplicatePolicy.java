package com.example.pricing_import.imports;

import java.util.Locale;

/**
 * What to do when a batch row matches an already committed record.
 */
public enum DuplicatePolicy {
    SKIP,
    UPDATE;

    public static DuplicatePolicy parse(String value, DuplicatePolicy fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown duplicatePolicy: " + value + " (expected SKIP or UPDATE)", e);
        }
    }
}
