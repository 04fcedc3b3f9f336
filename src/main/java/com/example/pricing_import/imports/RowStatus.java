package com.example.pricing_import.imports;

/**
 * Terminal status of one input row.
 */
public enum RowStatus {
    ACCEPTED,
    DUPLICATE,
    UPDATED,
    REJECTED
}
