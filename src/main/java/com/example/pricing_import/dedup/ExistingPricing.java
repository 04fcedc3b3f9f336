package com.example.pricing_import.dedup;

/**
 * Read-only view of a committed pricing record, as far as duplicate matching needs it.
 */
public record ExistingPricing(Long id, String supplierKey, String normalizedName, String unit) {
}
