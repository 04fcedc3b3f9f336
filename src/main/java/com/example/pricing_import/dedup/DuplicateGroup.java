package com.example.pricing_import.dedup;

import java.util.List;

import com.example.pricing_import.classify.ClassifiedRecord;

/**
 * Rows judged to be the same product.
 *
 * @param existing committed record the primary matches, or null
 */
public record DuplicateGroup(ClassifiedRecord primary, List<ClassifiedRecord> others, ExistingPricing existing) {

    public DuplicateGroup {
        others = List.copyOf(others);
    }

    public boolean matchesExisting() {
        return existing != null;
    }
}
