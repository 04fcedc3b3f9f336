package com.example.pricing_import.dedup;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.pricing_import.classify.Category;
import com.example.pricing_import.classify.ClassificationSource;
import com.example.pricing_import.classify.ClassifiedRecord;
import com.example.pricing_import.imports.PricingImportProperties;
import com.example.pricing_import.standardize.StandardizedRecord;

class DuplicateDetectorTest {

    private final DuplicateDetector detector = new DuplicateDetector(new PricingImportProperties());

    @Test
    void detect_identicalKeys_formOneGroupWithEarliestPrimaryOnTie() {
        DeduplicationResult result = detector.detect(List.of(
                record(2, "cat6 cable", "acme", "m", 0.9),
                record(3, "cat6 cable", "acme", "m", 0.9)), List.of());

        assertThat(result.groups()).hasSize(1);
        assertThat(result.groups().get(0).primary().position()).isEqualTo(2);
        assertThat(result.groups().get(0).others()).extracting(ClassifiedRecord::position).containsExactly(3);
    }

    @Test
    void detect_primaryIsHighestConfidence() {
        DeduplicationResult result = detector.detect(List.of(
                record(2, "cat6 cable", "acme", "m", 0.6),
                record(3, "cat6 cable", "acme", "m", 0.95)), List.of());

        assertThat(result.groups().get(0).primary().position()).isEqualTo(3);
    }

    @Test
    void detect_similarityIsTransitive() {
        // abcd~abce 0.909, abce~abfe 0.909, abcd~abfe 0.818 (below 0.88)
        DeduplicationResult result = detector.detect(List.of(
                record(2, "widget abcd", "acme", "each", 0.9),
                record(3, "widget abce", "acme", "each", 0.9),
                record(4, "widget abfe", "acme", "each", 0.9)), List.of());

        assertThat(result.groups()).hasSize(1);
        assertThat(result.groups().get(0).others()).extracting(ClassifiedRecord::position).containsExactly(3, 4);
    }

    @Test
    void detect_differentSupplierOrUnit_neverGroup() {
        DeduplicationResult result = detector.detect(List.of(
                record(2, "cat6 cable", "acme", "m", 0.9),
                record(3, "cat6 cable", "other", "m", 0.9),
                record(4, "cat6 cable", "acme", "box", 0.9)), List.of());

        assertThat(result.groups()).hasSize(3);
    }

    @Test
    void detect_matchesExistingRecords() {
        ExistingPricing existing = new ExistingPricing(77L, "acme", "cat6 cable", "m");

        DeduplicationResult result = detector.detect(List.of(
                record(2, "cat6 cable", "acme", "m", 0.9),
                record(3, "cat6 cables", "acme", "m", 0.8),
                record(4, "rj45 plug", "acme", "each", 0.9)), List.of(existing));

        assertThat(result.groups()).hasSize(2);
        DuplicateGroup cable = result.groups().get(0);
        assertThat(cable.primary().position()).isEqualTo(2);
        assertThat(cable.existing()).isEqualTo(existing);
        assertThat(result.existingMatches()).containsEntry(3, existing);
        assertThat(result.groups().get(1).matchesExisting()).isFalse();
    }

    @Test
    void detect_groupsOrderedByPrimaryPosition() {
        DeduplicationResult result = detector.detect(List.of(
                record(5, "b item", "acme", "each", 0.9),
                record(2, "a item", "acme", "each", 0.9)), List.of());

        assertThat(result.primaries()).extracting(ClassifiedRecord::position).containsExactly(2, 5);
    }

    private static ClassifiedRecord record(int pos, String name, String supplier, String unit, double confidence) {
        StandardizedRecord r = StandardizedRecord.builder()
                .position(pos)
                .productName(name)
                .normalizedName(name)
                .price(new BigDecimal("1.00"))
                .currency("GBP")
                .unit(unit)
                .unitResolved(true)
                .supplier(supplier)
                .supplierKey(supplier)
                .confidence(confidence)
                .build();
        return new ClassifiedRecord(r, Category.UNCLASSIFIED, ClassificationSource.UNCLASSIFIED);
    }
}
