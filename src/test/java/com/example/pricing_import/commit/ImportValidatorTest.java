package com.example.pricing_import.commit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.pricing_import.classify.Category;
import com.example.pricing_import.classify.ClassificationSource;
import com.example.pricing_import.classify.ClassifiedRecord;
import com.example.pricing_import.imports.RowReason;
import com.example.pricing_import.standardize.StandardizedRecord;
import com.example.pricing_import.standardize.SupplierDirectory;

class ImportValidatorTest {

    private final ImportValidator validator = new ImportValidator();
    private final SupplierDirectory suppliers = SupplierDirectory.of(List.of(
            new SupplierDirectory.SupplierRef(1L, "ACME", "Acme Ltd", "GBP")));

    @Test
    void validate_positivePriceKnownSupplier_passes() {
        assertTrue(validator.validate(record("9.99", false, "ACME"), suppliers).isEmpty());
    }

    @Test
    void validate_zeroPrice_onlyForFreeSamples() {
        assertEquals(RowReason.INVALID_PRICE,
                validator.validate(record("0.00", false, "ACME"), suppliers).get().reason());
        assertTrue(validator.validate(record("0.00", true, "ACME"), suppliers).isEmpty());
    }

    @Test
    void validate_unknownOrMissingSupplier_isRejected() {
        assertEquals(RowReason.UNKNOWN_SUPPLIER,
                validator.validate(record("1.00", false, "NOPE"), suppliers).get().reason());
        assertEquals(RowReason.UNKNOWN_SUPPLIER,
                validator.validate(record("1.00", false, null), suppliers).get().reason());
    }

    @Test
    void validate_missingCategory_isAnInternalError() {
        ClassifiedRecord noCategory = new ClassifiedRecord(record("1.00", false, "ACME").record(), null,
                ClassificationSource.UNCLASSIFIED);

        assertThrows(IllegalStateException.class, () -> validator.validate(noCategory, suppliers));
    }

    private static ClassifiedRecord record(String price, boolean freeSample, String supplier) {
        StandardizedRecord r = StandardizedRecord.builder()
                .position(2)
                .productName("Widget")
                .normalizedName("widget")
                .price(new BigDecimal(price))
                .currency("GBP")
                .unit("each")
                .unitResolved(true)
                .supplier(supplier)
                .supplierKey(supplier == null ? null : supplier.toLowerCase())
                .freeSample(freeSample)
                .confidence(0.9)
                .build();
        return new ClassifiedRecord(r, Category.TOOLS, ClassificationSource.KEYWORD_RULE);
    }
}
