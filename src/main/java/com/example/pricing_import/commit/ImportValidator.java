package com.example.pricing_import.commit;

import java.math.BigDecimal;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.example.pricing_import.classify.ClassifiedRecord;
import com.example.pricing_import.imports.RowReason;
import com.example.pricing_import.standardize.StandardizedRecord;
import com.example.pricing_import.standardize.SupplierDirectory;

/**
 * Final checks before a record may be written.
 */
@Component
public class ImportValidator {

    public record Violation(RowReason reason, String detail) {
    }

    public Optional<Violation> validate(ClassifiedRecord classified, SupplierDirectory suppliers) {
        StandardizedRecord r = classified.record();

        BigDecimal price = r.price();
        if (price == null || price.signum() < 0) {
            return Optional.of(new Violation(RowReason.INVALID_PRICE, "price must not be negative"));
        }
        if (price.signum() == 0 && !r.freeSample()) {
            return Optional.of(new Violation(RowReason.INVALID_PRICE, "zero price on a row not marked free sample"));
        }

        if (suppliers.resolve(r.supplier()).isEmpty()) {
            return Optional.of(new Violation(RowReason.UNKNOWN_SUPPLIER,
                    r.supplier() == null ? "no supplier on row or batch" : "unknown supplier: " + r.supplier()));
        }

        if (classified.category() == null) {
            throw new IllegalStateException("row " + r.position() + " reached validation without a category");
        }
        return Optional.empty();
    }
}
