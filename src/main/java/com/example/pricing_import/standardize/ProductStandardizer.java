package com.example.pricing_import.standardize;

import java.util.Currency;
import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.example.pricing_import.extraction.ExtractedRecord;
import com.example.pricing_import.imports.RowReason;

/**
 * Normalizes names, prices, currencies and units. Pure: same input, same output.
 */
@Component
public class ProductStandardizer {

    public StandardizationResult standardize(ExtractedRecord in, String declaredSupplier, SupplierDirectory suppliers) {
        int pos = in.rowPosition();

        String name = displayName(in.productName());
        if (name == null) {
            return StandardizationResult.rejected(pos, RowReason.MISSING_PRODUCT_NAME, "product name is blank");
        }

        ParsedPrice price = in.numericPrice()
                ? PriceParser.parseNumeric(in.unitPrice())
                : PriceParser.parse(in.unitPrice());
        if (!price.isOk()) {
            return price.failure() == ParsedPrice.Failure.NEGATIVE
                    ? StandardizationResult.rejected(pos, RowReason.INVALID_PRICE,
                            "negative price: " + in.unitPrice())
                    : StandardizationResult.rejected(pos, RowReason.UNPARSEABLE_PRICE,
                            "cannot parse price: " + in.unitPrice());
        }

        String supplier = trimToNull(in.supplier());
        if (supplier == null) {
            supplier = trimToNull(declaredSupplier);
        }
        Optional<SupplierDirectory.SupplierRef> ref = suppliers.resolve(supplier);

        // extracted, then price text, then supplier default; first recognized code wins
        String[] candidates = {
                in.currency(),
                price.currencyHint(),
                ref.map(SupplierDirectory.SupplierRef::defaultCurrency).orElse(null) };
        String isoCurrency = firstIsoCurrency(candidates);
        if (isoCurrency == null) {
            String stated = firstNonBlank(candidates);
            return StandardizationResult.rejected(pos, RowReason.UNRECOGNIZED_CURRENCY,
                    stated == null ? "no currency stated and no supplier default" : "unknown currency: " + stated);
        }

        String rawUnit = trimToNull(in.unit());
        Optional<UnitOfMeasure> uom = rawUnit == null ? Optional.of(UnitOfMeasure.EACH) : UnitOfMeasure.lookup(rawUnit);
        String unit = uom.map(UnitOfMeasure::getCode).orElse(rawUnit == null ? null : rawUnit.toLowerCase(Locale.ROOT));

        String supplierKey = ref.map(SupplierDirectory.SupplierRef::key)
                .orElse(supplier == null ? null : supplier.toLowerCase(Locale.ROOT));

        return StandardizationResult.ok(StandardizedRecord.builder()
                .position(pos)
                .productName(name)
                .normalizedName(normalizedName(name))
                .price(price.amount())
                .currency(isoCurrency)
                .unit(unit)
                .unitResolved(uom.isPresent())
                .supplier(supplier)
                .supplierKey(supplierKey)
                .supplierSku(trimToNull(in.supplierSku()))
                .categoryHint(trimToNull(in.categoryHint()))
                .freeSample(in.freeSample())
                .confidence(in.confidence())
                .build());
    }

    static String displayName(String raw) {
        if (raw == null) {
            return null;
        }
        String s = raw.replaceAll("[\\s\\u00A0]+", " ").trim();
        return s.isEmpty() ? null : s;
    }

    /**
     * Matching key: lower case, punctuation removed, single spaces.
     */
    public static String normalizedName(String name) {
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}\\s]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static String firstIsoCurrency(String... candidates) {
        for (String candidate : candidates) {
            String iso = toIsoCurrency(candidate);
            if (iso != null) {
                return iso;
            }
        }
        return null;
    }

    private static String toIsoCurrency(String code) {
        if (code == null) {
            return null;
        }
        String symbol = PriceParser.currencyForSymbol(code);
        if (symbol != null) {
            return symbol;
        }
        String c = code.trim().toUpperCase(Locale.ROOT);
        if (!c.matches("[A-Z]{3}")) {
            return null;
        }
        try {
            return Currency.getInstance(c).getCurrencyCode();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return null;
    }

    private static String trimToNull(String s) {
        if (s == null) {
            return null;
        }
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
