package com.example.pricing_import.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.example.pricing_import.loader.RawRow;

/**
 * Deterministic extraction for files whose headers use common column names.
 * Used when the remote model is disabled, or when the caller asks for the standard-format path.
 */
public class ColumnMappingExtractionClient implements ExtractionClient {

    private static final double FULL_CONFIDENCE = 1.0;
    private static final double GUESSED_PRICE_CONFIDENCE = 0.5;

    private static final Pattern PRICE_LIKE = Pattern.compile("^[^0-9]{0,4}[0-9][0-9.,' ]*[^0-9]{0,4}$");

    private static final Map<String, Set<String>> ALIASES = Map.of(
            ExtractionSchema.PRODUCT_NAME, Set.of("name", "product", "product_name", "item", "item_name",
                    "description", "product_description", "article"),
            ExtractionSchema.UNIT_PRICE, Set.of("price", "unit_price", "cost", "base_price", "selling_price",
                    "list_price", "net_price", "price_each"),
            ExtractionSchema.UNIT, Set.of("unit", "uom", "unit_of_measure", "units"),
            ExtractionSchema.CATEGORY_HINT, Set.of("category", "type", "product_type", "group"),
            ExtractionSchema.SUPPLIER_SKU, Set.of("sku", "code", "part_number", "product_code", "item_code",
                    "part_no", "article_number"),
            ExtractionSchema.CURRENCY, Set.of("currency", "ccy", "currency_code"),
            ExtractionSchema.SUPPLIER, Set.of("supplier", "vendor", "manufacturer"),
            ExtractionSchema.FREE_SAMPLE, Set.of("free_sample", "sample", "is_free_sample"));

    @Override
    public List<ExtractionResult> extract(List<RawRow> rows, ExtractionSchema schema) {
        List<ExtractionResult> results = new ArrayList<>(rows.size());
        for (RawRow row : rows) {
            results.add(extractRow(row));
        }
        return results;
    }

    private ExtractionResult extractRow(RawRow row) {
        String name = field(row, ExtractionSchema.PRODUCT_NAME);
        if (name == null) {
            return ExtractionResult.none(row.position());
        }

        double confidence = FULL_CONFIDENCE;
        String priceLabel = label(row, ExtractionSchema.UNIT_PRICE);
        if (priceLabel == null) {
            // no recognizable price column: take the last price-looking cell
            priceLabel = lastPriceLikeLabel(row);
            confidence = GUESSED_PRICE_CONFIDENCE;
        }
        if (priceLabel == null) {
            return ExtractionResult.none(row.position());
        }

        String freeSample = field(row, ExtractionSchema.FREE_SAMPLE);

        ExtractedRecord record = ExtractedRecord.builder()
                .rowPosition(row.position())
                .productName(name)
                .unitPrice(row.text(priceLabel))
                .numericPrice(row.isNumeric(priceLabel))
                .unit(field(row, ExtractionSchema.UNIT))
                .categoryHint(field(row, ExtractionSchema.CATEGORY_HINT))
                .supplierSku(field(row, ExtractionSchema.SUPPLIER_SKU))
                .currency(field(row, ExtractionSchema.CURRENCY))
                .supplier(field(row, ExtractionSchema.SUPPLIER))
                .freeSample(isTrue(freeSample))
                .confidence(confidence)
                .build();
        return new ExtractionResult(row.position(), record);
    }

    private String field(RawRow row, String schemaField) {
        String label = label(row, schemaField);
        return label == null ? null : row.text(label);
    }

    /**
     * First column whose normalized label is an alias of the field and whose cell is not blank.
     */
    private String label(RawRow row, String schemaField) {
        Set<String> aliases = ALIASES.get(schemaField);
        for (String label : row.cells().keySet()) {
            if (aliases.contains(normalizeLabel(label)) && row.text(label) != null) {
                return label;
            }
        }
        return null;
    }

    private String lastPriceLikeLabel(RawRow row) {
        String found = null;
        for (String label : row.cells().keySet()) {
            String text = row.text(label);
            if (text != null && (row.isNumeric(label) || PRICE_LIKE.matcher(text).matches())) {
                found = label;
            }
        }
        return found;
    }

    static String normalizeLabel(String label) {
        return label.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_|_$", "");
    }

    private static boolean isTrue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("yes") || v.equals("y") || v.equals("1");
    }
}
