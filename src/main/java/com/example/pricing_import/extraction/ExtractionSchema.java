package com.example.pricing_import.extraction;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.example.pricing_import.classify.Category;

/**
 * Target fields an extraction request asks for, with a short description of each.
 */
public record ExtractionSchema(Map<String, String> fields, List<String> categoryNames) {

    public static final String PRODUCT_NAME = "product_name";
    public static final String UNIT_PRICE = "unit_price";
    public static final String UNIT = "unit";
    public static final String CATEGORY_HINT = "category_hint";
    public static final String SUPPLIER_SKU = "supplier_sku";
    public static final String CURRENCY = "currency";
    public static final String SUPPLIER = "supplier";
    public static final String FREE_SAMPLE = "free_sample";

    public ExtractionSchema {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        categoryNames = List.copyOf(categoryNames);
    }

    public static ExtractionSchema standard() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(PRODUCT_NAME, "Product name as written by the supplier");
        fields.put(UNIT_PRICE, "Unit price exactly as shown, including symbols and separators");
        fields.put(UNIT, "Unit of measure (each, m, box, ...)");
        fields.put(CATEGORY_HINT, "Best matching category from the list, if any");
        fields.put(SUPPLIER_SKU, "Supplier SKU / product code / part number");
        fields.put(CURRENCY, "ISO-4217 currency code if stated");
        fields.put(SUPPLIER, "Supplier or vendor name if stated on the row");
        fields.put(FREE_SAMPLE, "true only if the row is explicitly a free sample");
        List<String> categories = Arrays.stream(Category.values())
                .filter(c -> c != Category.UNCLASSIFIED)
                .map(Category::getDisplayName)
                .toList();
        return new ExtractionSchema(fields, categories);
    }
}
