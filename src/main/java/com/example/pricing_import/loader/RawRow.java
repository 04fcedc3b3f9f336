package com.example.pricing_import.loader;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One data row of an uploaded file.
 *
 * @param position 1-based row number in the source file
 * @param cells    column label to cell value (String, BigDecimal or null), in column order
 */
public record RawRow(int position, Map<String, Object> cells) {

    public RawRow {
        cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }

    /**
     * Cell value as text, or null when blank.
     */
    public String text(String label) {
        return asText(cells.get(label));
    }

    /**
     * True when the cell holds a number read from a workbook rather than text.
     */
    public boolean isNumeric(String label) {
        return cells.get(label) instanceof BigDecimal;
    }

    static String asText(Object value) {
        if (value == null) {
            return null;
        }
        String s = value instanceof BigDecimal bd ? bd.toPlainString() : value.toString().trim();
        return s.isEmpty() ? null : s;
    }
}
