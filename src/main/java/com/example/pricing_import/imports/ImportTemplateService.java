package com.example.pricing_import.imports;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.example.pricing_import.classify.Category;
import com.example.pricing_import.dto.imports.ImportTemplate;

/**
 * Describes the standard price list layout. Other layouts still import through AI extraction.
 */
@Service
public class ImportTemplateService {

    public ImportTemplate template() {
        Map<String, Object> example = new LinkedHashMap<>();
        example.put("name", "Cat6 Ethernet Cable");
        example.put("code", "CAT6-305M");
        example.put("price", new BigDecimal("125.50"));
        example.put("currency", "GBP");
        example.put("unit", "box");
        example.put("category", Category.CABLING.getDisplayName());
        example.put("supplier", "Supplier Name");
        example.put("part_number", "PART123");
        example.put("free_sample", false);
        example.put("description", "305m box of Cat6 cable");

        return new ImportTemplate(
                List.copyOf(example.keySet()),
                List.of("name", "price"),
                List.of("code", "currency", "unit", "category", "supplier", "part_number", "free_sample",
                        "description"),
                List.of(example),
                List.of(
                        "File can be Excel (.xlsx, .xls) or delimited text (.csv, .tsv, .txt)",
                        "Column names can be in any order; rows above the header are ignored",
                        "AI extraction handles non-standard layouts",
                        "Prices may use either 1,234.56 or 1.234,56 notation",
                        "Currency defaults to the supplier's configured currency",
                        "Unit defaults to each"));
    }
}
