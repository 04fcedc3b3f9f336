package com.example.pricing_import.dto.imports;

import java.util.List;
import java.util.Map;

public record ImportTemplate(
        List<String> columns,
        List<String> required,
        List<String> optional,
        List<Map<String, Object>> example,
        List<String> notes) {
}
