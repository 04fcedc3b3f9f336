package com.example.pricing_import.standardize;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.example.pricing_import.entity.Supplier;

/**
 * Read-only snapshot of active suppliers, addressable by code or name (case-insensitive).
 */
public final class SupplierDirectory {

    public record SupplierRef(Long id, String code, String name, String defaultCurrency) {

        /** Dedup/commit key: the supplier code, lower case. */
        public String key() {
            return code.toLowerCase(Locale.ROOT);
        }
    }

    private final Map<String, SupplierRef> byKey = new HashMap<>();

    private SupplierDirectory(Collection<SupplierRef> refs) {
        for (SupplierRef ref : refs) {
            byKey.putIfAbsent(normalize(ref.code()), ref);
        }
        // names only where they do not shadow a code
        for (SupplierRef ref : refs) {
            if (ref.name() != null) {
                byKey.putIfAbsent(normalize(ref.name()), ref);
            }
        }
    }

    public static SupplierDirectory of(Collection<SupplierRef> refs) {
        return new SupplierDirectory(refs);
    }

    public static SupplierDirectory fromSuppliers(Collection<Supplier> suppliers) {
        return new SupplierDirectory(suppliers.stream()
                .filter(Supplier::isActive)
                .map(s -> new SupplierRef(s.getSupplierId(), s.getCode(), s.getName(), s.getDefaultCurrency()))
                .toList());
    }

    public static SupplierDirectory empty() {
        return new SupplierDirectory(List.of());
    }

    public Optional<SupplierRef> resolve(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byKey.get(normalize(identifier)));
    }

    private static String normalize(String s) {
        return s.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
