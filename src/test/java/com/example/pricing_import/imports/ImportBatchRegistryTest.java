package com.example.pricing_import.imports;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

class ImportBatchRegistryTest {

    private final ImportBatchRegistry registry = new ImportBatchRegistry();

    @Test
    void register_sameIdTwice_isRejectedAndKeepsFirst() {
        ImportBatch first = batch("weekly-acme");
        ImportBatch second = batch("weekly-acme");
        registry.register(first);

        assertThatThrownBy(() -> registry.register(second))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("weekly-acme");
        assertThat(registry.find("weekly-acme")).containsSame(first);
    }

    @Test
    void unregister_onlyRemovesTheSameBatch() {
        ImportBatch first = batch("b1");
        registry.register(first);
        registry.unregister(batch("b1"));

        assertThat(registry.find("b1")).containsSame(first);

        registry.unregister(first);
        assertThat(registry.cancel("b1")).isFalse();
    }

    private static ImportBatch batch(String id) {
        return new ImportBatch("f.csv", ImportOptions.builder().batchId(id).build(), List.of());
    }
}
