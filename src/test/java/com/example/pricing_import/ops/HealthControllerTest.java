package com.example.pricing_import.ops;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import com.example.pricing_import.entity.Supplier;
import com.example.pricing_import.extraction.ColumnMappingExtractionClient;
import com.example.pricing_import.repo.SupplierRepository;

class HealthControllerTest {

    @Test
    void health_reportsExtractionClientAndSupplierCount() {
        SupplierRepository suppliers = mock(SupplierRepository.class);
        when(suppliers.findByActiveTrue()).thenReturn(List.of(new Supplier("A", "A Ltd", "GBP")));
        HealthController controller = new HealthController(new ColumnMappingExtractionClient(), suppliers);

        ResponseEntity<?> res = controller.health();

        assertEquals(200, res.getStatusCode().value());
        Map<?, ?> body = (Map<?, ?>) res.getBody();
        assertEquals("UP", body.get("status"));
        assertEquals("ColumnMappingExtractionClient", body.get("extractionClient"));
        assertEquals(1, body.get("activeSuppliers"));
    }
}
