package com.example.pricing_import.ops;

import java.time.Instant;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.pricing_import.extraction.ExtractionClient;
import com.example.pricing_import.repo.SupplierRepository;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final ExtractionClient extractionClient;
    private final SupplierRepository supplierRepository;

    @GetMapping
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "extractionClient", extractionClient.getClass().getSimpleName(),
                "activeSuppliers", supplierRepository.findByActiveTrue().size(),
                "timestamp", Instant.now().toString()));
    }
}
