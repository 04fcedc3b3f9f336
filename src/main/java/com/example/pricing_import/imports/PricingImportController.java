package com.example.pricing_import.imports;

import java.io.IOException;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.example.pricing_import.dto.imports.ImportReport;
import com.example.pricing_import.dto.imports.ImportTemplate;
import com.example.pricing_import.loader.FileFormat;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/pricing-import")
@RequiredArgsConstructor
public class PricingImportController {

    private final PricingImportService importService;
    private final ImportTemplateService templateService;
    private final ImportBatchSummaryService summaryService;
    private final ImportBatchRegistry registry;
    private final PricingImportProperties properties;

    /**
     * POST /pricing-import/import
     * Content-Type: multipart/form-data
     * Body: file=@prices.xlsx [supplier=ACME] [duplicatePolicy=SKIP|UPDATE] [useAiExtraction=true] [batchId=...]
     */
    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportReport> importFile(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "supplier", required = false) String supplier,
            @RequestParam(value = "duplicatePolicy", required = false) String duplicatePolicy,
            @RequestParam(value = "useAiExtraction", defaultValue = "true") boolean useAiExtraction,
            @RequestParam(value = "batchId", required = false) String batchId) throws IOException {

        String fileName = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload";
        String extension = FileFormat.extensionOf(fileName);
        if (!extension.isEmpty() && !FileFormat.isSupportedExtension(extension)) {
            throw new IllegalArgumentException("Unsupported file type: ." + extension
                    + " (expected .xlsx, .xls, .csv, .tsv or .txt)");
        }

        ImportOptions options = ImportOptions.builder()
                .batchId(batchId == null || batchId.isBlank() ? null : batchId.trim())
                .supplier(supplier == null || supplier.isBlank() ? null : supplier.trim())
                .duplicatePolicy(DuplicatePolicy.parse(duplicatePolicy, properties.getDuplicatePolicy()))
                .useAiExtraction(useAiExtraction)
                .build();

        return ResponseEntity.ok(importService.importFile(fileName, file.getBytes(), options));
    }

    /**
     * GET /pricing-import/import/template
     */
    @GetMapping("/import/template")
    public ImportTemplate template() {
        return templateService.template();
    }

    /**
     * GET /pricing-import/batches/{batchId}
     */
    @GetMapping("/batches/{batchId}")
    public ResponseEntity<?> batch(@PathVariable String batchId) {
        return summaryService.find(batchId)
                .<ResponseEntity<?>>map(s -> ResponseEntity.ok(Map.of(
                        "batchId", s.getBatchId(),
                        "fileName", s.getFileName() != null ? s.getFileName() : "",
                        "status", s.getStatus(),
                        "totalRows", s.getTotalRows(),
                        "accepted", s.getAcceptedCount(),
                        "duplicateSkipped", s.getDuplicateSkippedCount(),
                        "duplicateUpdated", s.getDuplicateUpdatedCount(),
                        "rejected", s.getRejectedCount(),
                        "createdAt", s.getCreatedAt().toString(),
                        "finishedAt", s.getFinishedAt() != null ? s.getFinishedAt().toString() : "")))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Batch not found: " + batchId)));
    }

    /**
     * POST /pricing-import/batches/{batchId}/cancel
     */
    @PostMapping("/batches/{batchId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String batchId) {
        if (registry.cancel(batchId)) {
            return ResponseEntity.accepted().body(Map.of("batchId", batchId, "status", "CANCELLING"));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "No running batch: " + batchId));
    }
}
