package com.example.pricing_import.imports;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockMultipartFile;

import com.example.pricing_import.dto.imports.ImportReport;

class PricingImportControllerTest {

    private PricingImportService importService;
    private ImportBatchRegistry registry;
    private PricingImportController controller;

    @BeforeEach
    void setUp() {
        importService = mock(PricingImportService.class);
        registry = new ImportBatchRegistry();
        controller = new PricingImportController(importService, new ImportTemplateService(),
                mock(ImportBatchSummaryService.class), registry, new PricingImportProperties());
    }

    @Test
    void importFile_passesOptionsToService() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "prices.csv", "text/csv",
                "name,price\nA,1.00\n".getBytes(StandardCharsets.UTF_8));
        ImportReport report = ImportReport.builder().batchId("b").status(ImportReport.Status.COMPLETED).build();
        when(importService.importFile(eq("prices.csv"), any(), any())).thenReturn(report);

        ResponseEntity<ImportReport> res = controller.importFile(file, " ACME ", "update", false, null);

        assertEquals(200, res.getStatusCode().value());
        assertSame(report, res.getBody());
        ArgumentCaptor<ImportOptions> options = ArgumentCaptor.forClass(ImportOptions.class);
        verify(importService).importFile(eq("prices.csv"), any(), options.capture());
        assertEquals("ACME", options.getValue().getSupplier());
        assertEquals(DuplicatePolicy.UPDATE, options.getValue().getDuplicatePolicy());
        assertEquals(false, options.getValue().isUseAiExtraction());
    }

    @Test
    void importFile_unsupportedExtension_isBadRequest() {
        MockMultipartFile file = new MockMultipartFile("file", "prices.pdf", "application/pdf", new byte[] { 1 });

        assertThrows(IllegalArgumentException.class, () -> controller.importFile(file, null, null, true, null));
        verify(importService, never()).importFile(any(), any(), any());
    }

    @Test
    void importFile_unknownPolicy_isBadRequest() {
        MockMultipartFile file = new MockMultipartFile("file", "prices.csv", "text/csv", new byte[] { 'a' });

        assertThrows(IllegalArgumentException.class, () -> controller.importFile(file, null, "merge", true, null));
    }

    @Test
    void template_listsRequiredColumns() {
        assertEquals(List.of("name", "price"), controller.template().required());
    }

    @Test
    void cancel_runningBatch_isAccepted_otherwiseNotFound() {
        ImportBatch running = new ImportBatch("f.csv", ImportOptions.builder().batchId("run-1").build(), List.of());
        registry.register(running);

        ResponseEntity<?> accepted = controller.cancel("run-1");
        ResponseEntity<?> missing = controller.cancel("nope");

        assertEquals(202, accepted.getStatusCode().value());
        assertEquals(true, running.isCancelled());
        assertEquals(404, missing.getStatusCode().value());
        assertEquals("No running batch: nope", ((Map<?, ?>) missing.getBody()).get("error"));
    }
}
