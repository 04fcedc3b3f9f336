package com.example.pricing_import.imports;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.example.pricing_import.classify.Category;
import com.example.pricing_import.classify.ClassificationSource;
import com.example.pricing_import.classify.ClassifiedRecord;
import com.example.pricing_import.dto.imports.ImportReport;
import com.example.pricing_import.dto.imports.RowReport;
import com.example.pricing_import.extraction.ExtractedRecord;
import com.example.pricing_import.extraction.ExtractionResult;
import com.example.pricing_import.loader.RawRow;
import com.example.pricing_import.standardize.StandardizedRecord;

class ImportBatchTest {

    private ImportBatch batch() {
        return new ImportBatch("f.csv", ImportOptions.builder().build(), List.of(
                new RawRow(2, Map.of("a", "1")),
                new RawRow(3, Map.of("a", "2")),
                new RawRow(5, Map.of("a", "3"))));
    }

    @Test
    void resolve_twice_isRejected() {
        ImportBatch batch = batch();
        batch.resolve(RowOutcome.rejected(2, RowReason.LOW_CONFIDENCE, null));

        assertThatThrownBy(() -> batch.resolve(RowOutcome.rejected(2, RowReason.CANCELLED, null)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void finish_withOpenRows_isRejected() {
        ImportBatch batch = batch();
        batch.resolve(RowOutcome.rejected(2, RowReason.LOW_CONFIDENCE, null));

        assertThatThrownBy(() -> batch.finish(ImportReport.Status.COMPLETED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("[3, 5]");
    }

    @Test
    void finish_countsByStatusAndReason_inFileOrder() {
        ImportBatch batch = batch();
        batch.resolve(RowOutcome.rejected(5, RowReason.EXTRACTION_FAILED, "x"));
        batch.rejectUnresolved(RowReason.CANCELLED, "stop");

        ImportReport report = batch.finish(ImportReport.Status.CANCELLED);

        assertThat(report.getTotalRows()).isEqualTo(3);
        assertThat(report.getRejected()).isEqualTo(3);
        assertThat(report.getRejectedByReason()).containsEntry("cancelled", 2).containsEntry("extraction_failed", 1);
        assertThat(report.getRows()).extracting(r -> r.getPosition()).containsExactly(2, 3, 5);
        assertThat(report.getStatus()).isEqualTo(ImportReport.Status.CANCELLED);
    }

    @Test
    void finish_unresolvedUnit_isReportedAsWarning() {
        ImportBatch batch = batch();
        batch.resolve(RowOutcome.accepted(classified(2, "furlong", false), 10L));
        batch.resolve(RowOutcome.accepted(classified(3, "m", true), 11L));
        batch.rejectUnresolved(RowReason.LOW_CONFIDENCE, null);

        ImportReport report = batch.finish(ImportReport.Status.COMPLETED);

        assertThat(report.getRows().get(0).getUnit()).isEqualTo("furlong");
        assertThat(report.getRows().get(0).getWarning()).isEqualTo(RowReport.UNIT_UNRESOLVABLE);
        assertThat(report.getRows().get(1).getWarning()).isNull();
        assertThat(report.getAccepted()).isEqualTo(2);
    }

    @Test
    void batchId_comesFromOptionsWhenGiven() {
        ImportBatch batch = new ImportBatch("f.csv", ImportOptions.builder().batchId("my-batch").build(), List.of());

        assertThat(batch.getBatchId()).isEqualTo("my-batch");
    }

    @Test
    void cacheExtraction_keepsFirstResult() {
        ImportBatch batch = batch();
        batch.cacheExtraction(ExtractionResult.none(2));
        batch.cacheExtraction(new ExtractionResult(2,
                ExtractedRecord.builder().rowPosition(2).productName("x").build()));

        assertThat(batch.cachedExtraction(2)).get().matches(r -> !r.extracted());
    }

    private static ClassifiedRecord classified(int pos, String unit, boolean unitResolved) {
        StandardizedRecord r = StandardizedRecord.builder()
                .position(pos)
                .productName("Cable " + pos)
                .normalizedName("cable " + pos)
                .price(new BigDecimal("2.00"))
                .currency("GBP")
                .unit(unit)
                .unitResolved(unitResolved)
                .supplier("ACME")
                .supplierKey("acme")
                .confidence(0.9)
                .build();
        return new ClassifiedRecord(r, Category.CABLING, ClassificationSource.KEYWORD_RULE);
    }
}
