package com.example.pricing_import.imports;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import com.example.pricing_import.classify.ClassifiedRecord;
import com.example.pricing_import.dto.imports.ImportReport;
import com.example.pricing_import.dto.imports.RowReport;
import com.example.pricing_import.extraction.ExtractionResult;
import com.example.pricing_import.loader.RawRow;
import com.example.pricing_import.standardize.StandardizedRecord;

import lombok.Getter;

/**
 * One import run. Owns the raw rows, the per-row extraction cache and exactly one terminal outcome per row.
 * Outcome bookkeeping is done by the pipeline thread; the cache and the cancel flag are shared with workers.
 */
public class ImportBatch {

    @Getter
    private final String batchId;
    @Getter
    private final String fileName;
    @Getter
    private final ImportOptions options;
    @Getter
    private final List<RawRow> rows;

    private final Map<Integer, RowOutcome> outcomes = new TreeMap<>();
    private final ConcurrentHashMap<Integer, ExtractionResult> extractionCache = new ConcurrentHashMap<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public ImportBatch(String fileName, ImportOptions options, List<RawRow> rows) {
        this(options.getBatchId() != null ? options.getBatchId() : UUID.randomUUID().toString(),
                fileName, options, rows);
    }

    public ImportBatch(String batchId, String fileName, ImportOptions options, List<RawRow> rows) {
        this.batchId = batchId;
        this.fileName = fileName;
        this.options = options;
        this.rows = List.copyOf(rows);
    }

    // --- cancellation ---

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    // --- extraction cache ---

    public Optional<ExtractionResult> cachedExtraction(int position) {
        return Optional.ofNullable(extractionCache.get(position));
    }

    /**
     * Keeps the first successful result for a row; later ones are ignored.
     */
    public void cacheExtraction(ExtractionResult result) {
        extractionCache.putIfAbsent(result.rowPosition(), result);
    }

    // --- outcomes ---

    public void resolve(RowOutcome outcome) {
        RowOutcome previous = outcomes.putIfAbsent(outcome.position(), outcome);
        if (previous != null) {
            throw new IllegalStateException("row " + outcome.position() + " already resolved as "
                    + previous.status() + " in batch " + batchId);
        }
    }

    public boolean isResolved(int position) {
        return outcomes.containsKey(position);
    }

    public Optional<RowOutcome> outcome(int position) {
        return Optional.ofNullable(outcomes.get(position));
    }

    public List<Integer> unresolvedPositions() {
        List<Integer> open = new ArrayList<>();
        for (RawRow row : rows) {
            if (!outcomes.containsKey(row.position())) {
                open.add(row.position());
            }
        }
        return open;
    }

    /**
     * Resolves every still-open row with the given rejection reason.
     */
    public void rejectUnresolved(RowReason reason, String detail) {
        for (Integer position : unresolvedPositions()) {
            resolve(RowOutcome.rejected(position, reason, detail));
        }
    }

    public ImportReport finish(ImportReport.Status status) {
        List<Integer> open = unresolvedPositions();
        if (!open.isEmpty()) {
            throw new IllegalStateException("batch " + batchId + " has unresolved rows " + open);
        }

        int accepted = 0;
        int skipped = 0;
        int updated = 0;
        int rejected = 0;
        Map<String, Integer> byReason = new TreeMap<>();
        List<RowReport> reports = new ArrayList<>(rows.size());

        for (RawRow row : rows) {
            RowOutcome o = outcomes.get(row.position());
            switch (o.status()) {
                case ACCEPTED -> accepted++;
                case DUPLICATE -> skipped++;
                case UPDATED -> updated++;
                case REJECTED -> {
                    rejected++;
                    byReason.merge(o.reason().getCode(), 1, Integer::sum);
                }
            }
            reports.add(toRowReport(o));
        }

        return ImportReport.builder()
                .batchId(batchId)
                .fileName(fileName)
                .status(status)
                .totalRows(rows.size())
                .accepted(accepted)
                .duplicateSkipped(skipped)
                .duplicateUpdated(updated)
                .rejected(rejected)
                .rejectedByReason(Collections.unmodifiableMap(byReason))
                .rows(List.copyOf(reports))
                .build();
    }

    private static RowReport toRowReport(RowOutcome o) {
        RowReport.RowReportBuilder b = RowReport.builder()
                .position(o.position())
                .status(o.status())
                .reason(o.reason())
                .detail(o.detail())
                .primaryPosition(o.primaryPosition())
                .pricingRecordId(o.pricingRecordId());
        ClassifiedRecord c = o.record();
        if (c != null) {
            StandardizedRecord r = c.record();
            b.productName(r.productName())
                    .price(r.price())
                    .currency(r.currency())
                    .unit(r.unit())
                    .warning(r.unitResolved() ? null : RowReport.UNIT_UNRESOLVABLE)
                    .category(c.category())
                    .classificationSource(c.source());
        }
        return b.build();
    }
}
