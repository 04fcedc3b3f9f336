package com.example.pricing_import.imports;

import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.pricing_import.dto.imports.ImportReport;
import com.example.pricing_import.entity.ImportBatchSummary;
import com.example.pricing_import.repo.ImportBatchSummaryRepository;

import lombok.RequiredArgsConstructor;

/**
 * Persists one summary row per batch: RUNNING while the pipeline works, then the final counts.
 */
@Service
@RequiredArgsConstructor
public class ImportBatchSummaryService {

    public static final String RUNNING = "RUNNING";
    public static final String FAILED = "FAILED";

    private final ImportBatchSummaryRepository repo;

    public void open(ImportBatch batch) {
        if (repo.findByBatchId(batch.getBatchId()).isPresent()) {
            throw new IllegalStateException("Batch id already used: " + batch.getBatchId());
        }
        ImportBatchSummary s = new ImportBatchSummary();
        s.setBatchId(batch.getBatchId());
        s.setFileName(batch.getFileName());
        s.setSupplier(batch.getOptions().getSupplier());
        s.setDuplicatePolicy(batch.getOptions().getDuplicatePolicy().name());
        s.setStatus(RUNNING);
        s.setTotalRows(batch.getRows().size());
        repo.save(s);
    }

    @Transactional
    public void close(ImportReport report) {
        ImportBatchSummary s = repo.findByBatchId(report.getBatchId())
                .orElseThrow(() -> new IllegalStateException("No summary for batch " + report.getBatchId()));
        s.setStatus(report.getStatus().name());
        s.setTotalRows(report.getTotalRows());
        s.setAcceptedCount(report.getAccepted());
        s.setDuplicateSkippedCount(report.getDuplicateSkipped());
        s.setDuplicateUpdatedCount(report.getDuplicateUpdated());
        s.setRejectedCount(report.getRejected());
        s.setFinishedAt(LocalDateTime.now());
        repo.save(s);
    }

    /**
     * Marks a batch that aborted with an unexpected error; counts stay as they were.
     */
    @Transactional
    public void fail(String batchId) {
        repo.findByBatchId(batchId).ifPresent(s -> {
            s.setStatus(FAILED);
            s.setFinishedAt(LocalDateTime.now());
            repo.save(s);
        });
    }

    public Optional<ImportBatchSummary> find(String batchId) {
        return repo.findByBatchId(batchId);
    }
}
