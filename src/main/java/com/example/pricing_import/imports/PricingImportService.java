package com.example.pricing_import.imports;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import com.example.pricing_import.classify.CategoryClassifier;
import com.example.pricing_import.classify.ClassifiedRecord;
import com.example.pricing_import.commit.CommitFailedException;
import com.example.pricing_import.commit.CommitPlan;
import com.example.pricing_import.commit.PricingCommitter;
import com.example.pricing_import.commit.SupplierLockRegistry;
import com.example.pricing_import.dto.imports.ImportReport;
import com.example.pricing_import.extraction.ColumnMappingExtractionClient;
import com.example.pricing_import.extraction.ExtractedRecord;
import com.example.pricing_import.extraction.ExtractionClient;
import com.example.pricing_import.extraction.ExtractionService;
import com.example.pricing_import.extraction.RowExtraction;
import com.example.pricing_import.loader.FileLoader;
import com.example.pricing_import.loader.RawRow;
import com.example.pricing_import.repo.SupplierRepository;
import com.example.pricing_import.standardize.ProductStandardizer;
import com.example.pricing_import.standardize.StandardizationResult;
import com.example.pricing_import.standardize.SupplierDirectory;

/**
 * Runs one uploaded price list through load, extract, standardize, classify and commit.
 * Every loaded row ends with exactly one outcome in the report.
 */
@Service
public class PricingImportService {

    private static final Logger log = LoggerFactory.getLogger(PricingImportService.class);

    static final String LOADED = "LOADED";
    static final String EXTRACTED = "EXTRACTED";
    static final String STANDARDIZED = "STANDARDIZED";
    static final String CLASSIFIED = "CLASSIFIED";
    static final String COMMITTED = "COMMITTED";
    static final String COMMIT_FAILED = "COMMIT_FAILED";
    static final String CANCELLED = "CANCELLED";

    private final FileLoader fileLoader;
    private final ExtractionService extractionService;
    private final ExtractionClient extractionClient;
    private final ColumnMappingExtractionClient columnMappingClient;
    private final ProductStandardizer standardizer;
    private final CategoryClassifier classifier;
    private final PricingCommitter committer;
    private final SupplierLockRegistry lockRegistry;
    private final SupplierRepository supplierRepository;
    private final ImportBatchRegistry registry;
    private final ImportBatchEventService events;
    private final ImportBatchSummaryService summaries;
    private final PricingImportProperties properties;

    public PricingImportService(
            FileLoader fileLoader,
            ExtractionService extractionService,
            ExtractionClient extractionClient,
            ColumnMappingExtractionClient columnMappingClient,
            ProductStandardizer standardizer,
            CategoryClassifier classifier,
            PricingCommitter committer,
            SupplierLockRegistry lockRegistry,
            SupplierRepository supplierRepository,
            ImportBatchRegistry registry,
            ImportBatchEventService events,
            ImportBatchSummaryService summaries,
            PricingImportProperties properties) {
        this.fileLoader = fileLoader;
        this.extractionService = extractionService;
        this.extractionClient = extractionClient;
        this.columnMappingClient = columnMappingClient;
        this.standardizer = standardizer;
        this.classifier = classifier;
        this.committer = committer;
        this.lockRegistry = lockRegistry;
        this.supplierRepository = supplierRepository;
        this.registry = registry;
        this.events = events;
        this.summaries = summaries;
        this.properties = properties;
    }

    /**
     * File-level failures (unreadable, empty) propagate and produce no report.
     */
    public ImportReport importFile(String fileName, byte[] content, ImportOptions options) {
        if (options.getBatchId() != null) {
            validateBatchId(options.getBatchId());
        }
        List<RawRow> rows = fileLoader.load(fileName, content);
        ImportBatch batch = new ImportBatch(fileName, options, rows);
        return run(batch);
    }

    ImportReport run(ImportBatch batch) {
        registry.register(batch);
        try {
            summaries.open(batch);
            return runRegistered(batch);
        } finally {
            registry.unregister(batch);
        }
    }

    private ImportReport runRegistered(ImportBatch batch) {
        log.info("Import started batchId={} file={} rows={} supplier={} policy={} ai={}", batch.getBatchId(),
                batch.getFileName(), batch.getRows().size(), batch.getOptions().getSupplier(),
                batch.getOptions().getDuplicatePolicy(), batch.getOptions().isUseAiExtraction());
        ImportReport report;
        try {
            events.log(batch.getBatchId(), null, LOADED, "rows=" + batch.getRows().size());
            report = runStages(batch);
        } catch (RuntimeException e) {
            log.error("Import aborted batchId={}", batch.getBatchId(), e);
            try {
                summaries.fail(batch.getBatchId());
            } catch (RuntimeException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
        summaries.close(report);
        log.info("Import finished batchId={} status={} accepted={} duplicates={} updated={} rejected={}",
                report.getBatchId(), report.getStatus(), report.getAccepted(), report.getDuplicateSkipped(),
                report.getDuplicateUpdated(), report.getRejected());
        return report;
    }

    private ImportReport runStages(ImportBatch batch) {
        String id = batch.getBatchId();
        ImportOptions options = batch.getOptions();

        // extract
        ExtractionClient client = options.isUseAiExtraction() ? extractionClient : columnMappingClient;
        List<RowExtraction> extractions = extractionService.extractAll(batch, client);
        if (batch.isCancelled()) {
            return cancel(batch, LOADED);
        }
        List<ExtractedRecord> extracted = new ArrayList<>();
        for (RowExtraction e : extractions) {
            if (e.isOk()) {
                extracted.add(e.record());
            } else {
                batch.resolve(RowOutcome.rejected(e.rowPosition(), e.reason(), e.detail()));
            }
        }
        events.log(id, LOADED, EXTRACTED, "ok=" + extracted.size() + " rejected=" + (extractions.size()
                - extracted.size()));

        // standardize
        SupplierDirectory suppliers = SupplierDirectory.fromSuppliers(supplierRepository.findByActiveTrue());
        String declaredSupplier = options.getSupplier() != null ? options.getSupplier()
                : properties.getDefaultSupplier();
        List<ClassifiedRecord> classified = new ArrayList<>();
        int standardized = 0;
        for (ExtractedRecord record : extracted) {
            StandardizationResult result = standardizer.standardize(record, declaredSupplier, suppliers);
            if (!result.isOk()) {
                batch.resolve(RowOutcome.rejected(result.position(), result.reason(), result.detail()));
                continue;
            }
            standardized++;
            // classify
            classified.add(classifier.classify(result.record()));
        }
        events.log(id, EXTRACTED, STANDARDIZED, "ok=" + standardized);
        events.log(id, STANDARDIZED, CLASSIFIED, "records=" + classified.size());

        if (batch.isCancelled()) {
            return cancel(batch, CLASSIFIED);
        }

        // commit
        if (classified.isEmpty()) {
            events.log(id, CLASSIFIED, COMMITTED, "nothing to commit");
            return batch.finish(ImportReport.Status.COMPLETED);
        }

        Set<String> supplierKeys = new LinkedHashSet<>();
        classified.forEach(c -> supplierKeys.add(c.record().supplierKey()));
        try {
            CommitPlan plan = lockRegistry.withLocks(supplierKeys, () -> batch.isCancelled()
                    ? null
                    : committer.commit(id, classified, options.getDuplicatePolicy()));
            if (plan == null) {
                return cancel(batch, CLASSIFIED);
            }
            plan.outcomes().values().forEach(batch::resolve);
            events.log(id, CLASSIFIED, COMMITTED, "records=" + classified.size());
            return batch.finish(ImportReport.Status.COMPLETED);

        } catch (CommitFailedException e) {
            if (e.getPlan() != null) {
                for (RowOutcome planned : e.getPlan().outcomes().values()) {
                    boolean written = planned.status() == RowStatus.ACCEPTED || planned.status() == RowStatus.UPDATED;
                    batch.resolve(written ? planned.downgrade(RowReason.COMMIT_FAILED, e.getMessage()) : planned);
                }
            }
            return commitFailed(batch, e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Commit transaction failed batchId={}", id, e);
            return commitFailed(batch, e);
        }
    }

    private ImportReport commitFailed(ImportBatch batch, RuntimeException cause) {
        batch.rejectUnresolved(RowReason.COMMIT_FAILED, cause.getMessage());
        events.log(batch.getBatchId(), CLASSIFIED, COMMIT_FAILED, cause.getClass().getSimpleName());
        return batch.finish(ImportReport.Status.COMMIT_FAILED);
    }

    private ImportReport cancel(ImportBatch batch, String stage) {
        int open = batch.unresolvedPositions().size();
        log.info("Import cancelled batchId={} at {} openRows={}", batch.getBatchId(), stage, open);
        batch.rejectUnresolved(RowReason.CANCELLED, "batch cancelled");
        events.log(batch.getBatchId(), stage, CANCELLED, "openRows=" + open);
        return batch.finish(ImportReport.Status.CANCELLED);
    }

    private static void validateBatchId(String batchId) {
        if (batchId.isBlank() || batchId.length() > 36 || !batchId.matches("[A-Za-z0-9_-]+")) {
            throw new IllegalArgumentException("batchId must be 1-36 characters of letters, digits, '-' or '_'");
        }
    }
}
