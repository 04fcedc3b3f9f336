package com.example.pricing_import.commit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.pricing_import.classify.ClassifiedRecord;
import com.example.pricing_import.dedup.DeduplicationResult;
import com.example.pricing_import.dedup.DuplicateDetector;
import com.example.pricing_import.dedup.DuplicateGroup;
import com.example.pricing_import.dedup.ExistingPricing;
import com.example.pricing_import.entity.PricingRecord;
import com.example.pricing_import.entity.Supplier;
import com.example.pricing_import.imports.DuplicatePolicy;
import com.example.pricing_import.imports.RowOutcome;
import com.example.pricing_import.repo.PricingRecordRepository;
import com.example.pricing_import.repo.SupplierRepository;
import com.example.pricing_import.standardize.StandardizedRecord;
import com.example.pricing_import.standardize.SupplierDirectory;

import lombok.RequiredArgsConstructor;

/**
 * Validates, deduplicates and writes one batch in a single transaction.
 * Either every accepted/updated row is written or none is.
 */
@Service
@RequiredArgsConstructor
public class PricingCommitter {

    private static final Logger log = LoggerFactory.getLogger(PricingCommitter.class);

    private final SupplierRepository supplierRepository;
    private final PricingRecordRepository pricingRecordRepository;
    private final DuplicateDetector duplicateDetector;
    private final ImportValidator validator;

    @Transactional
    public CommitPlan commit(String batchId, List<ClassifiedRecord> records, DuplicatePolicy policy) {
        SupplierDirectory suppliers = SupplierDirectory.fromSuppliers(supplierRepository.findByActiveTrue());

        Set<Long> supplierIds = new LinkedHashSet<>();
        for (ClassifiedRecord r : records) {
            suppliers.resolve(r.record().supplier()).ifPresent(ref -> supplierIds.add(ref.id()));
        }
        Map<Long, String> keyById = new HashMap<>();
        if (!supplierIds.isEmpty()) {
            for (Supplier s : supplierRepository.lockAllById(supplierIds)) {
                keyById.put(s.getSupplierId(), s.getCode().toLowerCase(Locale.ROOT));
            }
        }

        List<ExistingPricing> existing = new ArrayList<>();
        if (!supplierIds.isEmpty()) {
            for (PricingRecord p : pricingRecordRepository.findBySupplierIdIn(supplierIds)) {
                existing.add(new ExistingPricing(p.getPricingRecordId(), keyById.get(p.getSupplierId()),
                        p.getNormalizedName(), p.getUnit()));
            }
        }

        Map<Integer, RowOutcome> outcomes = new TreeMap<>();
        List<ClassifiedRecord> valid = new ArrayList<>();
        for (ClassifiedRecord r : records) {
            Optional<ImportValidator.Violation> violation = validator.validate(r, suppliers);
            if (violation.isPresent()) {
                outcomes.put(r.position(), RowOutcome.rejected(r, violation.get().reason(), violation.get().detail()));
            } else {
                valid.add(r);
            }
        }

        DeduplicationResult dedup = duplicateDetector.detect(valid, existing);

        Map<Integer, PricingRecord> toInsert = new TreeMap<>();
        Map<Integer, Long> toUpdate = new TreeMap<>();
        for (DuplicateGroup group : dedup.groups()) {
            ClassifiedRecord primary = group.primary();
            if (group.matchesExisting()) {
                if (policy == DuplicatePolicy.UPDATE) {
                    toUpdate.put(primary.position(), group.existing().id());
                    outcomes.put(primary.position(), RowOutcome.updated(primary, group.existing().id()));
                } else {
                    outcomes.put(primary.position(), RowOutcome.duplicateOfExisting(primary, group.existing().id()));
                }
            } else {
                toInsert.put(primary.position(), newRecord(batchId, primary, suppliers));
                outcomes.put(primary.position(), RowOutcome.accepted(primary, null));
            }
            for (ClassifiedRecord other : group.others()) {
                ExistingPricing match = dedup.existingMatches().get(other.position());
                outcomes.put(other.position(), match != null
                        ? RowOutcome.duplicateOfExisting(other, match.id())
                        : RowOutcome.duplicateInBatch(other, primary.position()));
            }
        }

        log.info("Commit plan batchId={} insert={} update={} rows={}", batchId, toInsert.size(), toUpdate.size(),
                records.size());

        try {
            for (Map.Entry<Integer, Long> e : toUpdate.entrySet()) {
                PricingRecord target = pricingRecordRepository.findById(e.getValue())
                        .orElseThrow(() -> new IllegalStateException("pricing record vanished: " + e.getValue()));
                applyUpdate(target, batchId, outcomes.get(e.getKey()).record());
                pricingRecordRepository.save(target);
            }
            for (Map.Entry<Integer, PricingRecord> e : toInsert.entrySet()) {
                PricingRecord saved = pricingRecordRepository.save(e.getValue());
                outcomes.put(e.getKey(), RowOutcome.accepted(outcomes.get(e.getKey()).record(),
                        saved.getPricingRecordId()));
            }
            pricingRecordRepository.flush();
        } catch (RuntimeException e) {
            log.error("Commit failed batchId={}; rolling back {} inserts and {} updates", batchId, toInsert.size(),
                    toUpdate.size(), e);
            throw new CommitFailedException("commit failed for batch " + batchId + ": " + e.getMessage(),
                    new CommitPlan(outcomes), e);
        }

        return new CommitPlan(outcomes);
    }

    private PricingRecord newRecord(String batchId, ClassifiedRecord classified, SupplierDirectory suppliers) {
        StandardizedRecord r = classified.record();
        PricingRecord p = new PricingRecord();
        p.setSupplierId(suppliers.resolve(r.supplier()).orElseThrow().id());
        p.setProductName(r.productName());
        p.setNormalizedName(r.normalizedName());
        p.setUnit(r.unit());
        p.setPrice(r.price());
        p.setCurrency(r.currency());
        p.setCategory(classified.category().name());
        p.setSku(r.supplierSku());
        p.setFreeSample(r.freeSample());
        p.setSourceBatchId(batchId);
        return p;
    }

    private void applyUpdate(PricingRecord target, String batchId, ClassifiedRecord classified) {
        StandardizedRecord r = classified.record();
        target.setPrice(r.price());
        target.setCurrency(r.currency());
        target.setCategory(classified.category().name());
        if (r.supplierSku() != null) {
            target.setSku(r.supplierSku());
        }
        target.setFreeSample(r.freeSample());
        target.setSourceBatchId(batchId);
    }
}
