package com.example.pricing_import.repo;

import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.pricing_import.entity.PricingRecord;

@Repository
public interface PricingRecordRepository extends JpaRepository<PricingRecord, Long> {

    List<PricingRecord> findBySupplierIdIn(Collection<Long> supplierIds);

    List<PricingRecord> findBySourceBatchId(String sourceBatchId);

    long countBySupplierId(Long supplierId);
}
