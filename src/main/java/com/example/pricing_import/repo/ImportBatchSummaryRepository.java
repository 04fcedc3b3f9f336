package com.example.pricing_import.repo;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.pricing_import.entity.ImportBatchSummary;

@Repository
public interface ImportBatchSummaryRepository extends JpaRepository<ImportBatchSummary, Long> {
    Optional<ImportBatchSummary> findByBatchId(String batchId);
}
