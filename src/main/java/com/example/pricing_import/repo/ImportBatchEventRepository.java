package com.example.pricing_import.repo;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.pricing_import.entity.ImportBatchEvent;

@Repository
public interface ImportBatchEventRepository extends JpaRepository<ImportBatchEvent, Long> {
    List<ImportBatchEvent> findByBatchIdOrderByEventIdAsc(String batchId);
}
