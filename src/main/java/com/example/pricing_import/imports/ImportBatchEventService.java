package com.example.pricing_import.imports;

import java.time.LocalDateTime;

import org.springframework.stereotype.Service;

import com.example.pricing_import.entity.ImportBatchEvent;
import com.example.pricing_import.repo.ImportBatchEventRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class ImportBatchEventService {

    private final ImportBatchEventRepository repo;

    public void log(String batchId, String fromStage, String toStage, String detail) {
        ImportBatchEvent ev = new ImportBatchEvent();
        ev.setBatchId(batchId);
        ev.setFromStage(fromStage);
        ev.setToStage(toStage);
        ev.setDetail(detail);
        ev.setActor("SYSTEM");
        ev.setCreatedAt(LocalDateTime.now());
        repo.save(ev);
    }
}
