package com.example.pricing_import.imports;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

/**
 * Batches currently running in this process, by batch id.
 */
@Component
public class ImportBatchRegistry {

    private final ConcurrentHashMap<String, ImportBatch> running = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if a batch with the same id is already running
     */
    public void register(ImportBatch batch) {
        ImportBatch previous = running.putIfAbsent(batch.getBatchId(), batch);
        if (previous != null) {
            throw new IllegalStateException("Batch is already running: " + batch.getBatchId());
        }
    }

    public void unregister(ImportBatch batch) {
        running.remove(batch.getBatchId(), batch);
    }

    public Optional<ImportBatch> find(String batchId) {
        return Optional.ofNullable(running.get(batchId));
    }

    /**
     * @return true if the batch was running and is now flagged cancelled
     */
    public boolean cancel(String batchId) {
        ImportBatch batch = running.get(batchId);
        if (batch == null) {
            return false;
        }
        batch.cancel();
        return true;
    }
}
