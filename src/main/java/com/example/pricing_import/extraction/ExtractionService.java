package com.example.pricing_import.extraction;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.pricing_import.imports.ImportBatch;
import com.example.pricing_import.imports.RowReason;
import com.example.pricing_import.loader.RawRow;

import jakarta.annotation.PreDestroy;

/**
 * Runs the extraction adapter over a batch on a bounded worker pool.
 *
 * <ul>
 * <li>transient failures are retried with exponential backoff; permanent ones are not</li>
 * <li>successful answers are cached on the batch per row, so a row is never extracted twice</li>
 * <li>results come back in row order whatever order the calls complete in</li>
 * <li>once the batch is cancelled, pending requests are skipped and late answers dropped</li>
 * </ul>
 */
@Service
public class ExtractionService {

    private static final Logger log = LoggerFactory.getLogger(ExtractionService.class);

    private final ExtractionProperties properties;
    private final ExecutorService executor;

    public ExtractionService(ExtractionProperties properties) {
        this.properties = properties;
        this.executor = Executors.newFixedThreadPool(properties.getConcurrency(), new ExtractionThreadFactory());
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(properties.getCallTimeout().toSeconds() + 1, TimeUnit.SECONDS)) {
            log.warn("Extraction workers still busy at shutdown; interrupting");
            executor.shutdownNow();
        }
    }

    /**
     * One entry per batch row, in row order.
     */
    public List<RowExtraction> extractAll(ImportBatch batch, ExtractionClient client) {
        ExtractionSchema schema = ExtractionSchema.standard();

        List<RawRow> pending = new ArrayList<>();
        for (RawRow row : batch.getRows()) {
            if (batch.cachedExtraction(row.position()).isEmpty()) {
                pending.add(row);
            }
        }
        List<List<RawRow>> requests = partition(pending, properties.getRowsPerRequest());
        log.info("Extracting batchId={} rows={} cached={} requests={} client={}", batch.getBatchId(),
                batch.getRows().size(), batch.getRows().size() - pending.size(), requests.size(),
                client.getClass().getSimpleName());

        Map<Integer, RowExtraction> failures = new ConcurrentHashMap<>();
        List<Future<?>> futures = new ArrayList<>(requests.size());
        for (List<RawRow> request : requests) {
            futures.add(executor.submit(() -> runRequest(batch, client, schema, request, failures)));
        }

        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while extracting batchId={}; cancelling", batch.getBatchId());
                batch.cancel();
                futures.subList(i, futures.size()).forEach(f -> f.cancel(true));
                break;
            } catch (ExecutionException e) {
                log.error("Extraction worker failed batchId={}", batch.getBatchId(), e.getCause());
                markFailed(requests.get(i), failures, "worker error: " + e.getCause().getMessage());
            }
        }

        double floor = properties.getConfidenceFloor();
        List<RowExtraction> results = new ArrayList<>(batch.getRows().size());
        for (RawRow row : batch.getRows()) {
            int pos = row.position();
            ExtractionResult cached = batch.cachedExtraction(pos).orElse(null);
            if (cached == null) {
                results.add(failures.getOrDefault(pos,
                        RowExtraction.rejected(pos, RowReason.EXTRACTION_FAILED, "no extraction result")));
            } else if (!cached.extracted()) {
                results.add(RowExtraction.rejected(pos, RowReason.EXTRACTION_FAILED, "no extraction for row"));
            } else if (cached.record().confidence() < floor) {
                results.add(RowExtraction.rejected(pos, RowReason.LOW_CONFIDENCE,
                        String.format("confidence %.2f below %.2f", cached.record().confidence(), floor)));
            } else {
                results.add(RowExtraction.ok(cached.record()));
            }
        }
        return results;
    }

    private void runRequest(ImportBatch batch, ExtractionClient client, ExtractionSchema schema,
            List<RawRow> request, Map<Integer, RowExtraction> failures) {
        int maxAttempts = properties.getMaxAttempts();
        int first = request.get(0).position();

        for (int attempt = 1;; attempt++) {
            if (batch.isCancelled()) {
                return;
            }
            try {
                List<ExtractionResult> answer = client.extract(request, schema);
                if (batch.isCancelled()) {
                    log.debug("Dropping extraction for rows from {}: batch {} cancelled", first, batch.getBatchId());
                    return;
                }
                store(batch, request, answer, failures);
                return;
            } catch (ExtractionClientException e) {
                if (!e.isTransientFailure() || attempt >= maxAttempts) {
                    log.warn("Extraction gave up rows from {} after {} attempt(s): {}", first, attempt,
                            e.getMessage());
                    markFailed(request, failures, e.getMessage());
                    return;
                }
                Duration wait = backoff(attempt);
                log.warn("Extraction attempt {}/{} failed rows from {}: {}; retrying in {} ms", attempt,
                        maxAttempts, first, e.getMessage(), wait.toMillis());
                try {
                    Thread.sleep(wait.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    markFailed(request, failures, "interrupted during retry backoff");
                    return;
                }
            } catch (RuntimeException e) {
                log.warn("Extraction client error rows from {}", first, e);
                markFailed(request, failures, "client error: " + e.getMessage());
                return;
            }
        }
    }

    private void store(ImportBatch batch, List<RawRow> request, List<ExtractionResult> answer,
            Map<Integer, RowExtraction> failures) {
        Map<Integer, ExtractionResult> byPosition = new HashMap<>();
        if (answer != null) {
            for (ExtractionResult r : answer) {
                if (r != null) {
                    byPosition.putIfAbsent(r.rowPosition(), r);
                }
            }
        }
        for (RawRow row : request) {
            ExtractionResult r = byPosition.get(row.position());
            if (r != null) {
                batch.cacheExtraction(r);
            } else {
                failures.put(row.position(), RowExtraction.rejected(row.position(), RowReason.EXTRACTION_FAILED,
                        "adapter returned no result for row"));
            }
        }
    }

    private static void markFailed(List<RawRow> request, Map<Integer, RowExtraction> failures, String detail) {
        for (RawRow row : request) {
            failures.putIfAbsent(row.position(),
                    RowExtraction.rejected(row.position(), RowReason.EXTRACTION_FAILED, detail));
        }
    }

    /**
     * Wait before the next attempt: initial * multiplier^(attempt-1), capped.
     */
    Duration backoff(int attempt) {
        double millis = properties.getInitialBackoff().toMillis()
                * Math.pow(properties.getBackoffMultiplier(), attempt - 1);
        long capped = (long) Math.min(millis, properties.getMaxBackoff().toMillis());
        return Duration.ofMillis(capped);
    }

    static List<List<RawRow>> partition(List<RawRow> rows, int size) {
        List<List<RawRow>> parts = new ArrayList<>();
        for (int i = 0; i < rows.size(); i += size) {
            parts.add(List.copyOf(rows.subList(i, Math.min(rows.size(), i + size))));
        }
        return parts;
    }

    private static final class ExtractionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "extraction-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
