package com.example.pricing_import.commit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-process per-supplier commit locks. Locks are taken in sorted key order so two batches never deadlock.
 */
@Component
public class SupplierLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(SupplierLockRegistry.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLocks(Collection<String> supplierKeys, Supplier<T> action) {
        TreeSet<String> keys = new TreeSet<>();
        supplierKeys.stream().filter(Objects::nonNull).forEach(keys::add);

        List<ReentrantLock> held = new ArrayList<>(keys.size());
        try {
            for (String key : keys) {
                ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
                if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
                    log.info("Waiting for commit lock on supplier {}", key);
                }
                lock.lock();
                held.add(lock);
            }
            return action.get();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }
}
