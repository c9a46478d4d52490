package com.regulatory.conflict.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process {@link ConflictLock} backed by one {@link ReentrantLock} per key.
 * Suitable for single-JVM deployments.
 */
public class LocalConflictLock implements ConflictLock {
    private static final Logger log = LoggerFactory.getLogger(LocalConflictLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalConflictLock() {
        this(LockConfig.defaults());
    }

    public LocalConflictLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        for (int attempt = 0; attempt <= config.maxRetries(); attempt++) {
            try {
                if (lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                    log.debug("Lock acquired: {} (attempt {})", key, attempt + 1);
                    return true;
                }
                if (attempt < config.maxRetries()) {
                    Thread.sleep(config.retryDelayMs());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockAcquisitionException("Interrupted while acquiring lock for key: " + key, e);
            }
        }
        throw new LockAcquisitionException(
                "Failed to acquire lock for key '" + key + "' after " + (config.maxRetries() + 1) + " attempts");
    }

    @Override
    public void unlock(String key) {
        ReentrantLock lock = locks.get(key);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("Lock released: {}", key);
        }
    }

    /**
     * Returns whether some thread currently holds the lock for the key.
     */
    public boolean isLocked(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }
}
