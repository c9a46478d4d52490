package com.regulatory.conflict.lock;

/**
 * Configuration for {@link ConflictLock} implementations.
 *
 * @param timeoutMs    maximum time to wait for one acquisition attempt
 * @param maxRetries   additional attempts after the first one times out
 * @param retryDelayMs pause between attempts in milliseconds
 */
public record LockConfig(long timeoutMs, int maxRetries, long retryDelayMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryDelayMs <= 0) {
            throw new IllegalArgumentException("retryDelayMs must be > 0");
        }
    }

    /**
     * Default configuration: 2s per attempt, 2 retries, 50ms between attempts.
     */
    public static LockConfig defaults() {
        return new LockConfig(2000, 2, 50);
    }
}
