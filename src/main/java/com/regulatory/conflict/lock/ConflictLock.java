package com.regulatory.conflict.lock;

import java.util.function.Supplier;

/**
 * Mutual exclusion keyed by conflict id, so that at most one resolver works on a conflict
 * at any moment.
 */
public interface ConflictLock {

    /**
     * Acquires the lock for the key, waiting up to the configured timeout.
     *
     * @param key the lock key (a conflict id)
     * @return true once the lock is held
     * @throws LockAcquisitionException if the lock cannot be acquired in time
     */
    boolean tryLock(String key);

    /**
     * Releases the lock for the key if the current thread holds it.
     */
    void unlock(String key);

    /**
     * Runs {@code action} while holding the lock for {@code key}.
     *
     * @throws LockAcquisitionException if the lock cannot be acquired in time
     */
    default <T> T withLock(String key, Supplier<T> action) {
        tryLock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }
}
