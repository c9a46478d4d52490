package com.regulatory.conflict.lock;

/**
 * Thrown when a conflict lock cannot be acquired within the configured attempts.
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
