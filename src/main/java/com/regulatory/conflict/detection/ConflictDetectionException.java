package com.regulatory.conflict.detection;

/**
 * Thrown when a detection pass fails for a reason other than missing provision data.
 */
public class ConflictDetectionException extends RuntimeException {

    public ConflictDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
