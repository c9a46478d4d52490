package com.regulatory.conflict.store;

/**
 * Thrown when an operation names a conflict, record or case that does not exist.
 */
public class ConflictNotFoundException extends RuntimeException {

    public ConflictNotFoundException(String message) {
        super(message);
    }
}
