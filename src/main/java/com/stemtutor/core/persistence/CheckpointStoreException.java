package com.stemtutor.core.persistence;

/**
 * The checkpoint store could not be read or written.
 */
public class CheckpointStoreException extends RuntimeException {
    public CheckpointStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
