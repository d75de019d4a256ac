package com.scorebench.evaluator.storage;

/**
 * Thrown when the object store cannot save, read or sign a path.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
