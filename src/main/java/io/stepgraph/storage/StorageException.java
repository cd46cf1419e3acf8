package io.stepgraph.storage;

/**
 * A store operation failed after the adapter gave up retrying it.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
