package uk.gegc.intellicode.shared.exception;

/**
 * Exception thrown when object storage operations fail
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
