package in.the13th.intel.repository;

/**
 * Raised when a store operation cannot be completed (database or disk failure).
 * Fatal for the attempted operation only.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
