package in.the13th.intel.service.scoring;

/**
 * Raised when an event cannot be scored (structurally malformed payload).
 */
public class ScoringException extends RuntimeException {

    public ScoringException(String message) {
        super(message);
    }

    public ScoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
