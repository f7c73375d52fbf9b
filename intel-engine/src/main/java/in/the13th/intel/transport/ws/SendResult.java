package in.the13th.intel.transport.ws;

/**
 * Result of handing a message to an observer. A failed send marks the observer for removal.
 */
public enum SendResult {
    OK,
    FAILED
}
