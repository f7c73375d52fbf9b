package in.the13th.intel.service.notify;

/**
 * Outcome of a single delivery attempt.
 */
public record DeliveryResult(boolean success, String reason) {

    private static final DeliveryResult OK = new DeliveryResult(true, null);

    public static DeliveryResult ok() {
        return OK;
    }

    public static DeliveryResult failure(String reason) {
        return new DeliveryResult(false, reason == null || reason.isBlank() ? "unknown error" : reason);
    }
}
