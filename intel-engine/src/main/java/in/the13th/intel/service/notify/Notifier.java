package in.the13th.intel.service.notify;

import in.the13th.intel.domain.delivery.Alert;

/**
 * Outbound notification channel.
 *
 * Implementations report failures through {@link DeliveryResult} and should not throw;
 * callers still guard against runtime exceptions and treat them as failures.
 */
public interface Notifier {

    DeliveryResult send(Alert alert);

    /**
     * Short name used in logs and metrics labels.
     */
    String name();
}
