package in.the13th.intel.service.notify;

import in.the13th.intel.domain.delivery.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default notifier: writes the alert to the log.
 *
 * Stands in for a mail transport on installs without one. Always succeeds.
 */
public final class LoggingNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public DeliveryResult send(Alert alert) {
        log.warn("[ALERT] to={} subject={}", alert.recipient(), alert.subject());
        log.info("[ALERT-DETAILS] event={}\n{}", alert.eventId(), alert.body());
        return DeliveryResult.ok();
    }

    @Override
    public String name() {
        return "log";
    }
}
