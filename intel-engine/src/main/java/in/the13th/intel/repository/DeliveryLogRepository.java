package in.the13th.intel.repository;

import in.the13th.intel.domain.delivery.DeliveryLogEntry;
import in.the13th.intel.domain.delivery.DeliveryStatus;

import java.util.List;

/**
 * Immutable delivery audit log.
 */
public interface DeliveryLogRepository {

    DeliveryLogEntry append(Long eventId, String recipient, String subject,
                            DeliveryStatus status, String error, int attempt, double createdAt);

    /**
     * Newest first.
     */
    List<DeliveryLogEntry> fetchRecent(int limit);

    /**
     * Oldest first, in write order.
     */
    List<DeliveryLogEntry> findByEventId(long eventId);
}
