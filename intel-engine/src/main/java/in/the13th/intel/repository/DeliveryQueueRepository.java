package in.the13th.intel.repository;

import in.the13th.intel.domain.delivery.Alert;
import in.the13th.intel.domain.delivery.DeliveryQueueEntry;

import java.util.List;
import java.util.Optional;

/**
 * Durable set of notifications awaiting retry.
 */
public interface DeliveryQueueRepository {

    DeliveryQueueEntry enqueue(Alert alert, double nextRetryAt, double createdAt, String lastError);

    /**
     * Live (not dead-lettered) entries with {@code next_retry_at <= now}, earliest first.
     */
    List<DeliveryQueueEntry> findDue(double now, int limit);

    /**
     * Record a failed retry: store the new attempt count, schedule and error.
     */
    boolean recordFailure(long id, int attempts, double nextRetryAt, String error);

    /**
     * Stop scheduling this entry. It stays visible until deleted or requeued.
     */
    boolean markDeadLettered(long id, int attempts, String error);

    /**
     * Reset attempts to zero and make the entry due at {@code now}, reviving dead letters.
     */
    boolean requeue(long id, double now);

    boolean delete(long id);

    Optional<DeliveryQueueEntry> findById(long id);

    /**
     * All entries, newest id first.
     */
    List<DeliveryQueueEntry> findAll();

    long countPending();
}
