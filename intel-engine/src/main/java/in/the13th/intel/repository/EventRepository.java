package in.the13th.intel.repository;

import in.the13th.intel.domain.event.Event;
import in.the13th.intel.domain.event.NewEvent;

import java.util.List;
import java.util.Optional;

/**
 * Append-only event log with a processed flag.
 * All methods throw {@link StorageException} on storage failure.
 */
public interface EventRepository {
    /**
     * Append an event; the store assigns a monotonically increasing id.
     */
    Event insert(NewEvent event);

    /**
     * Unprocessed events, oldest timestamp first (ties broken by id).
     */
    List<Event> fetchUnprocessed(int limit);

    /**
     * Flip {@code processed} to true.
     *
     * @return true if this call changed the row, false if it was already processed or absent
     */
    boolean markProcessed(long eventId);

    /**
     * Most recent events, newest timestamp first.
     */
    List<Event> fetchRecent(int limit);

    Optional<Event> findById(long eventId);

    long countUnprocessed();
}
