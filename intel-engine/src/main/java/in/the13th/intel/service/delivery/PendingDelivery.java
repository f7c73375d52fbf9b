package in.the13th.intel.service.delivery;

import in.the13th.intel.domain.delivery.Alert;
import in.the13th.intel.domain.event.Event;

/**
 * A triggered alert whose queue entry is already stored, awaiting its first send.
 */
public record PendingDelivery(
    Event event,
    double score,
    Alert alert,
    long queueEntryId
) {}
