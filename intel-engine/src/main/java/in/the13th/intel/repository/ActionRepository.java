package in.the13th.intel.repository;

import com.fasterxml.jackson.databind.JsonNode;
import in.the13th.intel.domain.action.ActionRecord;

import java.util.List;

/**
 * Append-only audit trail of actions taken on triggering events.
 */
public interface ActionRepository {

    ActionRecord insert(long eventId, String actionType, JsonNode details, double timestamp);

    /**
     * Most recent actions, newest first.
     */
    List<ActionRecord> fetchRecent(int limit);

    List<ActionRecord> findByEventId(long eventId);
}
