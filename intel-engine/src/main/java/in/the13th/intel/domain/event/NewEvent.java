package in.the13th.intel.domain.event;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A validated ingestion request, not yet stored.
 */
public record NewEvent(
    String user,
    String action,
    JsonNode payload,
    double timestamp
) {
    public NewEvent {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action is required");
        }
        if (payload != null && !payload.isNull() && !payload.isObject()) {
            throw new IllegalArgumentException("payload must be a JSON object");
        }
        if (Double.isNaN(timestamp) || Double.isInfinite(timestamp)) {
            throw new IllegalArgumentException("timestamp must be a finite number");
        }
        if (payload != null && payload.isNull()) {
            payload = null;
        }
    }
}
