package in.the13th.intel.domain.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * An occurrence reported by an external actor.
 *
 * {@code payload} is the raw JSON object as ingested (null when absent); use
 * {@link EventPayload#from(JsonNode)} for the typed scoring view.
 */
public record Event(
    @JsonProperty("id") long id,
    @JsonProperty("user") String user,
    @JsonProperty("action") String action,
    @JsonProperty("payload") JsonNode payload,
    @JsonProperty("timestamp") double timestamp,    // epoch seconds
    @JsonProperty("processed") boolean processed
) {
    public Event withProcessed(boolean processed) {
        return new Event(id, user, action, payload, timestamp, processed);
    }
}
