package in.the13th.intel.domain.action;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of acting on one triggering event. Append-only.
 */
public record ActionRecord(
    @JsonProperty("id") long id,
    @JsonProperty("event_id") long eventId,
    @JsonProperty("action_type") String actionType,
    @JsonProperty("details") JsonNode details,
    @JsonProperty("timestamp") double timestamp
) {
    public static final String EMAIL_ALERT = "email_alert";
}
