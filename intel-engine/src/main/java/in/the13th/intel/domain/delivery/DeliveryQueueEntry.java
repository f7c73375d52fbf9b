package in.the13th.intel.domain.delivery;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A notification waiting for another delivery attempt.
 */
public record DeliveryQueueEntry(
    @JsonProperty("id") long id,
    @JsonProperty("event_id") Long eventId,
    @JsonProperty("subject") String subject,
    @JsonProperty("body") String body,
    @JsonProperty("to_email") String recipient,
    @JsonProperty("attempts") int attempts,
    @JsonProperty("next_retry_at") double nextRetryAt,
    @JsonProperty("created_at") double createdAt,
    @JsonProperty("last_error") String lastError,
    @JsonProperty("dead_lettered") boolean deadLettered
) {
    public Alert toAlert() {
        return new Alert(eventId, subject, body, recipient);
    }
}
