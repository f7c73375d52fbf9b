package in.the13th.intel.domain.delivery;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable audit record of one delivery attempt (or of a dead-lettering).
 * Never consulted for control flow.
 */
public record DeliveryLogEntry(
    @JsonProperty("id") long id,
    @JsonProperty("event_id") Long eventId,
    @JsonProperty("to_email") String recipient,
    @JsonProperty("subject") String subject,
    @JsonProperty("status") DeliveryStatus status,
    @JsonProperty("error") String error,
    @JsonProperty("attempt") int attempt,
    @JsonProperty("created_at") double createdAt
) {}
