package in.the13th.intel.domain.action;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured details stored on an {@link ActionRecord}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionDetails(
    @JsonProperty("status") String status,          // sent | failed
    @JsonProperty("recipient") String recipient,
    @JsonProperty("score") double score,
    @JsonProperty("error") String error,
    @JsonProperty("retry_queued") Boolean retryQueued,
    @JsonProperty("attempts") int attempts
) {
    public static final String SENT = "sent";
    public static final String FAILED = "failed";

    public static ActionDetails sent(String recipient, double score, int attempts) {
        return new ActionDetails(SENT, recipient, score, null, null, attempts);
    }

    public static ActionDetails failed(String recipient, double score, String error, boolean retryQueued, int attempts) {
        return new ActionDetails(FAILED, recipient, score, error, retryQueued, attempts);
    }
}
