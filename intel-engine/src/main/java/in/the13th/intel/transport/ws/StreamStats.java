package in.the13th.intel.transport.ws;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of the live stream counters.
 */
public record StreamStats(
    @JsonProperty("connected") int connected,
    @JsonProperty("total_sent") long totalSent,
    @JsonProperty("last_message_ts") Double lastMessageTs
) {}
