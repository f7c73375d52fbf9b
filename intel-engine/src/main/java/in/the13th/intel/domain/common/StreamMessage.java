package in.the13th.intel.domain.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Envelope for everything sent over the live stream: {@code {type, payload}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamMessage(
    @JsonProperty("type") StreamMessageType type,
    @JsonProperty("payload") Object payload,
    @JsonProperty("ts") Double ts
) {
    public static StreamMessage event(Object payload) {
        return new StreamMessage(StreamMessageType.EVENT, payload, null);
    }

    public static StreamMessage action(Object payload) {
        return new StreamMessage(StreamMessageType.ACTION, payload, null);
    }

    public static StreamMessage ping(double ts) {
        return new StreamMessage(StreamMessageType.PING, null, ts);
    }
}
