package in.the13th.intel.domain.common;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Message types pushed to live stream observers.
 */
public enum StreamMessageType {
    EVENT,
    ACTION,
    PING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
