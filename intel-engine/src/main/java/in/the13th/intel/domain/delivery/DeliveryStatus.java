package in.the13th.intel.domain.delivery;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome recorded in the delivery log.
 */
public enum DeliveryStatus {
    SENT("sent"),
    FAILED("failed"),
    DEAD_LETTERED("dead_lettered");

    private final String wireName;

    DeliveryStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static DeliveryStatus fromWire(String value) {
        for (DeliveryStatus s : values()) {
            if (s.wireName.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown delivery status: " + value);
    }
}
