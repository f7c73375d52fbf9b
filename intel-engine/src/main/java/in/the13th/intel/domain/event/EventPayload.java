package in.the13th.intel.domain.event;

import com.fasterxml.jackson.databind.JsonNode;
import in.the13th.intel.service.scoring.ScoringException;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view of an event payload.
 *
 * The four fields the scorer reads are lifted out with their JSON type checked; a field
 * of the wrong type is treated as absent. Everything else stays in {@code extensions}.
 */
public record EventPayload(
    Double value,
    String priority,
    Boolean suspected,
    Long occurrences,
    Map<String, JsonNode> extensions
) {
    public static final String VALUE = "value";
    public static final String PRIORITY = "priority";
    public static final String SUSPECTED = "suspected";
    public static final String OCCURRENCES = "occurrences";

    private static final EventPayload EMPTY = new EventPayload(null, null, null, null, Map.of());

    public static EventPayload empty() {
        return EMPTY;
    }

    /**
     * @throws ScoringException if the payload is present but not a JSON object
     */
    public static EventPayload from(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return EMPTY;
        }
        if (!node.isObject()) {
            throw new ScoringException("payload is not an object: " + node.getNodeType());
        }

        Double value = null;
        String priority = null;
        Boolean suspected = null;
        Long occurrences = null;
        Map<String, JsonNode> extensions = new LinkedHashMap<>();

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode v = field.getValue();
            switch (field.getKey()) {
                case VALUE -> value = v.isNumber() ? v.asDouble() : null;
                case PRIORITY -> priority = v.isTextual() ? v.asText() : null;
                case SUSPECTED -> suspected = v.isBoolean() ? v.booleanValue() : null;
                case OCCURRENCES -> occurrences = v.isIntegralNumber() && v.canConvertToLong() ? v.longValue() : null;
                default -> extensions.put(field.getKey(), v);
            }
        }
        return new EventPayload(value, priority, suspected, occurrences, Collections.unmodifiableMap(extensions));
    }

    public boolean isHighPriority() {
        return "high".equals(priority);
    }

    public boolean isSuspected() {
        return Boolean.TRUE.equals(suspected);
    }
}
