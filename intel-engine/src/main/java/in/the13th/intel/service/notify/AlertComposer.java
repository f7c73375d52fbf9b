package in.the13th.intel.service.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.the13th.intel.domain.delivery.Alert;
import in.the13th.intel.domain.event.Event;

import java.time.Instant;
import java.util.Locale;

/**
 * Renders the alert subject and body for a triggering event.
 */
public final class AlertComposer {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String recipient;

    public AlertComposer(String recipient) {
        this.recipient = recipient;
    }

    public Alert compose(Event event, double score) {
        return new Alert(event.id(), subject(event, score), body(event, score), recipient);
    }

    static String subject(Event event, double score) {
        return String.format(Locale.ROOT, "THE13TH Alert — %s (score=%.2f)", event.action(), score);
    }

    static String body(Event event, double score) {
        StringBuilder sb = new StringBuilder();
        sb.append("Event ID: ").append(event.id()).append('\n');
        sb.append("Action: ").append(event.action()).append('\n');
        sb.append("User: ").append(event.user() == null ? "-" : event.user()).append('\n');
        sb.append("Timestamp: ").append(isoTimestamp(event.timestamp())).append('\n');
        sb.append("Score: ").append(String.format(Locale.ROOT, "%.3f", score)).append("\n\n");
        sb.append("Payload:\n").append(prettyPayload(event));
        return sb.toString();
    }

    private static String isoTimestamp(double epochSeconds) {
        long millis = Math.round(epochSeconds * 1000.0);
        return Instant.ofEpochMilli(millis).toString();
    }

    private static String prettyPayload(Event event) {
        if (event.payload() == null) {
            return "{}";
        }
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(event.payload());
        } catch (JsonProcessingException e) {
            return event.payload().toString();
        }
    }
}
