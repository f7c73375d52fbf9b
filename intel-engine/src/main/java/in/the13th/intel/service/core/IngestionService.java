package in.the13th.intel.service.core;

import com.fasterxml.jackson.databind.JsonNode;
import in.the13th.intel.domain.common.StreamMessage;
import in.the13th.intel.domain.event.Event;
import in.the13th.intel.domain.event.NewEvent;
import in.the13th.intel.infrastructure.metrics.IntelMetrics;
import in.the13th.intel.repository.EventRepository;
import in.the13th.intel.transport.ws.StreamHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Event ingestion.
 * Reliability rule: persist the event first, then push it to the stream.
 */
public final class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final EventRepository repo;
    private final StreamHub hub;
    private final IntelMetrics metrics;
    private final Clock clock;

    public IngestionService(EventRepository repo, StreamHub hub, IntelMetrics metrics, Clock clock) {
        this.repo = repo;
        this.hub = hub;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Validate and store a raw ingestion request body.
     *
     * @throws IllegalArgumentException if the request is malformed; nothing is stored
     * @throws in.the13th.intel.repository.StorageException if the event could not be stored
     */
    public Event ingest(JsonNode body) {
        return ingest(parse(body));
    }

    public Event ingest(NewEvent newEvent) {
        Event stored = repo.insert(newEvent);
        metrics.recordIngested();
        log.debug("Ingested event {} action={} user={}", stored.id(), stored.action(), stored.user());
        hub.broadcast(StreamMessage.event(stored));
        return stored;
    }

    NewEvent parse(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new IllegalArgumentException("request body must be a JSON object");
        }

        JsonNode action = body.get("action");
        if (action == null || !action.isTextual()) {
            throw new IllegalArgumentException("action is required");
        }

        JsonNode user = body.get("user");
        if (user != null && !user.isNull() && !user.isTextual()) {
            throw new IllegalArgumentException("user must be a string");
        }

        JsonNode ts = body.get("timestamp");
        double timestamp;
        if (ts == null || ts.isNull()) {
            timestamp = clock.millis() / 1000.0;
        } else if (ts.isNumber()) {
            timestamp = ts.asDouble();
        } else {
            throw new IllegalArgumentException("timestamp must be a number (epoch seconds)");
        }

        return new NewEvent(
            user == null || user.isNull() ? null : user.asText(),
            action.asText(),
            body.get("payload"),
            timestamp);
    }
}
