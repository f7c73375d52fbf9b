package in.the13th.intel.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.the13th.intel.domain.event.Event;
import in.the13th.intel.repository.ActionRepository;
import in.the13th.intel.repository.EventRepository;
import in.the13th.intel.repository.StorageException;
import in.the13th.intel.service.core.IngestionService;
import in.the13th.intel.service.rules.RuleConfigService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

import static in.the13th.intel.transport.http.JsonResponses.MAPPER;
import static in.the13th.intel.transport.http.JsonResponses.intParam;
import static in.the13th.intel.transport.http.JsonResponses.sendError;
import static in.the13th.intel.transport.http.JsonResponses.sendJson;

/**
 * Ingestion, dashboard snapshot and health endpoints.
 */
public final class IntelHandlers {
    private static final Logger log = LoggerFactory.getLogger(IntelHandlers.class);

    static final int DEFAULT_INTEL_LIMIT = 100;
    static final int MAX_INTEL_LIMIT = 1000;

    private final IngestionService ingestion;
    private final EventRepository eventRepo;
    private final ActionRepository actionRepo;
    private final RuleConfigService rules;
    private final Clock clock;

    public IntelHandlers(IngestionService ingestion, EventRepository eventRepo, ActionRepository actionRepo,
                         RuleConfigService rules, Clock clock) {
        this.ingestion = ingestion;
        this.eventRepo = eventRepo;
        this.actionRepo = actionRepo;
        this.rules = rules;
        this.clock = clock;
    }

    /**
     * POST /events - Ingest one event
     */
    public void ingestEvent(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            JsonNode json;
            try {
                json = MAPPER.readTree(body);
            } catch (JsonProcessingException e) {
                sendError(ex, StatusCodes.BAD_REQUEST, "invalid JSON: " + e.getOriginalMessage());
                return;
            }

            try {
                Event stored = ingestion.ingest(json);
                sendJson(ex, StatusCodes.CREATED, Map.of("status", "ok", "event_id", stored.id()));
            } catch (IllegalArgumentException e) {
                sendError(ex, StatusCodes.BAD_REQUEST, e.getMessage());
            } catch (StorageException e) {
                log.error("Failed to store event: {}", e.getMessage());
                sendError(ex, StatusCodes.INTERNAL_SERVER_ERROR, "failed to store event");
            } catch (Exception e) {
                log.error("Unexpected ingestion failure: {}", e.getMessage(), e);
                sendError(ex, StatusCodes.INTERNAL_SERVER_ERROR, "internal error");
            }
        });
    }

    /**
     * GET /intel?limit=100 - Recent events, actions and current rules
     */
    public void intel(HttpServerExchange exchange) {
        int limit = intParam(exchange, "limit", DEFAULT_INTEL_LIMIT, 1, MAX_INTEL_LIMIT);
        try {
            ObjectNode response = MAPPER.createObjectNode();
            response.set("events", MAPPER.valueToTree(eventRepo.fetchRecent(limit)));
            response.set("actions", MAPPER.valueToTree(actionRepo.fetchRecent(limit)));
            response.set("rules", RuleConfigService.toDocument(rules.current()));
            response.put("now", clock.millis() / 1000.0);
            sendJson(exchange, response);
        } catch (Exception e) {
            log.error("Failed to build intel snapshot: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "failed to load intel");
        }
    }

    /**
     * GET /healthz
     */
    public void health(HttpServerExchange exchange) {
        sendJson(exchange, Map.of("status", "ok", "ts", clock.millis() / 1000.0));
    }
}
