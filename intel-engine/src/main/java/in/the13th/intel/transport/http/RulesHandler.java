package in.the13th.intel.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import in.the13th.intel.config.RuleConfig;
import in.the13th.intel.service.rules.RuleConfigService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

import static in.the13th.intel.transport.http.JsonResponses.MAPPER;
import static in.the13th.intel.transport.http.JsonResponses.sendError;
import static in.the13th.intel.transport.http.JsonResponses.sendJson;

/**
 * HTTP handler for rule configuration.
 */
public final class RulesHandler {
    private static final Logger log = LoggerFactory.getLogger(RulesHandler.class);

    private final RuleConfigService rules;

    public RulesHandler(RuleConfigService rules) {
        this.rules = rules;
    }

    /**
     * GET /rules
     */
    public void getRules(HttpServerExchange exchange) {
        sendJson(exchange, RuleConfigService.toDocument(rules.current()));
    }

    /**
     * PUT /rules - Replace the rules document wholesale
     */
    public void putRules(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            RuleConfig parsed;
            try {
                JsonNode json = MAPPER.readTree(body);
                parsed = RuleConfigService.parseDocument(json);
            } catch (JsonProcessingException e) {
                sendError(ex, StatusCodes.BAD_REQUEST, "invalid JSON: " + e.getOriginalMessage());
                return;
            } catch (IllegalArgumentException e) {
                sendError(ex, StatusCodes.BAD_REQUEST, e.getMessage());
                return;
            }

            try {
                RuleConfig saved = rules.update(parsed);
                sendJson(ex, Map.of("status", "ok", "rules", RuleConfigService.toDocument(saved)));
            } catch (IOException e) {
                log.error("Failed to save rules: {}", e.getMessage(), e);
                sendError(ex, StatusCodes.INTERNAL_SERVER_ERROR, "failed to save rules");
            }
        });
    }
}
