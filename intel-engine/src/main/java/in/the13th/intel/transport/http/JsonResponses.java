package in.the13th.intel.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Deque;
import java.util.Map;

/**
 * JSON response helpers shared by the HTTP handlers.
 */
final class JsonResponses {
    private static final Logger log = LoggerFactory.getLogger(JsonResponses.class);
    static final ObjectMapper MAPPER = new ObjectMapper();

    static void sendJson(HttpServerExchange exchange, int status, Object body) {
        String json;
        try {
            json = MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize response: {}", e.getMessage(), e);
            status = StatusCodes.INTERNAL_SERVER_ERROR;
            json = "{\"error\":\"serialization failed\"}";
        }
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(json);
    }

    static void sendJson(HttpServerExchange exchange, Object body) {
        sendJson(exchange, StatusCodes.OK, body);
    }

    static void sendError(HttpServerExchange exchange, int status, String message) {
        sendJson(exchange, status, Map.of("error", message == null ? "error" : message));
    }

    static String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.getFirst();
    }

    /**
     * Integer query parameter clamped to [min, max]; missing or malformed yields the default.
     */
    static int intParam(HttpServerExchange exchange, String name, int defaultValue, int min, int max) {
        String raw = queryParam(exchange, name);
        int value = defaultValue;
        if (raw != null) {
            try {
                value = Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                value = defaultValue;
            }
        }
        return Math.max(min, Math.min(max, value));
    }

    private JsonResponses() {}
}
