package in.the13th.intel.transport.http;

import in.the13th.intel.service.delivery.RetryQueueProcessor;
import in.the13th.intel.transport.ws.StreamHub;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static in.the13th.intel.transport.http.JsonResponses.intParam;
import static in.the13th.intel.transport.http.JsonResponses.queryParam;
import static in.the13th.intel.transport.http.JsonResponses.sendError;
import static in.the13th.intel.transport.http.JsonResponses.sendJson;

/**
 * Operator endpoints for the delivery queue, delivery log and stream stats.
 */
public final class AdminHandlers {
    private static final Logger log = LoggerFactory.getLogger(AdminHandlers.class);

    static final int DEFAULT_LOG_LIMIT = 200;
    static final int MAX_LOG_LIMIT = 1000;

    private final RetryQueueProcessor retryQueue;
    private final StreamHub hub;

    public AdminHandlers(RetryQueueProcessor retryQueue, StreamHub hub) {
        this.retryQueue = retryQueue;
        this.hub = hub;
    }

    /**
     * GET /admin/api/email_queue
     */
    public void emailQueue(HttpServerExchange exchange) {
        try {
            sendJson(exchange, retryQueue.listQueue());
        } catch (Exception e) {
            log.error("Failed to list delivery queue: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "failed to list queue");
        }
    }

    /**
     * POST /admin/api/email_queue/{id}/retry
     */
    public void retryEntry(HttpServerExchange exchange) {
        Long id = pathId(exchange);
        if (id == null) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "invalid id");
            return;
        }
        try {
            if (retryQueue.requeue(id)) {
                sendJson(exchange, Map.of("status", "ok", "id", id));
            } else {
                sendError(exchange, StatusCodes.NOT_FOUND, "not found");
            }
        } catch (Exception e) {
            log.error("Failed to requeue delivery {}: {}", id, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "failed to requeue");
        }
    }

    /**
     * DELETE /admin/api/email_queue/{id}
     */
    public void deleteEntry(HttpServerExchange exchange) {
        Long id = pathId(exchange);
        if (id == null) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "invalid id");
            return;
        }
        try {
            if (retryQueue.delete(id)) {
                sendJson(exchange, Map.of("status", "ok", "id", id));
            } else {
                sendError(exchange, StatusCodes.NOT_FOUND, "not found");
            }
        } catch (Exception e) {
            log.error("Failed to delete delivery {}: {}", id, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "failed to delete");
        }
    }

    /**
     * GET /admin/api/email_logs?limit=200
     */
    public void emailLogs(HttpServerExchange exchange) {
        int limit = intParam(exchange, "limit", DEFAULT_LOG_LIMIT, 1, MAX_LOG_LIMIT);
        try {
            sendJson(exchange, retryQueue.recentLogs(limit));
        } catch (Exception e) {
            log.error("Failed to list delivery log: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "failed to list logs");
        }
    }

    /**
     * GET /admin/api/socket_stats
     */
    public void socketStats(HttpServerExchange exchange) {
        sendJson(exchange, hub.stats());
    }

    private static Long pathId(HttpServerExchange exchange) {
        String raw = queryParam(exchange, "id");
        if (raw == null) {
            return null;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
