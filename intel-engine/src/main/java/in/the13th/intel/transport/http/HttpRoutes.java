package in.the13th.intel.transport.http;

import in.the13th.intel.infrastructure.metrics.PrometheusMetricsHandler;
import in.the13th.intel.transport.ws.StreamHub;
import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;

/**
 * Route table for the HTTP and stream endpoints, wrapped in a permissive CORS handler.
 *
 * Handlers that touch the database run on worker threads via {@link BlockingHandler}.
 */
public final class HttpRoutes {

    public static HttpHandler build(
        IntelHandlers intel,
        RulesHandler rules,
        AdminHandlers admin,
        StreamHub hub,
        PrometheusMetricsHandler metricsHandler
    ) {
        RoutingHandler routes = Handlers.routing()
            .post("/events", new BlockingHandler(intel::ingestEvent))
            .get("/intel", new BlockingHandler(intel::intel))
            .get("/healthz", intel::health)
            .get("/rules", rules::getRules)
            .put("/rules", new BlockingHandler(rules::putRules))
            .get("/stream", hub.websocketHandler())
            .get("/admin/api/email_queue", new BlockingHandler(admin::emailQueue))
            .post("/admin/api/email_queue/{id}/retry", new BlockingHandler(admin::retryEntry))
            .delete("/admin/api/email_queue/{id}", new BlockingHandler(admin::deleteEntry))
            .get("/admin/api/email_logs", new BlockingHandler(admin::emailLogs))
            .get("/admin/api/socket_stats", admin::socketStats)
            .get("/metrics", metricsHandler)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(StatusCodes.NOT_FOUND);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "THE13TH intel engine\n\n" +
                    "API:  POST /events, GET /intel, GET|PUT /rules, GET /healthz, GET /metrics\n" +
                    "WS:   /stream\n");
            });

        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, PUT, DELETE, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (Methods.OPTIONS.equals(exchange.getRequestMethod())) {
                exchange.setStatusCode(StatusCodes.OK);
                exchange.endExchange();
            } else {
                routes.handleRequest(exchange);
            }
        };
    }

    private HttpRoutes() {}
}
