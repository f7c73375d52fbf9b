package in.the13th.intel.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * GET /metrics: the engine's intel_* counters, gauges and histograms in Prometheus text format.
 *
 * Repeated {@code name[]} query parameters restrict the scrape to those metric families,
 * e.g. {@code /metrics?name[]=intel_delivery_queue_depth}.
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);
    private static final String NAME_PARAM = "name[]";

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Set<String> names = requestedNames(exchange);
        try {
            StringWriter writer = new StringWriter();
            TextFormat.write004(writer, names.isEmpty()
                ? registry.metricFamilySamples()
                : registry.filteredMetricFamilySamples(names));
            String body = writer.toString();

            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
            exchange.setStatusCode(200);
            exchange.getResponseSender().send(body);

            log.debug("[METRICS] Served intel metrics ({} bytes, filter={})", body.length(),
                names.isEmpty() ? "all" : names);
        } catch (IOException e) {
            log.error("[METRICS] Failed to render intel metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Failed to render intel metrics: " + e.getMessage());
        }
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get(NAME_PARAM);
        Set<String> names = new HashSet<>();
        if (values != null) {
            for (String v : values) {
                if (!v.isBlank()) names.add(v.trim());
            }
        }
        return names;
    }
}
