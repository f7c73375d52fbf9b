package in.the13th.intel.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.the13th.intel.domain.delivery.Alert;
import in.the13th.intel.domain.delivery.DeliveryQueueEntry;
import in.the13th.intel.infrastructure.metrics.IntelMetrics;
import in.the13th.intel.infrastructure.metrics.PrometheusMetricsHandler;
import in.the13th.intel.infrastructure.persistence.JdbcActionRepository;
import in.the13th.intel.infrastructure.persistence.JdbcDeliveryLogRepository;
import in.the13th.intel.infrastructure.persistence.JdbcDeliveryQueueRepository;
import in.the13th.intel.infrastructure.persistence.JdbcEventRepository;
import in.the13th.intel.service.core.IngestionService;
import in.the13th.intel.service.delivery.RetryPolicy;
import in.the13th.intel.service.delivery.RetryQueueProcessor;
import in.the13th.intel.service.rules.RuleConfigService;
import in.the13th.intel.testing.MutableClock;
import in.the13th.intel.testing.ScriptedNotifier;
import in.the13th.intel.testing.TestDatabase;
import in.the13th.intel.transport.ws.StreamHub;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the route table end to end on an embedded Undertow listener.
 */
class HttpEndpointsTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int TEST_PORT = 19191;
    private static final String BASE = "http://localhost:" + TEST_PORT;

    @TempDir
    Path tempDir;

    private Undertow server;
    private HttpClient client;
    private RuleConfigService rules;
    private RetryQueueProcessor retryQueue;
    private JdbcDeliveryQueueRepository queueRepo;

    @BeforeEach
    void setUp() {
        DataSource ds = TestDatabase.create();
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        CollectorRegistry registry = new CollectorRegistry();
        IntelMetrics metrics = new IntelMetrics(registry);
        StreamHub hub = new StreamHub(Duration.ofSeconds(5), metrics, clock);

        JdbcEventRepository eventRepo = new JdbcEventRepository(ds);
        queueRepo = new JdbcDeliveryQueueRepository(ds);
        rules = new RuleConfigService(tempDir.resolve("rules.json"), 0.8);
        retryQueue = new RetryQueueProcessor(queueRepo, new JdbcDeliveryLogRepository(ds),
            new ScriptedNotifier(), RetryPolicy.builder().build(), 10, Duration.ofSeconds(10), metrics, clock);
        IngestionService ingestion = new IngestionService(eventRepo, hub, metrics, clock);

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(HttpRoutes.build(
                new IntelHandlers(ingestion, eventRepo, new JdbcActionRepository(ds), rules, clock),
                new RulesHandler(rules),
                new AdminHandlers(retryQueue, hub),
                hub,
                new PrometheusMetricsHandler(registry)))
            .build();
        server.start();

        client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(BASE + path))
            .timeout(Duration.ofSeconds(5));
        HttpRequest.BodyPublisher publisher = body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(body);
        if (body != null) {
            builder.header("Content-Type", "application/json");
        }
        return client.send(builder.method(method, publisher).build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("POST /events stores the event and it shows up in /intel")
    void ingestThenRead() throws Exception {
        HttpResponse<String> created = send("POST", "/events",
            "{\"user\": \"u1\", \"action\": \"lead_hot\", \"payload\": {\"value\": 10}}");

        assertEquals(201, created.statusCode());
        JsonNode ack = MAPPER.readTree(created.body());
        assertEquals("ok", ack.get("status").asText());
        long id = ack.get("event_id").asLong();

        HttpResponse<String> intel = send("GET", "/intel?limit=5", null);
        assertEquals(200, intel.statusCode());
        JsonNode snapshot = MAPPER.readTree(intel.body());
        assertEquals(id, snapshot.get("events").get(0).get("id").asLong());
        assertEquals("lead_hot", snapshot.get("events").get(0).get("action").asText());
        assertFalse(snapshot.get("events").get(0).get("processed").asBoolean());
        assertTrue(snapshot.get("actions").isArray());
        assertEquals(0.8, snapshot.get("rules").get("score_threshold").asDouble());
        assertTrue(snapshot.has("now"));
    }

    @Test
    void rejectsBadEvents() throws Exception {
        HttpResponse<String> notJson = send("POST", "/events", "{nope");
        assertEquals(400, notJson.statusCode());
        assertTrue(MAPPER.readTree(notJson.body()).has("error"));

        HttpResponse<String> noAction = send("POST", "/events", "{\"user\": \"u1\"}");
        assertEquals(400, noAction.statusCode());

        HttpResponse<String> listPayload = send("POST", "/events", "{\"action\": \"login\", \"payload\": [1]}");
        assertEquals(400, listPayload.statusCode());
    }

    @Test
    @DisplayName("PUT /rules replaces the rules and persists them")
    void rulesRoundTrip() throws Exception {
        HttpResponse<String> initial = send("GET", "/rules", null);
        assertEquals(200, initial.statusCode());
        assertEquals(0.8, MAPPER.readTree(initial.body()).get("score_threshold").asDouble());

        HttpResponse<String> put = send("PUT", "/rules", "{\"score_threshold\": 0.5}");
        assertEquals(200, put.statusCode());
        assertEquals(0.5, MAPPER.readTree(put.body()).get("rules").get("score_threshold").asDouble());

        assertEquals(0.5, MAPPER.readTree(send("GET", "/rules", null).body()).get("score_threshold").asDouble());
        assertEquals(0.5, rules.current().scoreThreshold());
        assertTrue(Files.readString(tempDir.resolve("rules.json")).contains("0.5"));
    }

    @Test
    void rejectsInvalidRules() throws Exception {
        assertEquals(400, send("PUT", "/rules", "{\"score_threshold\": 1.5}").statusCode());
        assertEquals(400, send("PUT", "/rules", "{\"score_threshold\": \"high\"}").statusCode());
        assertEquals(400, send("PUT", "/rules", "{\"score_threshold\": 0.5, \"extra\": true}").statusCode());
        assertEquals(400, send("PUT", "/rules", "not json").statusCode());

        assertEquals(0.8, rules.current().scoreThreshold());
    }

    @Test
    void healthAndMetrics() throws Exception {
        HttpResponse<String> health = send("GET", "/healthz", null);
        assertEquals(200, health.statusCode());
        assertEquals("ok", MAPPER.readTree(health.body()).get("status").asText());

        send("POST", "/events", "{\"action\": \"login\"}");

        HttpResponse<String> metrics = send("GET", "/metrics", null);
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("intel_events_ingested_total 1.0"));
    }

    @Test
    @DisplayName("/metrics?name[]= restricts the scrape to the named families")
    void metricsNameFilter() throws Exception {
        send("POST", "/events", "{\"action\": \"login\"}");

        HttpResponse<String> filtered = send("GET", "/metrics?name%5B%5D=intel_delivery_queue_depth", null);

        assertEquals(200, filtered.statusCode());
        assertTrue(filtered.body().contains("intel_delivery_queue_depth"));
        assertFalse(filtered.body().contains("intel_events_ingested_total"));
    }

    @Test
    @DisplayName("Admin queue endpoints list, requeue and delete entries")
    void adminQueue() throws Exception {
        DeliveryQueueEntry entry = retryQueue.reserve(new Alert(3L, "s", "b", "ops@example.com"));
        retryQueue.release(entry.id(), "smtp down");

        JsonNode queue = MAPPER.readTree(send("GET", "/admin/api/email_queue", null).body());
        assertEquals(1, queue.size());
        assertEquals(entry.id(), queue.get(0).get("id").asLong());
        assertEquals("smtp down", queue.get(0).get("last_error").asText());

        assertEquals(200, send("POST", "/admin/api/email_queue/" + entry.id() + "/retry", null).statusCode());
        assertEquals(404, send("POST", "/admin/api/email_queue/9999/retry", null).statusCode());
        assertEquals(400, send("POST", "/admin/api/email_queue/abc/retry", null).statusCode());

        assertEquals(200, send("DELETE", "/admin/api/email_queue/" + entry.id(), null).statusCode());
        assertTrue(queueRepo.findAll().isEmpty());
        assertEquals(404, send("DELETE", "/admin/api/email_queue/" + entry.id(), null).statusCode());

        assertEquals(200, send("GET", "/admin/api/email_logs?limit=10", null).statusCode());

        JsonNode stats = MAPPER.readTree(send("GET", "/admin/api/socket_stats", null).body());
        assertEquals(0, stats.get("connected").asInt());
    }

    @Test
    void unknownRouteIs404AndPreflightIsAnswered() throws Exception {
        assertEquals(404, send("GET", "/nope", null).statusCode());

        HttpResponse<String> preflight = send("OPTIONS", "/events", null);
        assertEquals(200, preflight.statusCode());
        assertEquals("*", preflight.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
    }
}
