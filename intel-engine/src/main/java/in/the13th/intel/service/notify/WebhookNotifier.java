package in.the13th.intel.service.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.the13th.intel.domain.delivery.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Posts alerts as JSON to an HTTP endpoint.
 *
 * Request body: {@code {"event_id", "to", "subject", "body"}}. Any 2xx response is a
 * success; other statuses and I/O errors are failures.
 */
public final class WebhookNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final URI endpoint;
    private final HttpClient httpClient;

    public WebhookNotifier(String url) {
        this(URI.create(url), HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build());
    }

    WebhookNotifier(URI endpoint, HttpClient httpClient) {
        this.endpoint = endpoint;
        this.httpClient = httpClient;
    }

    @Override
    public DeliveryResult send(Alert alert) {
        try {
            ObjectNode payload = MAPPER.createObjectNode();
            if (alert.eventId() != null) {
                payload.put("event_id", alert.eventId());
            } else {
                payload.putNull("event_id");
            }
            payload.put("to", alert.recipient());
            payload.put("subject", alert.subject());
            payload.put("body", alert.body());

            HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(payload)))
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                log.debug("[WEBHOOK] Delivered alert for event {} (HTTP {})", alert.eventId(), status);
                return DeliveryResult.ok();
            }
            log.warn("[WEBHOOK] Alert for event {} rejected: HTTP {}", alert.eventId(), status);
            return DeliveryResult.failure("HTTP " + status);
        } catch (IOException e) {
            log.warn("[WEBHOOK] Alert for event {} failed: {}", alert.eventId(), e.toString());
            return DeliveryResult.failure(e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.failure("interrupted");
        }
    }

    @Override
    public String name() {
        return "webhook";
    }
}
