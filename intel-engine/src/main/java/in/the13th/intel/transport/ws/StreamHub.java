package in.the13th.intel.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.the13th.intel.domain.common.StreamMessage;
import in.the13th.intel.infrastructure.metrics.IntelMetrics;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live stream hub: fans {@link StreamMessage}s out to every connected observer.
 *
 * - Registry keyed by connection id
 * - Broadcast never throws and never blocks on a slow observer
 * - Observers whose send fails are removed after the fan-out
 * - Keepalive ping on a fixed interval
 */
public class StreamHub {
    private static final Logger log = LoggerFactory.getLogger(StreamHub.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ConcurrentMap<Long, ObserverChannel> observers = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(0);
    private final AtomicLong totalSent = new AtomicLong(0);
    private volatile Double lastMessageTs;

    private final Clock clock;
    private final IntelMetrics metrics;
    private final Duration pingInterval;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "stream-ping");
        t.setDaemon(true);
        return t;
    });

    public StreamHub(Duration pingInterval, IntelMetrics metrics, Clock clock) {
        this.pingInterval = pingInterval;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void start() {
        long ms = pingInterval.toMillis();
        scheduler.scheduleAtFixedRate(this::ping, ms, ms, TimeUnit.MILLISECONDS);
        log.info("[STREAM] Hub started with {}ms ping interval", ms);
    }

    /**
     * Stop pinging and close every observer.
     */
    public void stop() {
        scheduler.shutdownNow();
        for (Map.Entry<Long, ObserverChannel> entry : observers.entrySet()) {
            entry.getValue().close();
        }
        observers.clear();
        updateGauge();
        log.info("[STREAM] Hub stopped");
    }

    /**
     * Register an observer.
     *
     * @return the connection id
     */
    public long connect(ObserverChannel channel) {
        long id = nextId.incrementAndGet();
        observers.put(id, channel);
        updateGauge();
        log.info("[STREAM] Observer {} connected: {} (total={})", id, channel.describe(), observers.size());
        return id;
    }

    public void disconnect(long id) {
        ObserverChannel removed = observers.remove(id);
        if (removed != null) {
            updateGauge();
            log.info("[STREAM] Observer {} disconnected: {} (total={})", id, removed.describe(), observers.size());
        }
    }

    /**
     * Send to every registered observer. Zero observers is a no-op.
     */
    public void broadcast(StreamMessage message) {
        String json;
        try {
            json = MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.warn("[STREAM] Failed to serialize message {}: {}", message.type(), e.toString());
            return;
        }

        List<Long> failed = new ArrayList<>();
        for (Map.Entry<Long, ObserverChannel> entry : observers.entrySet()) {
            SendResult result;
            try {
                result = entry.getValue().send(json);
            } catch (RuntimeException e) {
                result = SendResult.FAILED;
            }
            if (result == SendResult.OK) {
                totalSent.incrementAndGet();
            } else {
                failed.add(entry.getKey());
            }
        }
        lastMessageTs = now();

        for (Long id : failed) {
            ObserverChannel removed = observers.remove(id);
            if (removed != null) {
                log.debug("[STREAM] Dropping observer {} after failed send", id);
                removed.close();
            }
        }
        if (!failed.isEmpty()) {
            updateGauge();
        }
    }

    public StreamStats stats() {
        return new StreamStats(observers.size(), totalSent.get(), lastMessageTs);
    }

    public int connectedCount() {
        return observers.size();
    }

    void ping() {
        try {
            if (!observers.isEmpty()) {
                broadcast(StreamMessage.ping(now()));
            }
        } catch (Exception e) {
            log.warn("[STREAM] Ping failed: {}", e.toString());
        }
    }

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                AtomicLong idRef = new AtomicLong(-1);
                UndertowObserverChannel observer =
                    new UndertowObserverChannel(channel, failedChannel -> disconnect(idRef.get()));
                idRef.set(connect(observer));

                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        // observers are receive-only; client frames just keep the socket alive
                    }

                    @Override
                    protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                        disconnect(idRef.get());
                        super.onCloseMessage(cm, ch);
                    }

                    @Override
                    protected void onError(WebSocketChannel ch, Throwable error) {
                        log.warn("[STREAM] WebSocket error: {}", error.toString());
                        disconnect(idRef.get());
                        super.onError(ch, error);
                    }
                });
                channel.addCloseTask(ch -> disconnect(idRef.get()));
                channel.resumeReceives();
            }
        });
    }

    private double now() {
        return clock.millis() / 1000.0;
    }

    private void updateGauge() {
        if (metrics != null) {
            metrics.setObservers(observers.size());
        }
    }
}
