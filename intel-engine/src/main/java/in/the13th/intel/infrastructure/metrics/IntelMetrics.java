package in.the13th.intel.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus metrics for the intel engine.
 *
 * Key Metrics:
 * - intel_events_ingested_total - Events accepted by the ingestion endpoint
 * - intel_events_processed_total - Events marked processed by the worker
 * - intel_scoring_failures_total - Events whose payload could not be scored
 * - intel_actions_triggered_total - Events whose score met the threshold
 * - intel_deliveries_total{phase, status} - Delivery attempts by outcome
 * - intel_worker_cycle_seconds - Duration of one worker drain
 * - intel_delivery_queue_depth - Live entries waiting for retry
 * - intel_stream_observers - Connected stream observers
 *
 * Pass a fresh {@link CollectorRegistry} in tests to avoid duplicate registration.
 */
public class IntelMetrics {

    public static final String PHASE_IMMEDIATE = "immediate";
    public static final String PHASE_RETRY = "retry";

    private final CollectorRegistry registry;

    private final Counter eventsIngested;
    private final Counter eventsProcessed;
    private final Counter scoringFailures;
    private final Counter actionsTriggered;
    private final Counter deliveries;
    private final Histogram workerCycle;
    private final Gauge queueDepth;
    private final Gauge observers;

    public IntelMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public IntelMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.eventsIngested = Counter.build()
            .name("intel_events_ingested_total")
            .help("Total number of events accepted for ingestion")
            .register(registry);

        this.eventsProcessed = Counter.build()
            .name("intel_events_processed_total")
            .help("Total number of events marked processed")
            .register(registry);

        this.scoringFailures = Counter.build()
            .name("intel_scoring_failures_total")
            .help("Total number of events that could not be scored")
            .register(registry);

        this.actionsTriggered = Counter.build()
            .name("intel_actions_triggered_total")
            .help("Total number of events whose score met the threshold")
            .register(registry);

        this.deliveries = Counter.build()
            .name("intel_deliveries_total")
            .help("Total number of delivery attempts by outcome")
            .labelNames("phase", "status")
            .register(registry);

        this.workerCycle = Histogram.build()
            .name("intel_worker_cycle_seconds")
            .help("Duration of one worker drain cycle in seconds")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0)
            .register(registry);

        this.queueDepth = Gauge.build()
            .name("intel_delivery_queue_depth")
            .help("Live delivery queue entries awaiting retry")
            .register(registry);

        this.observers = Gauge.build()
            .name("intel_stream_observers")
            .help("Currently connected stream observers")
            .register(registry);
    }

    public void recordIngested() {
        eventsIngested.inc();
    }

    public void recordProcessed() {
        eventsProcessed.inc();
    }

    public void recordScoringFailure() {
        scoringFailures.inc();
    }

    public void recordTriggered() {
        actionsTriggered.inc();
    }

    public void recordDelivery(String phase, String status) {
        deliveries.labels(phase, status).inc();
    }

    public void recordWorkerCycle(Duration elapsed) {
        workerCycle.observe(elapsed.toNanos() / 1_000_000_000.0);
    }

    public void setQueueDepth(long depth) {
        queueDepth.set(depth);
    }

    public void setObservers(int count) {
        observers.set(count);
    }

    public double deliveryCount(String phase, String status) {
        return deliveries.labels(phase, status).get();
    }

    public double processedCount() {
        return eventsProcessed.get();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
