package in.the13th.intel.bootstrap;

import com.zaxxer.hikari.HikariDataSource;
import in.the13th.intel.config.EngineConfig;
import in.the13th.intel.infrastructure.metrics.IntelMetrics;
import in.the13th.intel.infrastructure.metrics.PrometheusMetricsHandler;
import in.the13th.intel.infrastructure.persistence.DataSourceFactory;
import in.the13th.intel.infrastructure.persistence.JdbcActionRepository;
import in.the13th.intel.infrastructure.persistence.JdbcDeliveryLogRepository;
import in.the13th.intel.infrastructure.persistence.JdbcDeliveryQueueRepository;
import in.the13th.intel.infrastructure.persistence.JdbcEventRepository;
import in.the13th.intel.migration.IntelSchemaMigration;
import in.the13th.intel.repository.ActionRepository;
import in.the13th.intel.repository.DeliveryLogRepository;
import in.the13th.intel.repository.DeliveryQueueRepository;
import in.the13th.intel.repository.EventRepository;
import in.the13th.intel.service.core.IngestionService;
import in.the13th.intel.service.delivery.DeliveryService;
import in.the13th.intel.service.delivery.DeliveryTask;
import in.the13th.intel.service.delivery.RetryPolicy;
import in.the13th.intel.service.delivery.RetryQueueProcessor;
import in.the13th.intel.service.notify.AlertComposer;
import in.the13th.intel.service.notify.LoggingNotifier;
import in.the13th.intel.service.notify.Notifier;
import in.the13th.intel.service.notify.WebhookNotifier;
import in.the13th.intel.service.rules.RuleConfigService;
import in.the13th.intel.service.scoring.EventScorer;
import in.the13th.intel.service.worker.EventWorker;
import in.the13th.intel.service.worker.WorkerSupervisor;
import in.the13th.intel.transport.http.AdminHandlers;
import in.the13th.intel.transport.http.HttpRoutes;
import in.the13th.intel.transport.http.IntelHandlers;
import in.the13th.intel.transport.http.RulesHandler;
import in.the13th.intel.transport.ws.StreamHub;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires every component of the engine and owns their lifecycle.
 *
 * Startup: datasource, schema, rules, stream hub, retry queue, worker, HTTP server.
 * Shutdown runs in reverse: HTTP server, worker drain, delivery executor, retry queue,
 * stream hub, datasource. Alerts still waiting on the delivery executor go to the retry queue
 * before the datasource closes.
 */
public final class IntelEngine {
    private static final Logger log = LoggerFactory.getLogger(IntelEngine.class);
    private static final Duration INTERRUPTED_DELIVERY_GRACE = Duration.ofSeconds(5);

    private final EngineConfig config;
    private final HikariDataSource dataSource;
    private final IntelMetrics metrics;
    private final RuleConfigService rules;
    private final StreamHub hub;
    private final RetryQueueProcessor retryQueue;
    private final ExecutorService deliveryExecutor;
    private final WorkerSupervisor supervisor;
    private final Undertow server;

    private IntelEngine(EngineConfig config, CollectorRegistry registry, Notifier notifier) {
        Clock clock = Clock.systemUTC();
        this.config = config;

        this.dataSource = DataSourceFactory.create(config);
        new IntelSchemaMigration(dataSource).migrate();

        this.metrics = new IntelMetrics(registry);
        this.rules = new RuleConfigService(config.rulesFile(), config.defaultScoreThreshold());

        EventRepository eventRepo = new JdbcEventRepository(dataSource);
        ActionRepository actionRepo = new JdbcActionRepository(dataSource);
        DeliveryLogRepository logRepo = new JdbcDeliveryLogRepository(dataSource);
        DeliveryQueueRepository queueRepo = new JdbcDeliveryQueueRepository(dataSource);

        this.hub = new StreamHub(config.wsPingInterval(), metrics, clock);

        RetryPolicy policy = RetryPolicy.builder()
            .maxBackoff(config.retryMaxBackoff())
            .maxAttempts(config.retryMaxAttempts())
            .build();
        this.retryQueue = new RetryQueueProcessor(queueRepo, logRepo, notifier, policy,
            config.retryBatchSize(), config.retryInterval(), metrics, clock);

        DeliveryService delivery = new DeliveryService(notifier, new AlertComposer(config.alertRecipient()),
            retryQueue, logRepo, actionRepo, hub, metrics,
            config.immediateRetries(), config.immediateRetryBackoff(), clock);

        AtomicInteger threadSeq = new AtomicInteger();
        this.deliveryExecutor = Executors.newFixedThreadPool(config.deliveryThreads(), r -> {
            Thread t = new Thread(r, "alert-delivery-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        EventWorker worker = new EventWorker(eventRepo, new EventScorer(), rules, delivery, deliveryExecutor,
            hub, metrics, config.workerBatchSize());
        this.supervisor = new WorkerSupervisor(worker, config.pollInterval());
        IngestionService ingestion = new IngestionService(eventRepo, hub, metrics, clock);

        IntelHandlers intelHandlers = new IntelHandlers(ingestion, eventRepo, actionRepo, rules, clock);
        RulesHandler rulesHandler = new RulesHandler(rules);
        AdminHandlers adminHandlers = new AdminHandlers(retryQueue, hub);

        this.server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(HttpRoutes.build(intelHandlers, rulesHandler, adminHandlers, hub,
                new PrometheusMetricsHandler(registry)))
            .build();
    }

    /**
     * Build the engine from config. Nothing is started yet.
     */
    public static IntelEngine create(EngineConfig config, CollectorRegistry registry) {
        return new IntelEngine(config, registry, createNotifier(config));
    }

    static IntelEngine create(EngineConfig config, CollectorRegistry registry, Notifier notifier) {
        return new IntelEngine(config, registry, notifier);
    }

    static Notifier createNotifier(EngineConfig config) {
        if (EngineConfig.NOTIFIER_WEBHOOK.equalsIgnoreCase(config.notifierType())) {
            log.info("Notifier: webhook -> {}", config.webhookUrl());
            return new WebhookNotifier(config.webhookUrl());
        }
        log.info("Notifier: log");
        return new LoggingNotifier();
    }

    public void start() {
        hub.start();
        retryQueue.start();
        supervisor.start();
        server.start();
        log.info("✓ Intel engine started on http://localhost:{}/ (data dir {})", config.port(), config.dataDir());
    }

    public void stop() {
        log.info("Shutting down intel engine...");
        try {
            server.stop();
        } catch (RuntimeException e) {
            log.warn("HTTP server stop failed: {}", e.getMessage());
        }

        supervisor.stop(config.shutdownTimeout());
        drainDeliveries();

        retryQueue.stop();
        hub.stop();
        dataSource.close();
        log.info("✓ Intel engine stopped");
    }

    /**
     * Let running deliveries finish within the shutdown timeout. Deliveries that never started are
     * released to the retry queue and recorded as failed actions; running ones are interrupted and
     * store their own outcome. The datasource stays open until this returns.
     */
    private void drainDeliveries() {
        deliveryExecutor.shutdown();
        try {
            if (deliveryExecutor.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                return;
            }
            log.warn("In-flight deliveries did not finish, handing them to the retry queue");
            abandonAll(deliveryExecutor.shutdownNow());
            if (!deliveryExecutor.awaitTermination(INTERRUPTED_DELIVERY_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.error("Delivery threads still running after interrupt; their queue entries stay pending");
            }
        } catch (InterruptedException e) {
            abandonAll(deliveryExecutor.shutdownNow());
            Thread.currentThread().interrupt();
        }
    }

    private static void abandonAll(List<Runnable> unstarted) {
        for (Runnable r : unstarted) {
            if (r instanceof DeliveryTask) {
                ((DeliveryTask) r).abandon("engine shutting down");
            }
        }
        if (!unstarted.isEmpty()) {
            log.info("Queued {} undelivered alerts for retry", unstarted.size());
        }
    }

    RetryQueueProcessor retryQueue() {
        return retryQueue;
    }

    RuleConfigService rules() {
        return rules;
    }

    StreamHub hub() {
        return hub;
    }
}
