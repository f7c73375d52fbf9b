package in.the13th.intel.service.worker;

import in.the13th.intel.config.RuleConfig;
import in.the13th.intel.domain.common.StreamMessage;
import in.the13th.intel.domain.event.Event;
import in.the13th.intel.infrastructure.metrics.IntelMetrics;
import in.the13th.intel.repository.EventRepository;
import in.the13th.intel.service.delivery.DeliveryService;
import in.the13th.intel.service.delivery.DeliveryTask;
import in.the13th.intel.service.rules.RuleConfigService;
import in.the13th.intel.service.scoring.EventScorer;
import in.the13th.intel.transport.ws.StreamHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drains unprocessed events: score, hand off triggering ones for delivery, mark processed.
 *
 * Each event is marked processed exactly once, whether it triggered, scored below the
 * threshold or could not be scored at all. A triggering event's alert is stored in the
 * retry queue before the event is marked processed; the sends then run on
 * {@code deliveryExecutor} so a slow notifier never stalls the drain.
 */
public final class EventWorker {
    private static final Logger log = LoggerFactory.getLogger(EventWorker.class);

    private final EventRepository eventRepo;
    private final EventScorer scorer;
    private final RuleConfigService rules;
    private final DeliveryService delivery;
    private final Executor deliveryExecutor;
    private final StreamHub hub;
    private final IntelMetrics metrics;
    private final int batchSize;

    private volatile WorkerState state = WorkerState.IDLE;

    public EventWorker(
        EventRepository eventRepo,
        EventScorer scorer,
        RuleConfigService rules,
        DeliveryService delivery,
        Executor deliveryExecutor,
        StreamHub hub,
        IntelMetrics metrics,
        int batchSize
    ) {
        this.eventRepo = eventRepo;
        this.scorer = scorer;
        this.rules = rules;
        this.delivery = delivery;
        this.deliveryExecutor = deliveryExecutor;
        this.hub = hub;
        this.metrics = metrics;
        this.batchSize = batchSize;
    }

    /**
     * Process batches until no unprocessed events remain.
     *
     * @return number of events marked processed
     * @throws in.the13th.intel.repository.StorageException if the event store fails; the cycle stops
     */
    public int drainOnce() {
        long startNanos = System.nanoTime();
        state = WorkerState.DRAINING;
        int processed = 0;
        try {
            while (true) {
                List<Event> batch = eventRepo.fetchUnprocessed(batchSize);
                if (batch.isEmpty()) {
                    break;
                }
                RuleConfig current = rules.current();
                int progressed = 0;
                for (Event event : batch) {
                    if (process(event, current)) {
                        progressed++;
                    }
                }
                processed += progressed;
                if (progressed == 0) {
                    log.warn("[WORKER] No progress on batch of {} events, yielding until next poll", batch.size());
                    break;
                }
            }
        } finally {
            state = WorkerState.IDLE;
            metrics.recordWorkerCycle(Duration.ofNanos(System.nanoTime() - startNanos));
        }
        if (processed > 0) {
            log.info("[WORKER] Processed {} events", processed);
        }
        return processed;
    }

    private boolean process(Event event, RuleConfig current) {
        Double score = null;
        try {
            score = scorer.score(event);
        } catch (RuntimeException e) {
            metrics.recordScoringFailure();
            log.warn("[WORKER] Could not score event {} ({}): {}", event.id(), event.action(), e.getMessage());
        }

        if (score != null && scorer.shouldTrigger(score, current)) {
            metrics.recordTriggered();
            double triggeredScore = score;
            log.info("[WORKER] Event {} ({}) scored {} >= {}, dispatching alert",
                event.id(), event.action(), String.format("%.3f", triggeredScore), current.scoreThreshold());
            // stored before markProcessed so a crash or shutdown cannot drop the alert
            dispatch(new DeliveryTask(delivery, delivery.prepare(event, triggeredScore)));
        } else if (score != null) {
            log.debug("[WORKER] Event {} ({}) scored {}", event.id(), event.action(), score);
        }

        boolean changed = eventRepo.markProcessed(event.id());
        if (changed) {
            metrics.recordProcessed();
            hub.broadcast(StreamMessage.event(event.withProcessed(true)));
        }
        return changed;
    }

    private void dispatch(DeliveryTask task) {
        try {
            deliveryExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.error("[WORKER] Delivery executor rejected event {}: {}", task.pending().event().id(), e.getMessage());
            task.abandon("delivery executor unavailable");
        }
    }

    public WorkerState state() {
        return state;
    }
}
