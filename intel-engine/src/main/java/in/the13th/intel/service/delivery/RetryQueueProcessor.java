package in.the13th.intel.service.delivery;

import in.the13th.intel.domain.delivery.Alert;
import in.the13th.intel.domain.delivery.DeliveryLogEntry;
import in.the13th.intel.domain.delivery.DeliveryQueueEntry;
import in.the13th.intel.domain.delivery.DeliveryStatus;
import in.the13th.intel.infrastructure.metrics.IntelMetrics;
import in.the13th.intel.repository.DeliveryLogRepository;
import in.the13th.intel.repository.DeliveryQueueRepository;
import in.the13th.intel.service.notify.DeliveryResult;
import in.the13th.intel.service.notify.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * RetryQueueProcessor - owns the delivery retry queue.
 *
 * 1. Every triggered alert is reserved as an entry before its first send; the entry is
 *    dropped on success or released to the retry schedule on failure
 * 2. Poll every {@code interval} for live entries with next_retry_at &lt;= now
 * 3. Re-send each through the notifier, earliest due first
 * 4. Success: delete the entry. Failure: bump attempts and push next_retry_at out.
 *    Exhausted: dead-letter the entry (kept for inspection, never scheduled again)
 *
 * Every retry appends one delivery log record. All queue row mutations go through here.
 */
public final class RetryQueueProcessor {
    private static final Logger log = LoggerFactory.getLogger(RetryQueueProcessor.class);

    private final DeliveryQueueRepository queueRepo;
    private final DeliveryLogRepository logRepo;
    private final Notifier notifier;
    private final RetryPolicy policy;
    private final int batchSize;
    private final Duration interval;
    private final IntelMetrics metrics;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public RetryQueueProcessor(
        DeliveryQueueRepository queueRepo,
        DeliveryLogRepository logRepo,
        Notifier notifier,
        RetryPolicy policy,
        int batchSize,
        Duration interval,
        IntelMetrics metrics,
        Clock clock
    ) {
        this.queueRepo = queueRepo;
        this.logRepo = logRepo;
        this.notifier = notifier;
        this.policy = policy;
        this.batchSize = batchSize;
        this.interval = interval;
        this.metrics = metrics;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "retry-queue-processor");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        log.info("[RETRY] Starting retry queue processor (every {}ms, batch {}, max attempts {})",
            interval.toMillis(), batchSize, policy.maxAttempts());
        scheduler.scheduleWithFixedDelay(this::runCycle, interval.toMillis(), interval.toMillis(),
            TimeUnit.MILLISECONDS);
    }

    public void stop() {
        log.info("[RETRY] Stopping retry queue processor...");
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            log.info("[RETRY] Retry queue processor stopped");
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Persist the alert before its first send so a crash or shutdown cannot lose it.
     * The entry is due after {@code backoffFor(0)} but is skipped by {@link #processDue()}
     * until {@link #complete(long)} or {@link #release(long, String)} is called for it.
     */
    public DeliveryQueueEntry reserve(Alert alert) {
        double now = now();
        DeliveryQueueEntry entry = queueRepo.enqueue(alert, now + seconds(policy.backoffFor(0)), now, null);
        inFlight.add(entry.id());
        log.debug("[RETRY] Reserved delivery {} for event {}", entry.id(), alert.eventId());
        refreshDepth();
        return entry;
    }

    /**
     * The reserved alert was delivered: drop its entry.
     */
    public void complete(long id) {
        try {
            queueRepo.delete(id);
        } finally {
            inFlight.remove(id);
        }
        refreshDepth();
    }

    /**
     * The reserved alert was not delivered: hand it to the retry schedule, first retry
     * after {@code backoffFor(0)}. The entry stays retryable even if this update fails.
     *
     * @return true if the entry was found and rescheduled
     */
    public boolean release(long id, String lastError) {
        boolean updated;
        try {
            updated = queueRepo.recordFailure(id, 0, now() + seconds(policy.backoffFor(0)), lastError);
        } finally {
            inFlight.remove(id);
        }
        if (updated) {
            log.info("[RETRY] Queued delivery {} for retry (due in {}s): {}",
                id, policy.backoffFor(0).toSeconds(), lastError);
        } else {
            log.warn("[RETRY] Delivery {} was removed before it could be queued for retry", id);
        }
        refreshDepth();
        return updated;
    }

    /**
     * Run one pass over the due entries.
     *
     * Entries reserved by a delivery still in progress are left alone.
     *
     * @return number of entries attempted
     */
    public int processDue() {
        List<DeliveryQueueEntry> due = queueRepo.findDue(now(), batchSize);
        if (due.isEmpty()) {
            log.debug("[RETRY] Nothing due");
            refreshDepth();
            return 0;
        }

        int attempted = 0;
        for (DeliveryQueueEntry entry : due) {
            if (inFlight.contains(entry.id())) {
                continue;
            }
            attempted++;
            try {
                retry(entry);
            } catch (Exception e) {
                log.error("[RETRY] Error retrying delivery {}: {}", entry.id(), e.getMessage(), e);
            }
        }
        if (attempted > 0) {
            log.info("[RETRY] Retried {} queued deliveries", attempted);
        }
        refreshDepth();
        return attempted;
    }

    private void retry(DeliveryQueueEntry entry) {
        Alert alert = entry.toAlert();
        DeliveryResult result = DeliveryService.sendSafely(notifier, alert);
        int attempts = entry.attempts() + 1;
        double now = now();

        if (result.success()) {
            queueRepo.delete(entry.id());
            audit(entry, DeliveryStatus.SENT, null, attempts, now);
            metrics.recordDelivery(IntelMetrics.PHASE_RETRY, DeliveryStatus.SENT.wireName());
            log.info("[RETRY] Delivery {} for event {} sent on retry {}", entry.id(), entry.eventId(), attempts);
            return;
        }

        if (policy.isExhausted(attempts)) {
            queueRepo.markDeadLettered(entry.id(), attempts, result.reason());
            audit(entry, DeliveryStatus.DEAD_LETTERED, result.reason(), attempts, now);
            metrics.recordDelivery(IntelMetrics.PHASE_RETRY, DeliveryStatus.DEAD_LETTERED.wireName());
            log.error("[RETRY] Delivery {} for event {} dead-lettered after {} attempts: {}",
                entry.id(), entry.eventId(), attempts, result.reason());
            return;
        }

        Duration backoff = policy.backoffFor(attempts);
        queueRepo.recordFailure(entry.id(), attempts, now + seconds(backoff), result.reason());
        audit(entry, DeliveryStatus.FAILED, result.reason(), attempts, now);
        metrics.recordDelivery(IntelMetrics.PHASE_RETRY, DeliveryStatus.FAILED.wireName());
        log.warn("[RETRY] Delivery {} for event {} failed (attempt {}), next try in {}s: {}",
            entry.id(), entry.eventId(), attempts, backoff.toSeconds(), result.reason());
    }

    // ========== Admin operations ==========

    /**
     * All entries including dead letters, newest first.
     */
    public List<DeliveryQueueEntry> listQueue() {
        return queueRepo.findAll();
    }

    /**
     * Reset attempts and make the entry due now. Revives a dead letter.
     *
     * @return false if no such entry
     */
    public boolean requeue(long id) {
        boolean changed = queueRepo.requeue(id, now());
        if (changed) {
            log.info("[RETRY] Delivery {} requeued by operator", id);
            refreshDepth();
        }
        return changed;
    }

    public boolean delete(long id) {
        boolean removed = queueRepo.delete(id);
        if (removed) {
            log.info("[RETRY] Delivery {} deleted by operator", id);
            refreshDepth();
        }
        return removed;
    }

    public List<DeliveryLogEntry> recentLogs(int limit) {
        return logRepo.fetchRecent(limit);
    }

    private void audit(DeliveryQueueEntry entry, DeliveryStatus status, String error, int attempts, double now) {
        try {
            logRepo.append(entry.eventId(), entry.recipient(), entry.subject(), status, error, attempts, now);
        } catch (RuntimeException e) {
            log.error("[RETRY] Could not write delivery log for {}: {}", entry.id(), e.getMessage());
        }
    }

    private void runCycle() {
        try {
            processDue();
        } catch (Exception e) {
            log.error("[RETRY] Error in retry loop: {}", e.getMessage(), e);
        }
    }

    private void refreshDepth() {
        try {
            metrics.setQueueDepth(queueRepo.countPending());
        } catch (Exception e) {
            log.debug("[RETRY] Could not refresh queue depth: {}", e.getMessage());
        }
    }

    private double now() {
        return clock.millis() / 1000.0;
    }

    private static double seconds(Duration d) {
        return d.toMillis() / 1000.0;
    }
}
