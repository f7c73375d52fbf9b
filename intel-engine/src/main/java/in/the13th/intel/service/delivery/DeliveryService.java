package in.the13th.intel.service.delivery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.the13th.intel.domain.action.ActionDetails;
import in.the13th.intel.domain.action.ActionRecord;
import in.the13th.intel.domain.common.StreamMessage;
import in.the13th.intel.domain.delivery.Alert;
import in.the13th.intel.domain.delivery.DeliveryQueueEntry;
import in.the13th.intel.domain.delivery.DeliveryStatus;
import in.the13th.intel.domain.event.Event;
import in.the13th.intel.infrastructure.metrics.IntelMetrics;
import in.the13th.intel.repository.ActionRepository;
import in.the13th.intel.repository.DeliveryLogRepository;
import in.the13th.intel.service.notify.AlertComposer;
import in.the13th.intel.service.notify.DeliveryResult;
import in.the13th.intel.service.notify.Notifier;
import in.the13th.intel.transport.ws.StreamHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Initial delivery of an alert for a triggering event.
 *
 * Flow:
 * 1. {@link #prepare}: render the alert and reserve its retry queue entry (on the worker
 *    thread, before the event is marked processed)
 * 2. {@link #deliver}: up to {@code immediateRetries} sends, sleeping {@code backoff * attempt}
 *    between tries
 * 3. Success drops the queue entry; final failure releases it to the retry schedule
 * 4. Record the email_alert action, append one delivery log record, broadcast the action
 *
 * The delivery log is audit only: a failed log write never changes the outcome.
 */
public final class DeliveryService {
    private static final Logger log = LoggerFactory.getLogger(DeliveryService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Notifier notifier;
    private final AlertComposer composer;
    private final RetryQueueProcessor retryQueue;
    private final DeliveryLogRepository logRepo;
    private final ActionRepository actionRepo;
    private final StreamHub hub;
    private final IntelMetrics metrics;
    private final int immediateRetries;
    private final Duration immediateBackoff;
    private final Clock clock;

    public DeliveryService(
        Notifier notifier,
        AlertComposer composer,
        RetryQueueProcessor retryQueue,
        DeliveryLogRepository logRepo,
        ActionRepository actionRepo,
        StreamHub hub,
        IntelMetrics metrics,
        int immediateRetries,
        Duration immediateBackoff,
        Clock clock
    ) {
        this.notifier = notifier;
        this.composer = composer;
        this.retryQueue = retryQueue;
        this.logRepo = logRepo;
        this.actionRepo = actionRepo;
        this.hub = hub;
        this.metrics = metrics;
        this.immediateRetries = immediateRetries;
        this.immediateBackoff = immediateBackoff;
        this.clock = clock;
    }

    /**
     * Render the alert and store it in the retry queue before any send is attempted.
     *
     * @throws in.the13th.intel.repository.StorageException if the entry cannot be stored
     */
    public PendingDelivery prepare(Event event, double score) {
        Alert alert = composer.compose(event, score);
        DeliveryQueueEntry entry = retryQueue.reserve(alert);
        return new PendingDelivery(event, score, alert, entry.id());
    }

    /**
     * Deliver a prepared alert. Never throws.
     *
     * @return the recorded action, or null if recording it failed
     */
    public ActionRecord deliver(PendingDelivery pending) {
        try {
            return doDeliver(pending);
        } catch (Exception e) {
            log.error("[DELIVERY] Delivery for event {} failed unexpectedly: {}",
                pending.event().id(), e.getMessage(), e);
            return null;
        }
    }

    /**
     * A prepared alert that will not be sent now (shutdown, executor rejection): hand it to
     * the retry schedule and record the failed action. Never throws.
     */
    public ActionRecord abandon(PendingDelivery pending, String reason) {
        try {
            log.warn("[DELIVERY] Alert for event {} not sent ({}), leaving it to the retry queue",
                pending.event().id(), reason);
            boolean queued = release(pending, reason);
            ActionDetails details = ActionDetails.failed(pending.alert().recipient(), pending.score(),
                reason, queued, 0);
            return recordAction(pending, details, now());
        } catch (Exception e) {
            log.error("[DELIVERY] Could not record abandoned delivery for event {}: {}",
                pending.event().id(), e.getMessage(), e);
            return null;
        }
    }

    private ActionRecord doDeliver(PendingDelivery pending) {
        Event event = pending.event();
        Alert alert = pending.alert();

        DeliveryResult result = DeliveryResult.failure("not attempted");
        int attempt = 0;
        while (attempt < immediateRetries) {
            attempt++;
            result = sendSafely(notifier, alert);
            if (result.success()) {
                break;
            }
            log.warn("[DELIVERY] Alert for event {} failed (attempt {}/{}): {}",
                event.id(), attempt, immediateRetries, result.reason());
            if (attempt < immediateRetries && !pause(immediateBackoff.multipliedBy(attempt))) {
                break;
            }
        }

        // An interrupt (shutdown) must not keep the outcome from being stored.
        boolean interrupted = Thread.interrupted();
        try {
            double now = now();
            ActionDetails details;
            if (result.success()) {
                complete(pending);
                details = ActionDetails.sent(alert.recipient(), pending.score(), attempt);
                metrics.recordDelivery(IntelMetrics.PHASE_IMMEDIATE, DeliveryStatus.SENT.wireName());
                log.info("[DELIVERY] Alert for event {} sent via {} (attempt {})", event.id(), notifier.name(), attempt);
            } else {
                boolean queued = release(pending, result.reason());
                details = ActionDetails.failed(alert.recipient(), pending.score(), result.reason(), queued, attempt);
                metrics.recordDelivery(IntelMetrics.PHASE_IMMEDIATE, DeliveryStatus.FAILED.wireName());
            }

            try {
                return recordAction(pending, details, now);
            } finally {
                audit(alert, result.success() ? DeliveryStatus.SENT : DeliveryStatus.FAILED,
                    result.success() ? null : result.reason(), attempt, now);
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private ActionRecord recordAction(PendingDelivery pending, ActionDetails details, double now) {
        JsonNode detailsJson = MAPPER.valueToTree(details);
        ActionRecord action = actionRepo.insert(pending.event().id(), ActionRecord.EMAIL_ALERT, detailsJson, now);
        hub.broadcast(StreamMessage.action(action));
        return action;
    }

    private void complete(PendingDelivery pending) {
        try {
            retryQueue.complete(pending.queueEntryId());
        } catch (Exception e) {
            // the entry stays queued, so the alert may be sent once more
            log.error("[DELIVERY] Could not clear queue entry {} after sending: {}",
                pending.queueEntryId(), e.getMessage(), e);
        }
    }

    private boolean release(PendingDelivery pending, String reason) {
        try {
            return retryQueue.release(pending.queueEntryId(), reason);
        } catch (Exception e) {
            // the reserved entry is still stored and becomes due on its own
            log.error("[DELIVERY] Could not reschedule queue entry {}: {}",
                pending.queueEntryId(), e.getMessage(), e);
            return true;
        }
    }

    private void audit(Alert alert, DeliveryStatus status, String error, int attempt, double now) {
        try {
            logRepo.append(alert.eventId(), alert.recipient(), alert.subject(), status, error, attempt, now);
        } catch (Exception e) {
            log.error("[DELIVERY] Could not write delivery log for event {}: {}", alert.eventId(), e.getMessage());
        }
    }

    /**
     * Call the notifier, turning a thrown exception into a failed result.
     */
    static DeliveryResult sendSafely(Notifier notifier, Alert alert) {
        try {
            DeliveryResult result = notifier.send(alert);
            return result == null ? DeliveryResult.failure("notifier returned no result") : result;
        } catch (Exception e) {
            return DeliveryResult.failure(e.toString());
        }
    }

    private double now() {
        return clock.millis() / 1000.0;
    }

    private static boolean pause(Duration d) {
        if (d.isZero() || d.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(d.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
