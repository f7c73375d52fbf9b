package in.the13th.intel.service.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns the single worker task for the process.
 *
 * A second {@link #start()} is refused. {@link #stop()} lets the current drain finish.
 */
public final class WorkerSupervisor {
    private static final Logger log = LoggerFactory.getLogger(WorkerSupervisor.class);

    private final EventWorker worker;
    private final Duration pollInterval;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    public WorkerSupervisor(EventWorker worker, Duration pollInterval) {
        this.worker = worker;
        this.pollInterval = pollInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "event-worker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @return true if the worker was started by this call, false if it was already running
     */
    public synchronized boolean start() {
        if (task != null) {
            log.warn("[WORKER] Start requested but worker is already running");
            return false;
        }
        log.info("[WORKER] Starting event worker (polling every {}ms)", pollInterval.toMillis());
        task = scheduler.scheduleWithFixedDelay(this::runCycle, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        return true;
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isCancelled() && !scheduler.isShutdown();
    }

    /**
     * Stop polling; waits up to {@code timeout} for an in-progress drain.
     */
    public synchronized void stop(Duration timeout) {
        log.info("[WORKER] Stopping event worker...");
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[WORKER] Drain did not finish within {}ms, interrupting", timeout.toMillis());
                scheduler.shutdownNow();
            }
            log.info("[WORKER] Event worker stopped");
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void runCycle() {
        try {
            worker.drainOnce();
        } catch (Exception e) {
            log.error("[WORKER] Error in worker loop: {}", e.getMessage(), e);
        }
    }
}
