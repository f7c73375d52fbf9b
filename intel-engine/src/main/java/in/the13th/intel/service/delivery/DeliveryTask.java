package in.the13th.intel.service.delivery;

/**
 * Unit of work for the delivery executor.
 *
 * Tasks that never get to run (executor rejected them or was shut down) must be
 * {@link #abandon(String) abandoned} so the alert is handed to the retry schedule.
 */
public final class DeliveryTask implements Runnable {

    private final DeliveryService service;
    private final PendingDelivery pending;

    public DeliveryTask(DeliveryService service, PendingDelivery pending) {
        this.service = service;
        this.pending = pending;
    }

    @Override
    public void run() {
        service.deliver(pending);
    }

    public void abandon(String reason) {
        service.abandon(pending, reason);
    }

    public PendingDelivery pending() {
        return pending;
    }
}
