package in.the13th.intel.testing;

import in.the13th.intel.domain.delivery.Alert;
import in.the13th.intel.service.notify.DeliveryResult;
import in.the13th.intel.service.notify.Notifier;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Notifier that plays back queued results, then succeeds.
 */
public final class ScriptedNotifier implements Notifier {

    private final Deque<DeliveryResult> script = new ArrayDeque<>();
    private final List<Alert> sent = Collections.synchronizedList(new ArrayList<>());

    public ScriptedNotifier failTimes(int n) {
        for (int i = 0; i < n; i++) {
            script.add(DeliveryResult.failure("smtp down #" + (i + 1)));
        }
        return this;
    }

    public ScriptedNotifier alwaysFail() {
        return failTimes(10_000);
    }

    @Override
    public synchronized DeliveryResult send(Alert alert) {
        sent.add(alert);
        DeliveryResult next = script.poll();
        return next == null ? DeliveryResult.ok() : next;
    }

    public List<Alert> attempts() {
        return sent;
    }

    @Override
    public String name() {
        return "scripted";
    }
}
