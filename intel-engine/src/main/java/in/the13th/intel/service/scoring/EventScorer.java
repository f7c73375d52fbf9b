package in.the13th.intel.service.scoring;

import in.the13th.intel.config.RuleConfig;
import in.the13th.intel.domain.event.Event;
import in.the13th.intel.domain.event.EventPayload;

import java.util.Map;

/**
 * Importance scoring for events.
 *
 * Pure and deterministic: score = base(action) + payload boosts, clamped to [0, 1].
 */
public final class EventScorer {

    static final double UNKNOWN_ACTION_BASE = 0.2;

    private static final Map<String, Double> BASE_SCORES = Map.of(
        "signup", 0.3,
        "login", 0.1,
        "password_reset", 0.25,
        "lead_hot", 0.95,
        "client_upgrade", 0.9,
        "billing_failure", 0.85,
        "suspicious_activity", 0.9,
        "api_error", 0.4,
        "high_value_action", 0.9
    );

    private static final double MAX_VALUE_BOOST = 0.25;
    private static final double HIGH_PRIORITY_BOOST = 0.15;
    private static final double SUSPECTED_BOOST = 0.20;
    private static final double OCCURRENCE_STEP = 0.05;
    private static final double MAX_OCCURRENCE_BOOST = 0.25;

    /**
     * @throws ScoringException if the payload is not a JSON object
     */
    public double score(Event event) {
        EventPayload payload = EventPayload.from(event.payload());
        double score = baseScore(event.action());

        if (payload.value() != null) {
            double boost = Math.min(MAX_VALUE_BOOST, Math.log1p(payload.value()) / 10.0);
            if (Double.isFinite(boost)) {
                score += boost;
            }
        }
        if (payload.isHighPriority()) {
            score += HIGH_PRIORITY_BOOST;
        }
        if (payload.isSuspected()) {
            score += SUSPECTED_BOOST;
        }
        if (payload.occurrences() != null && payload.occurrences() > 1) {
            score += Math.min(MAX_OCCURRENCE_BOOST, payload.occurrences() * OCCURRENCE_STEP);
        }

        return clamp(score);
    }

    public boolean shouldTrigger(double score, RuleConfig rules) {
        return score >= rules.scoreThreshold();
    }

    static double baseScore(String action) {
        return BASE_SCORES.getOrDefault(action, UNKNOWN_ACTION_BASE);
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
