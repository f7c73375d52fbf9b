package in.the13th.intel.bootstrap;

import in.the13th.intel.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration validator.
 *
 * Runs before any component is wired. Collects every problem and throws a single
 * IllegalStateException so the operator sees the whole list at once.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(EngineConfig config) {
        log.info("Running startup config validation...");

        List<String> problems = new ArrayList<>();

        if (config.port() <= 0 || config.port() > 65_535) {
            problems.add("PORT must be within 1..65535 (got " + config.port() + ")");
        }

        double threshold = config.defaultScoreThreshold();
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            problems.add("SCORE_THRESHOLD must be within [0, 1] (got " + threshold + ")");
        }

        requirePositive(problems, "POLL_INTERVAL_MS", config.pollInterval());
        requirePositive(problems, "RETRY_INTERVAL_MS", config.retryInterval());
        requirePositive(problems, "RETRY_MAX_BACKOFF_SEC", config.retryMaxBackoff());
        requirePositive(problems, "WS_PING_MS", config.wsPingInterval());
        requirePositive(problems, "SHUTDOWN_TIMEOUT_MS", config.shutdownTimeout());

        if (config.immediateRetryBackoff().isNegative()) {
            problems.add("IMMEDIATE_RETRY_BACKOFF_MS must not be negative");
        }
        if (config.workerBatchSize() <= 0) {
            problems.add("WORKER_BATCH_SIZE must be positive");
        }
        if (config.retryBatchSize() <= 0) {
            problems.add("RETRY_BATCH_SIZE must be positive");
        }
        if (config.retryMaxAttempts() <= 0) {
            problems.add("RETRY_MAX_ATTEMPTS must be positive");
        }
        if (config.immediateRetries() <= 0) {
            problems.add("IMMEDIATE_RETRIES must be positive");
        }
        if (config.deliveryThreads() <= 0) {
            problems.add("DELIVERY_THREADS must be positive");
        }
        if (config.dbPoolSize() <= 0) {
            problems.add("DB_POOL_SIZE must be positive");
        }

        String notifier = config.notifierType();
        if (EngineConfig.NOTIFIER_WEBHOOK.equalsIgnoreCase(notifier)) {
            if (config.webhookUrl() == null || config.webhookUrl().isBlank()) {
                problems.add("NOTIFIER=webhook requires ALERT_WEBHOOK_URL");
            }
        } else if (!EngineConfig.NOTIFIER_LOG.equalsIgnoreCase(notifier)) {
            problems.add("NOTIFIER must be 'log' or 'webhook' (got '" + notifier + "')");
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException("INVALID CONFIG:\n  - " + String.join("\n  - ", problems));
        }

        log.info("Startup config validation passed (dataDir={}, notifier={}, threshold={})",
            config.dataDir(), notifier, threshold);
    }

    private static void requirePositive(List<String> problems, String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            problems.add(key + " must be positive");
        }
    }

    private StartupConfigValidator() {}
}
