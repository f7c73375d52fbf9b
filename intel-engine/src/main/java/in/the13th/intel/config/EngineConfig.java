package in.the13th.intel.config;

import in.the13th.intel.util.Env;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Immutable runtime configuration for the intel engine.
 *
 * Built once at startup (from env via {@link #fromEnv()}, or through the builder in tests)
 * and passed explicitly to every component that needs it.
 */
public record EngineConfig(
    int port,
    Path dataDir,

    // Storage
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize,
    Path rulesFile,

    // Scoring
    double defaultScoreThreshold,

    // Worker loop
    Duration pollInterval,
    int workerBatchSize,

    // Delivery
    String alertRecipient,
    String notifierType,         // log | webhook
    String webhookUrl,           // required when notifierType = webhook
    int deliveryThreads,
    int immediateRetries,
    Duration immediateRetryBackoff,

    // Retry queue
    Duration retryInterval,
    int retryBatchSize,
    int retryMaxAttempts,
    Duration retryMaxBackoff,

    // Live stream
    Duration wsPingInterval,

    // Lifecycle
    Duration shutdownTimeout    // bounded wait for the worker drain and in-flight deliveries
) {
    public static final String NOTIFIER_LOG = "log";
    public static final String NOTIFIER_WEBHOOK = "webhook";

    /**
     * Read configuration from environment variables (system properties as fallback).
     */
    public static EngineConfig fromEnv() {
        Path dataDir = Paths.get(Env.get("DATA_DIR", "./data")).toAbsolutePath().normalize();
        return builder(dataDir)
            .port(Env.getInt("PORT", 8000))
            .dbUrl(Env.get("DB_URL", defaultDbUrl(dataDir)))
            .dbUser(Env.get("DB_USER", "sa"))
            .dbPass(Env.get("DB_PASS", ""))
            .dbPoolSize(Env.getInt("DB_POOL_SIZE", 5))
            .rulesFile(Paths.get(Env.get("RULES_FILE", dataDir.resolve("rules.json").toString())))
            .defaultScoreThreshold(Env.getDouble("SCORE_THRESHOLD", 0.8))
            .pollInterval(Duration.ofMillis(Env.getLong("POLL_INTERVAL_MS", 5000)))
            .workerBatchSize(Env.getInt("WORKER_BATCH_SIZE", 50))
            .alertRecipient(Env.get("ALERT_TO", "alerts@the13th.local"))
            .notifierType(Env.get("NOTIFIER", NOTIFIER_LOG))
            .webhookUrl(Env.get("ALERT_WEBHOOK_URL", null))
            .deliveryThreads(Env.getInt("DELIVERY_THREADS", 2))
            .immediateRetries(Env.getInt("IMMEDIATE_RETRIES", 3))
            .immediateRetryBackoff(Duration.ofMillis(Env.getLong("IMMEDIATE_RETRY_BACKOFF_MS", 3000)))
            .retryInterval(Duration.ofMillis(Env.getLong("RETRY_INTERVAL_MS", 10_000)))
            .retryBatchSize(Env.getInt("RETRY_BATCH_SIZE", 10))
            .retryMaxAttempts(Env.getInt("RETRY_MAX_ATTEMPTS", 8))
            .retryMaxBackoff(Duration.ofSeconds(Env.getLong("RETRY_MAX_BACKOFF_SEC", 3600)))
            .wsPingInterval(Duration.ofMillis(Env.getLong("WS_PING_MS", 5000)))
            .shutdownTimeout(Duration.ofMillis(Env.getLong("SHUTDOWN_TIMEOUT_MS", 30_000)))
            .build();
    }

    static String defaultDbUrl(Path dataDir) {
        return "jdbc:h2:file:" + dataDir.resolve("intel").toString().replace('\\', '/');
    }

    public static Builder builder(Path dataDir) {
        return new Builder(dataDir);
    }

    public static final class Builder {
        private final Path dataDir;
        private int port = 8000;
        private String dbUrl;
        private String dbUser = "sa";
        private String dbPass = "";
        private int dbPoolSize = 5;
        private Path rulesFile;
        private double defaultScoreThreshold = 0.8;
        private Duration pollInterval = Duration.ofSeconds(5);
        private int workerBatchSize = 50;
        private String alertRecipient = "alerts@the13th.local";
        private String notifierType = NOTIFIER_LOG;
        private String webhookUrl;
        private int deliveryThreads = 2;
        private int immediateRetries = 3;
        private Duration immediateRetryBackoff = Duration.ofSeconds(3);
        private Duration retryInterval = Duration.ofSeconds(10);
        private int retryBatchSize = 10;
        private int retryMaxAttempts = 8;
        private Duration retryMaxBackoff = Duration.ofHours(1);
        private Duration wsPingInterval = Duration.ofSeconds(5);
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        private Builder(Path dataDir) {
            this.dataDir = dataDir;
            this.dbUrl = defaultDbUrl(dataDir);
            this.rulesFile = dataDir.resolve("rules.json");
        }

        public Builder port(int port) { this.port = port; return this; }
        public Builder dbUrl(String dbUrl) { this.dbUrl = dbUrl; return this; }
        public Builder dbUser(String dbUser) { this.dbUser = dbUser; return this; }
        public Builder dbPass(String dbPass) { this.dbPass = dbPass; return this; }
        public Builder dbPoolSize(int dbPoolSize) { this.dbPoolSize = dbPoolSize; return this; }
        public Builder rulesFile(Path rulesFile) { this.rulesFile = rulesFile; return this; }
        public Builder defaultScoreThreshold(double threshold) { this.defaultScoreThreshold = threshold; return this; }
        public Builder pollInterval(Duration pollInterval) { this.pollInterval = pollInterval; return this; }
        public Builder workerBatchSize(int workerBatchSize) { this.workerBatchSize = workerBatchSize; return this; }
        public Builder alertRecipient(String alertRecipient) { this.alertRecipient = alertRecipient; return this; }
        public Builder notifierType(String notifierType) { this.notifierType = notifierType; return this; }
        public Builder webhookUrl(String webhookUrl) { this.webhookUrl = webhookUrl; return this; }
        public Builder deliveryThreads(int deliveryThreads) { this.deliveryThreads = deliveryThreads; return this; }
        public Builder immediateRetries(int immediateRetries) { this.immediateRetries = immediateRetries; return this; }
        public Builder immediateRetryBackoff(Duration backoff) { this.immediateRetryBackoff = backoff; return this; }
        public Builder retryInterval(Duration retryInterval) { this.retryInterval = retryInterval; return this; }
        public Builder retryBatchSize(int retryBatchSize) { this.retryBatchSize = retryBatchSize; return this; }
        public Builder retryMaxAttempts(int retryMaxAttempts) { this.retryMaxAttempts = retryMaxAttempts; return this; }
        public Builder retryMaxBackoff(Duration retryMaxBackoff) { this.retryMaxBackoff = retryMaxBackoff; return this; }
        public Builder wsPingInterval(Duration wsPingInterval) { this.wsPingInterval = wsPingInterval; return this; }
        public Builder shutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; return this; }

        public EngineConfig build() {
            return new EngineConfig(port, dataDir, dbUrl, dbUser, dbPass, dbPoolSize, rulesFile,
                defaultScoreThreshold, pollInterval, workerBatchSize,
                alertRecipient, notifierType, webhookUrl, deliveryThreads,
                immediateRetries, immediateRetryBackoff,
                retryInterval, retryBatchSize, retryMaxAttempts, retryMaxBackoff,
                wsPingInterval, shutdownTimeout);
        }
    }
}
