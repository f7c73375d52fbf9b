package in.the13th.intel.service.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.the13th.intel.config.RuleConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Persisted rule configuration.
 *
 * On disk the rules live in a versioned envelope:
 * <pre>
 * { "schema_version": 1, "rules": { "score_threshold": 0.8 } }
 * </pre>
 * A flat legacy document (no {@code schema_version}) is migrated on load.
 * Saves go to a temp file that is atomically moved over the target; the in-memory copy
 * is swapped only after the write succeeded.
 */
public final class RuleConfigService {
    private static final Logger log = LoggerFactory.getLogger(RuleConfigService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String SCHEMA_VERSION_FIELD = "schema_version";
    static final String RULES_FIELD = "rules";

    private final Path rulesFile;
    private final RuleConfig defaults;
    private volatile RuleConfig current;

    public RuleConfigService(Path rulesFile, double defaultThreshold) {
        this.rulesFile = rulesFile;
        this.defaults = new RuleConfig(defaultThreshold);
        this.current = load();
    }

    /**
     * Current rules. Never null.
     */
    public RuleConfig current() {
        return current;
    }

    /**
     * Read the rules file, creating it with defaults when missing.
     * A missing file is not an error; an unreadable one falls back to defaults.
     */
    public RuleConfig load() {
        if (!Files.exists(rulesFile)) {
            log.info("No rules file at {}, writing defaults (score_threshold={})",
                rulesFile, defaults.scoreThreshold());
            try {
                write(defaults);
            } catch (IOException e) {
                log.error("Failed to persist default rules to {}: {}", rulesFile, e.getMessage(), e);
            }
            current = defaults;
            return defaults;
        }

        try {
            JsonNode root = MAPPER.readTree(Files.readString(rulesFile));
            RuleConfig loaded = migrate(root);
            current = loaded;
            log.info("Loaded rules from {} (score_threshold={})", rulesFile, loaded.scoreThreshold());
            return loaded;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to read rules file {}, using defaults: {}", rulesFile, e.getMessage());
            current = defaults;
            return defaults;
        }
    }

    /**
     * Replace the rules wholesale and persist them.
     *
     * @throws IllegalArgumentException if the config is invalid
     * @throws IOException if the file cannot be written; the cached rules are unchanged
     */
    public RuleConfig update(RuleConfig newConfig) throws IOException {
        if (newConfig == null) {
            throw new IllegalArgumentException("Rules cannot be null");
        }
        if (!newConfig.isValid()) {
            throw new IllegalArgumentException("score_threshold must be within [0, 1]");
        }

        write(newConfig);
        this.current = newConfig;

        log.info("Rules updated: score_threshold={}", newConfig.scoreThreshold());
        return newConfig;
    }

    /**
     * Parse a full rules document as accepted by the management API.
     *
     * @throws IllegalArgumentException on missing/invalid fields or unknown fields
     */
    public static RuleConfig parseDocument(JsonNode doc) {
        if (doc == null || !doc.isObject()) {
            throw new IllegalArgumentException("rules document must be a JSON object");
        }

        List<String> unknown = new ArrayList<>();
        Iterator<String> names = doc.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!RuleConfig.SCORE_THRESHOLD.equals(name)) {
                unknown.add(name);
            }
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("unknown rule fields: " + unknown);
        }

        JsonNode threshold = doc.get(RuleConfig.SCORE_THRESHOLD);
        if (threshold == null || !threshold.isNumber()) {
            throw new IllegalArgumentException("score_threshold is required and must be a number");
        }
        RuleConfig config = new RuleConfig(threshold.asDouble());
        if (!config.isValid()) {
            throw new IllegalArgumentException("score_threshold must be within [0, 1]");
        }
        return config;
    }

    /**
     * Rules as the management API exposes them (no envelope).
     */
    public static ObjectNode toDocument(RuleConfig config) {
        ObjectNode doc = MAPPER.createObjectNode();
        doc.put(RuleConfig.SCORE_THRESHOLD, config.scoreThreshold());
        return doc;
    }

    private RuleConfig migrate(JsonNode root) throws IOException {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("rules file is not a JSON object");
        }

        JsonNode version = root.get(SCHEMA_VERSION_FIELD);
        if (version == null) {
            // v0: flat document written by earlier releases, possibly with ad-hoc keys
            JsonNode threshold = root.get(RuleConfig.SCORE_THRESHOLD);
            RuleConfig migrated = threshold != null && threshold.isNumber()
                ? new RuleConfig(threshold.asDouble())
                : defaults;
            if (!migrated.isValid()) {
                throw new IllegalArgumentException("legacy score_threshold out of range");
            }
            if (root.size() > (threshold == null ? 0 : 1)) {
                log.warn("Dropping unsupported legacy rule keys while migrating {}", rulesFile);
            }
            write(migrated);
            log.info("Migrated rules file {} to schema version {}", rulesFile, RuleConfig.SCHEMA_VERSION);
            return migrated;
        }

        int v = version.asInt(-1);
        if (v != RuleConfig.SCHEMA_VERSION) {
            throw new IllegalArgumentException("unsupported rules schema_version " + version);
        }
        return parseDocument(root.get(RULES_FIELD));
    }

    private void write(RuleConfig config) throws IOException {
        Path dir = rulesFile.toAbsolutePath().getParent();
        Files.createDirectories(dir);

        ObjectNode envelope = MAPPER.createObjectNode();
        envelope.put(SCHEMA_VERSION_FIELD, RuleConfig.SCHEMA_VERSION);
        envelope.set(RULES_FIELD, toDocument(config));
        String json = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(envelope);

        Path tmp = Files.createTempFile(dir, rulesFile.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, json);
            try {
                Files.move(tmp, rulesFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, rulesFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("Rules saved to {}", rulesFile);
    }
}
