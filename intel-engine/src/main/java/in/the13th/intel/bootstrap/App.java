package in.the13th.intel.bootstrap;

import in.the13th.intel.config.EngineConfig;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: read config, validate, start the engine, stop it on JVM shutdown.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== THE13TH Intel Engine Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        EngineConfig config = EngineConfig.fromEnv();
        StartupConfigValidator.validate(config);

        IntelEngine engine = IntelEngine.create(config, CollectorRegistry.defaultRegistry);
        Runtime.getRuntime().addShutdownHook(new Thread(engine::stop, "intel-shutdown"));
        engine.start();
    }

    private App() {}
}
