package in.the13th.intel.bootstrap;

import in.the13th.intel.config.EngineConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class StartupConfigValidatorTest {

    private static EngineConfig.Builder base() {
        return EngineConfig.builder(Path.of("build", "test-data"));
    }

    @Test
    void defaultsAreValid() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(base().build()));
    }

    @Test
    void reportsEveryProblemAtOnce() {
        EngineConfig config = base()
            .defaultScoreThreshold(1.5)
            .pollInterval(Duration.ZERO)
            .retryMaxAttempts(0)
            .build();

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(config));

        assertTrue(e.getMessage().contains("SCORE_THRESHOLD"));
        assertTrue(e.getMessage().contains("POLL_INTERVAL_MS"));
        assertTrue(e.getMessage().contains("RETRY_MAX_ATTEMPTS"));
    }

    @Test
    void webhookNotifierNeedsUrl() {
        EngineConfig config = base().notifierType(EngineConfig.NOTIFIER_WEBHOOK).build();

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(config));
        assertTrue(e.getMessage().contains("ALERT_WEBHOOK_URL"));

        assertDoesNotThrow(() -> StartupConfigValidator.validate(
            base().notifierType("webhook").webhookUrl("http://localhost:9/hook").build()));
    }

    @Test
    void unknownNotifierRejected() {
        assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(base().notifierType("smtp").build()));
    }
}
