package in.the13th.intel.service.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.the13th.intel.config.RuleConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class RuleConfigServiceTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path dir;

    @Test
    @DisplayName("Missing rules file is created with the default threshold")
    void createsDefaultsWhenMissing() throws Exception {
        Path file = dir.resolve("nested").resolve("rules.json");

        RuleConfigService service = new RuleConfigService(file, 0.8);

        assertEquals(0.8, service.current().scoreThreshold());
        assertTrue(Files.exists(file));
        JsonNode onDisk = MAPPER.readTree(file.toFile());
        assertEquals(RuleConfig.SCHEMA_VERSION, onDisk.get("schema_version").asInt());
        assertEquals(0.8, onDisk.get("rules").get("score_threshold").asDouble());
    }

    @Test
    @DisplayName("PUT-style update round-trips through disk")
    void updateRoundTrip() throws Exception {
        Path file = dir.resolve("rules.json");
        RuleConfigService service = new RuleConfigService(file, 0.8);

        RuleConfig parsed = RuleConfigService.parseDocument(MAPPER.readTree("{\"score_threshold\": 0.5}"));
        service.update(parsed);

        assertEquals(0.5, service.current().scoreThreshold());
        assertEquals("{\"score_threshold\":0.5}", RuleConfigService.toDocument(service.current()).toString());

        RuleConfigService reloaded = new RuleConfigService(file, 0.8);
        assertEquals(0.5, reloaded.current().scoreThreshold());
    }

    @Test
    void saveLeavesNoTempFiles() throws Exception {
        Path file = dir.resolve("rules.json");
        RuleConfigService service = new RuleConfigService(file, 0.8);
        service.update(new RuleConfig(0.3));
        service.update(new RuleConfig(0.4));

        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count(), "only rules.json should remain");
        }
    }

    @Test
    @DisplayName("Legacy flat document is migrated to the versioned envelope")
    void migratesLegacyDocument() throws Exception {
        Path file = dir.resolve("rules.json");
        Files.writeString(file, "{\"score_threshold\": 0.65, \"notes\": \"old\"}");

        RuleConfigService service = new RuleConfigService(file, 0.8);

        assertEquals(0.65, service.current().scoreThreshold());
        JsonNode onDisk = MAPPER.readTree(file.toFile());
        assertEquals(1, onDisk.get("schema_version").asInt());
        assertEquals(0.65, onDisk.get("rules").get("score_threshold").asDouble());
        assertFalse(onDisk.get("rules").has("notes"));
    }

    @Test
    void corruptFileFallsBackToDefaults() throws Exception {
        Path file = dir.resolve("rules.json");
        Files.writeString(file, "{not json");

        RuleConfigService service = new RuleConfigService(file, 0.7);

        assertEquals(0.7, service.current().scoreThreshold());
        assertEquals("{not json", Files.readString(file), "operator file is left untouched");
    }

    @Test
    void rejectsUnknownFields() throws Exception {
        JsonNode doc = MAPPER.readTree("{\"score_threshold\": 0.5, \"surprise\": 1}");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> RuleConfigService.parseDocument(doc));
        assertTrue(e.getMessage().contains("surprise"));
    }

    @Test
    void rejectsMissingOrInvalidThreshold() throws Exception {
        assertThrows(IllegalArgumentException.class,
            () -> RuleConfigService.parseDocument(MAPPER.readTree("{}")));
        assertThrows(IllegalArgumentException.class,
            () -> RuleConfigService.parseDocument(MAPPER.readTree("{\"score_threshold\": \"high\"}")));
        assertThrows(IllegalArgumentException.class,
            () -> RuleConfigService.parseDocument(MAPPER.readTree("{\"score_threshold\": 1.5}")));
        assertThrows(IllegalArgumentException.class,
            () -> RuleConfigService.parseDocument(MAPPER.readTree("[0.5]")));
    }

    @Test
    void invalidUpdateKeepsCurrentRules() throws Exception {
        RuleConfigService service = new RuleConfigService(dir.resolve("rules.json"), 0.8);

        assertThrows(IllegalArgumentException.class, () -> service.update(new RuleConfig(-0.1)));
        assertEquals(0.8, service.current().scoreThreshold());
    }
}
