package in.the13th.intel.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.the13th.intel.domain.event.Event;
import in.the13th.intel.domain.event.NewEvent;
import in.the13th.intel.testing.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcEventRepositoryTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DataSource dataSource;
    private JdbcEventRepository repo;

    @BeforeEach
    void setUp() {
        dataSource = TestDatabase.create();
        repo = new JdbcEventRepository(dataSource);
    }

    @Test
    @DisplayName("Unprocessed events come back oldest first")
    void fetchUnprocessedOrdersByTimestamp() throws Exception {
        Event late = repo.insert(new NewEvent("u", "login", null, 300.0));
        Event early = repo.insert(new NewEvent("u", "signup", MAPPER.readTree("{\"value\": 1}"), 100.0));
        Event middle = repo.insert(new NewEvent(null, "api_error", null, 200.0));

        List<Event> pending = repo.fetchUnprocessed(10);

        assertEquals(List.of(early.id(), middle.id(), late.id()), pending.stream().map(Event::id).toList());
        assertEquals(1, pending.get(0).payload().get("value").asInt());
        assertEquals(2, repo.fetchUnprocessed(2).size());
    }

    @Test
    void markProcessedIsIdempotent() {
        Event event = repo.insert(new NewEvent("u", "login", null, 1.0));

        assertTrue(repo.markProcessed(event.id()));
        assertFalse(repo.markProcessed(event.id()));
        assertTrue(repo.findById(event.id()).orElseThrow().processed());
        assertTrue(repo.fetchUnprocessed(10).isEmpty());
        assertEquals(0, repo.countUnprocessed());
    }

    @Test
    void fetchRecentIsNewestFirst() {
        repo.insert(new NewEvent("u", "a", null, 1.0));
        repo.insert(new NewEvent("u", "b", null, 3.0));
        repo.insert(new NewEvent("u", "c", null, 2.0));

        List<Event> recent = repo.fetchRecent(2);

        assertEquals(List.of("b", "c"), recent.stream().map(Event::action).toList());
    }

    @Test
    @DisplayName("Unreadable stored payload is surfaced as text instead of failing the read")
    void unreadablePayloadStaysReadable() throws Exception {
        Event event = repo.insert(new NewEvent("u", "login", null, 1.0));
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("UPDATE events SET payload = 'not json {' WHERE id = " + event.id());
        }

        Event loaded = repo.findById(event.id()).orElseThrow();

        assertTrue(loaded.payload().isTextual());
        assertEquals("not json {", loaded.payload().asText());
    }

    @Test
    void missingEventIsEmpty() {
        assertTrue(repo.findById(42L).isEmpty());
    }
}
