package in.the13th.intel.migration;

import in.the13th.intel.domain.delivery.Alert;
import in.the13th.intel.domain.delivery.DeliveryQueueEntry;
import in.the13th.intel.infrastructure.persistence.JdbcDeliveryQueueRepository;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class IntelSchemaMigrationTest {

    private JdbcDataSource dataSource;

    @BeforeEach
    void setUp() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:migration-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        dataSource.setPassword("");
    }

    @Test
    void runningTwiceIsHarmless() throws Exception {
        IntelSchemaMigration migration = new IntelSchemaMigration(dataSource);

        migration.migrate();
        migration.migrate();

        assertEquals(0, count("events"));
        assertEquals(0, count("email_queue"));
    }

    @Test
    @DisplayName("Queue table from an earlier release gains the retry bookkeeping columns")
    void upgradesLegacyQueueTable() throws Exception {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE email_queue (
                    id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    event_id BIGINT,
                    subject VARCHAR(1000),
                    body CLOB,
                    to_email VARCHAR(320),
                    attempts INT DEFAULT 0 NOT NULL,
                    next_retry_at DOUBLE PRECISION DEFAULT 0 NOT NULL,
                    created_at DOUBLE PRECISION NOT NULL
                )
                """);
            stmt.execute("INSERT INTO email_queue (event_id, subject, body, to_email, attempts, next_retry_at, created_at) "
                + "VALUES (1, 'old', 'b', 'ops@example.com', 2, 5.0, 1.0)");
        }

        new IntelSchemaMigration(dataSource).migrate();

        JdbcDeliveryQueueRepository repo = new JdbcDeliveryQueueRepository(dataSource);
        DeliveryQueueEntry legacy = repo.findAll().get(0);
        assertEquals("old", legacy.subject());
        assertEquals(2, legacy.attempts());
        assertFalse(legacy.deadLettered());
        assertNull(legacy.lastError());

        DeliveryQueueEntry fresh = repo.enqueue(new Alert(2L, "new", "b", "ops@example.com"), 9.0, 8.0, "boom");
        assertEquals("boom", repo.findById(fresh.id()).orElseThrow().lastError());
    }

    private long count(String table) throws Exception {
        try (Connection conn = dataSource.getConnection();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        }
    }
}
