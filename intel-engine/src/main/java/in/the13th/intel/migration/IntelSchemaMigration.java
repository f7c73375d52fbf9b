package in.the13th.intel.migration;

import in.the13th.intel.repository.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Intel schema migration - creates the engine tables on startup.
 *
 * Tables:
 * - events:      append-only event log with processed flag
 * - actions:     append-only action records
 * - email_logs:  immutable delivery audit log
 * - email_queue: pending / retrying deliveries
 */
public final class IntelSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(IntelSchemaMigration.class);

    private final DataSource dataSource;

    public IntelSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Create missing tables and add columns introduced after the first release.
     */
    public void migrate() {
        log.info("[SCHEMA] Starting intel schema migration");

        try (Connection conn = dataSource.getConnection()) {
            ensureTable(conn, "events", """
                CREATE TABLE events (
                    id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    user_name VARCHAR(255),
                    action VARCHAR(255) NOT NULL,
                    payload CLOB,
                    event_ts DOUBLE PRECISION NOT NULL,
                    processed BOOLEAN DEFAULT FALSE NOT NULL
                )
                """,
                "CREATE INDEX idx_events_unprocessed ON events (processed, event_ts)");

            ensureTable(conn, "actions", """
                CREATE TABLE actions (
                    id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    event_id BIGINT NOT NULL,
                    action_type VARCHAR(64) NOT NULL,
                    details CLOB,
                    action_ts DOUBLE PRECISION NOT NULL
                )
                """,
                "CREATE INDEX idx_actions_event ON actions (event_id)");

            ensureTable(conn, "email_logs", """
                CREATE TABLE email_logs (
                    id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    event_id BIGINT,
                    to_email VARCHAR(320),
                    subject VARCHAR(1000),
                    status VARCHAR(32) NOT NULL,
                    error CLOB,
                    created_at DOUBLE PRECISION NOT NULL
                )
                """,
                "CREATE INDEX idx_email_logs_event ON email_logs (event_id)");

            ensureTable(conn, "email_queue", """
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
                """,
                "CREATE INDEX idx_email_queue_due ON email_queue (next_retry_at)");

            updateSchema(conn);

            log.info("[SCHEMA] Migration completed successfully");

        } catch (SQLException e) {
            log.error("[SCHEMA] Migration failed: {}", e.getMessage(), e);
            throw new StorageException("Intel schema migration failed", e);
        }
    }

    private void ensureTable(Connection conn, String table, String ddl, String indexDdl) throws SQLException {
        if (tableExists(conn, table)) {
            log.info("[SCHEMA] {} table already exists", table);
            return;
        }
        log.info("[SCHEMA] Creating {} table...", table);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(ddl);
            stmt.execute(indexDdl);
        }
        log.info("[SCHEMA] ✓ {} table created", table);
    }

    /**
     * Columns added after the initial email_queue / email_logs layout.
     */
    private void updateSchema(Connection conn) throws SQLException {
        addColumnIfMissing(conn, "email_queue", "last_error", "CLOB");
        addColumnIfMissing(conn, "email_queue", "dead_lettered", "BOOLEAN DEFAULT FALSE NOT NULL");
        addColumnIfMissing(conn, "email_logs", "attempt", "INT DEFAULT 0 NOT NULL");
    }

    private void addColumnIfMissing(Connection conn, String table, String column, String definition)
            throws SQLException {
        if (columnExists(conn, table, column)) {
            return;
        }
        log.info("[SCHEMA] Adding column {}.{}", table, column);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("ALTER TABLE " + table + " ADD COLUMN " + column + " " + definition);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        for (String candidate : new String[]{tableName.toUpperCase(), tableName}) {
            try (ResultSet rs = metadata.getTables(null, null, candidate, new String[]{"TABLE"})) {
                if (rs.next()) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean columnExists(Connection conn, String tableName, String columnName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getColumns(null, null, tableName.toUpperCase(), columnName.toUpperCase())) {
            if (rs.next()) {
                return true;
            }
        }
        try (ResultSet rs = metadata.getColumns(null, null, tableName, columnName)) {
            return rs.next();
        }
    }
}
