package in.the13th.intel.infrastructure.persistence;

import in.the13th.intel.domain.delivery.DeliveryLogEntry;
import in.the13th.intel.domain.delivery.DeliveryStatus;
import in.the13th.intel.repository.DeliveryLogRepository;
import in.the13th.intel.repository.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of DeliveryLogRepository (email_logs table).
 */
public final class JdbcDeliveryLogRepository implements DeliveryLogRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcDeliveryLogRepository.class);

    private final DataSource dataSource;

    public JdbcDeliveryLogRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public DeliveryLogEntry append(Long eventId, String recipient, String subject,
                                   DeliveryStatus status, String error, int attempt, double createdAt) {
        String sql = """
                INSERT INTO email_logs (event_id, to_email, subject, status, error, attempt, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            if (eventId == null) {
                ps.setNull(1, Types.BIGINT);
            } else {
                ps.setLong(1, eventId);
            }
            ps.setString(2, recipient);
            ps.setString(3, subject);
            ps.setString(4, status.wireName());
            ps.setString(5, error);
            ps.setInt(6, attempt);
            ps.setDouble(7, createdAt);
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (keys.next()) {
                    return new DeliveryLogEntry(keys.getLong(1), eventId, recipient, subject,
                        status, error, attempt, createdAt);
                }
            }
            throw new StorageException("No id generated for delivery log insert");
        } catch (SQLException ex) {
            log.error("Failed to log delivery for event {}: {}", eventId, ex.getMessage(), ex);
            throw new StorageException("Failed to log delivery", ex);
        }
    }

    @Override
    public List<DeliveryLogEntry> fetchRecent(int limit) {
        String sql = """
                SELECT id, event_id, to_email, subject, status, error, attempt, created_at
                FROM email_logs
                ORDER BY id DESC
                LIMIT ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException ex) {
            log.error("Failed to list delivery logs: {}", ex.getMessage(), ex);
            throw new StorageException("Failed to list delivery logs", ex);
        }
    }

    @Override
    public List<DeliveryLogEntry> findByEventId(long eventId) {
        String sql = """
                SELECT id, event_id, to_email, subject, status, error, attempt, created_at
                FROM email_logs
                WHERE event_id = ?
                ORDER BY id ASC
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, eventId);
            return executeQuery(ps);
        } catch (SQLException ex) {
            log.error("Failed to list delivery logs for event {}: {}", eventId, ex.getMessage(), ex);
            throw new StorageException("Failed to list delivery logs", ex);
        }
    }

    private List<DeliveryLogEntry> executeQuery(PreparedStatement ps) throws SQLException {
        List<DeliveryLogEntry> entries = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                long rawEventId = rs.getLong("event_id");
                Long eventId = rs.wasNull() ? null : rawEventId;
                entries.add(new DeliveryLogEntry(
                    rs.getLong("id"),
                    eventId,
                    rs.getString("to_email"),
                    rs.getString("subject"),
                    DeliveryStatus.fromWire(rs.getString("status")),
                    rs.getString("error"),
                    rs.getInt("attempt"),
                    rs.getDouble("created_at")));
            }
        }
        return entries;
    }
}
