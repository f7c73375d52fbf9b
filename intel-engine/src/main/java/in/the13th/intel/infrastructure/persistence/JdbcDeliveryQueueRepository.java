package in.the13th.intel.infrastructure.persistence;

import in.the13th.intel.domain.delivery.Alert;
import in.the13th.intel.domain.delivery.DeliveryQueueEntry;
import in.the13th.intel.repository.DeliveryQueueRepository;
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
import java.util.Optional;

/**
 * JDBC implementation of DeliveryQueueRepository (email_queue table).
 */
public final class JdbcDeliveryQueueRepository implements DeliveryQueueRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcDeliveryQueueRepository.class);

    private static final String COLUMNS =
        "id, event_id, subject, body, to_email, attempts, next_retry_at, created_at, last_error, dead_lettered";

    private final DataSource dataSource;

    public JdbcDeliveryQueueRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public DeliveryQueueEntry enqueue(Alert alert, double nextRetryAt, double createdAt, String lastError) {
        String sql = """
                INSERT INTO email_queue (event_id, subject, body, to_email, attempts,
                                         next_retry_at, created_at, last_error, dead_lettered)
                VALUES (?, ?, ?, ?, 0, ?, ?, ?, FALSE)
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            if (alert.eventId() == null) {
                ps.setNull(1, Types.BIGINT);
            } else {
                ps.setLong(1, alert.eventId());
            }
            ps.setString(2, alert.subject());
            ps.setString(3, alert.body());
            ps.setString(4, alert.recipient());
            ps.setDouble(5, nextRetryAt);
            ps.setDouble(6, createdAt);
            ps.setString(7, lastError);
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (keys.next()) {
                    long id = keys.getLong(1);
                    log.debug("Enqueued delivery id={} for event {}", id, alert.eventId());
                    return new DeliveryQueueEntry(id, alert.eventId(), alert.subject(), alert.body(),
                        alert.recipient(), 0, nextRetryAt, createdAt, lastError, false);
                }
            }
            throw new StorageException("No id generated for queue insert");
        } catch (SQLException ex) {
            log.error("Failed to enqueue delivery for event {}: {}", alert.eventId(), ex.getMessage(), ex);
            throw new StorageException("Failed to enqueue delivery", ex);
        }
    }

    @Override
    public List<DeliveryQueueEntry> findDue(double now, int limit) {
        String sql = "SELECT " + COLUMNS + """
                 FROM email_queue
                WHERE dead_lettered = FALSE AND next_retry_at <= ?
                ORDER BY next_retry_at ASC, id ASC
                LIMIT ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setDouble(1, now);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException ex) {
            log.error("Failed to list due deliveries: {}", ex.getMessage(), ex);
            throw new StorageException("Failed to list due deliveries", ex);
        }
    }

    @Override
    public boolean recordFailure(long id, int attempts, double nextRetryAt, String error) {
        String sql = "UPDATE email_queue SET attempts = ?, next_retry_at = ?, last_error = ? WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, attempts);
            ps.setDouble(2, nextRetryAt);
            ps.setString(3, error);
            ps.setLong(4, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException ex) {
            log.error("Failed to update delivery {}: {}", id, ex.getMessage(), ex);
            throw new StorageException("Failed to update delivery", ex);
        }
    }

    @Override
    public boolean markDeadLettered(long id, int attempts, String error) {
        String sql = "UPDATE email_queue SET attempts = ?, last_error = ?, dead_lettered = TRUE WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, attempts);
            ps.setString(2, error);
            ps.setLong(3, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException ex) {
            log.error("Failed to dead-letter delivery {}: {}", id, ex.getMessage(), ex);
            throw new StorageException("Failed to dead-letter delivery", ex);
        }
    }

    @Override
    public boolean requeue(long id, double now) {
        String sql = "UPDATE email_queue SET attempts = 0, next_retry_at = ?, dead_lettered = FALSE WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setDouble(1, now);
            ps.setLong(2, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException ex) {
            log.error("Failed to requeue delivery {}: {}", id, ex.getMessage(), ex);
            throw new StorageException("Failed to requeue delivery", ex);
        }
    }

    @Override
    public boolean delete(long id) {
        String sql = "DELETE FROM email_queue WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException ex) {
            log.error("Failed to delete delivery {}: {}", id, ex.getMessage(), ex);
            throw new StorageException("Failed to delete delivery", ex);
        }
    }

    @Override
    public Optional<DeliveryQueueEntry> findById(long id) {
        String sql = "SELECT " + COLUMNS + " FROM email_queue WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            List<DeliveryQueueEntry> rows = executeQuery(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (SQLException ex) {
            log.error("Failed to load delivery {}: {}", id, ex.getMessage(), ex);
            throw new StorageException("Failed to load delivery", ex);
        }
    }

    @Override
    public List<DeliveryQueueEntry> findAll() {
        String sql = "SELECT " + COLUMNS + " FROM email_queue ORDER BY id DESC";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            return executeQuery(ps);
        } catch (SQLException ex) {
            log.error("Failed to list delivery queue: {}", ex.getMessage(), ex);
            throw new StorageException("Failed to list delivery queue", ex);
        }
    }

    @Override
    public long countPending() {
        String sql = "SELECT COUNT(*) FROM email_queue WHERE dead_lettered = FALSE";

        try (Connection conn = dataSource.getConnection();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(sql)) {

            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException ex) {
            log.error("Failed to count delivery queue: {}", ex.getMessage(), ex);
            throw new StorageException("Failed to count delivery queue", ex);
        }
    }

    private List<DeliveryQueueEntry> executeQuery(PreparedStatement ps) throws SQLException {
        List<DeliveryQueueEntry> entries = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                entries.add(mapRow(rs));
            }
        }
        return entries;
    }

    private DeliveryQueueEntry mapRow(ResultSet rs) throws SQLException {
        long id = rs.getLong("id");
        long rawEventId = rs.getLong("event_id");
        Long eventId = rs.wasNull() ? null : rawEventId;

        return new DeliveryQueueEntry(
            id,
            eventId,
            rs.getString("subject"),
            rs.getString("body"),
            rs.getString("to_email"),
            rs.getInt("attempts"),
            rs.getDouble("next_retry_at"),
            rs.getDouble("created_at"),
            rs.getString("last_error"),
            rs.getBoolean("dead_lettered"));
    }
}
