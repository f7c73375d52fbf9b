package in.the13th.intel.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.the13th.intel.domain.action.ActionRecord;
import in.the13th.intel.repository.ActionRepository;
import in.the13th.intel.repository.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of ActionRepository.
 */
public final class JdbcActionRepository implements ActionRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcActionRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final DataSource dataSource;

    public JdbcActionRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public ActionRecord insert(long eventId, String actionType, JsonNode details, double timestamp) {
        String sql = "INSERT INTO actions (event_id, action_type, details, action_ts) VALUES (?, ?, ?, ?)";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setLong(1, eventId);
            ps.setString(2, actionType);
            ps.setString(3, details == null ? null : MAPPER.writeValueAsString(details));
            ps.setDouble(4, timestamp);
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (keys.next()) {
                    long id = keys.getLong(1);
                    log.debug("Inserted action id={} for event {}", id, eventId);
                    return new ActionRecord(id, eventId, actionType, details, timestamp);
                }
            }
            throw new StorageException("No id generated for action insert");
        } catch (SQLException | JsonProcessingException ex) {
            log.error("Failed to insert action for event {}: {}", eventId, ex.getMessage(), ex);
            throw new StorageException("Failed to insert action", ex);
        }
    }

    @Override
    public List<ActionRecord> fetchRecent(int limit) {
        String sql = """
                SELECT id, event_id, action_type, details, action_ts
                FROM actions
                ORDER BY action_ts DESC, id DESC
                LIMIT ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException | JsonProcessingException ex) {
            log.error("Failed to list actions: {}", ex.getMessage(), ex);
            throw new StorageException("Failed to list actions", ex);
        }
    }

    @Override
    public List<ActionRecord> findByEventId(long eventId) {
        String sql = """
                SELECT id, event_id, action_type, details, action_ts
                FROM actions
                WHERE event_id = ?
                ORDER BY id ASC
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, eventId);
            return executeQuery(ps);
        } catch (SQLException | JsonProcessingException ex) {
            log.error("Failed to list actions for event {}: {}", eventId, ex.getMessage(), ex);
            throw new StorageException("Failed to list actions", ex);
        }
    }

    private List<ActionRecord> executeQuery(PreparedStatement ps) throws SQLException, JsonProcessingException {
        List<ActionRecord> actions = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String details = rs.getString("details");
                actions.add(new ActionRecord(
                    rs.getLong("id"),
                    rs.getLong("event_id"),
                    rs.getString("action_type"),
                    details == null ? null : MAPPER.readTree(details),
                    rs.getDouble("action_ts")));
            }
        }
        return actions;
    }
}
