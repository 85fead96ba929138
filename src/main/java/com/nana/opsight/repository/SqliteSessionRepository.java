package com.nana.opsight.repository;

import com.nana.opsight.domain.Session;
import com.nana.opsight.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * SQLite implementation of {@link SessionRepository}.
 *
 * <p>Inserting an explicit value into the AUTOINCREMENT key is allowed by
 * SQLite and advances the sequence, so loader-supplied ids and
 * store-generated ids never collide.
 */
public class SqliteSessionRepository extends JdbcRepositorySupport implements SessionRepository {

    private static final Logger log = LoggerFactory.getLogger(SqliteSessionRepository.class);

    private static final String COLUMNS = """
            Session_ID, shift_instance_id, Operator_ID, Shift_ID,
            Session_Start, Session_End, Inactivity_Threshold_Min, Created_At
            """;

    private static final String SQL_INSERT = """
            INSERT INTO Sessions
                (Session_ID, shift_instance_id, Operator_ID, Shift_ID,
                 Session_Start, Session_End, Inactivity_Threshold_Min)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SQL_FIND_BY_ID =
            "SELECT " + COLUMNS + " FROM Sessions WHERE Session_ID = ?";

    private static final String SQL_FIND_BY_OPERATOR =
            "SELECT " + COLUMNS + " FROM Sessions WHERE Operator_ID = ? ORDER BY Session_Start, Session_ID";

    private static final String SQL_EXISTING_IDS_PREFIX =
            "SELECT Session_ID FROM Sessions WHERE Session_ID IN (";

    private static final String SQL_COUNT_ALL = "SELECT COUNT(*) FROM Sessions";

    private static final String SQL_DELETE = "DELETE FROM Sessions WHERE Session_ID = ?";

    public SqliteSessionRepository(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    private Session mapRow(ResultSet rs) throws SQLException {
        Session session = new Session(
                rs.getLong("Session_ID"),
                rs.getString("Operator_ID"),
                rs.getLong("Shift_ID"),
                getTimestamp(rs, "Session_Start"),
                getTimestamp(rs, "Session_End"),
                rs.getInt("Inactivity_Threshold_Min"));
        session.setShiftInstanceId(getLong(rs, "shift_instance_id"));
        session.setCreatedAt(getTimestamp(rs, "Created_At"));
        return session;
    }

    private void bind(PreparedStatement ps, Session session) throws SQLException {
        setLong(ps, 1, session.getId());
        setLong(ps, 2, session.getShiftInstanceId());
        ps.setString(3, session.getOperatorId());
        ps.setLong(4, session.getShiftId());
        setTimestamp(ps, 5, session.getSessionStart());
        setTimestamp(ps, 6, session.getSessionEnd());
        ps.setInt(7, session.getInactivityThresholdMin());
    }

    // -----------------------------------------------------------------------
    // CREATE
    // -----------------------------------------------------------------------

    @Override
    public void save(Session session) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT, Statement.RETURN_GENERATED_KEYS)) {
            bind(ps, session);
            ps.executeUpdate();
            if (session.getId() == null) {
                session.setId(generatedKey(ps));
            }
            log.debug("Session saved: {}", session);
        } catch (SQLException ex) {
            throw translate("Failed to save session " + session.getId(), ex);
        }
    }

    @Override
    public int saveAll(Collection<Session> sessions) {
        if (sessions == null || sessions.isEmpty()) {
            return 0;
        }
        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT)) {
            for (Session session : sessions) {
                if (session.getId() == null) {
                    throw new IllegalArgumentException(
                            "Batch insert needs caller-supplied session ids: " + session);
                }
                bind(ps, session);
                ps.addBatch();
            }
            int inserted = sumUpdateCounts(ps.executeBatch());
            log.debug("Inserted {} session(s) in one batch.", inserted);
            return inserted;
        } catch (SQLException ex) {
            throw translate("Failed to insert " + sessions.size() + " sessions", ex);
        }
    }

    // -----------------------------------------------------------------------
    // READ
    // -----------------------------------------------------------------------

    @Override
    public Optional<Session> findById(long sessionId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_BY_ID)) {
            ps.setLong(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw translate("Failed to find session " + sessionId, ex);
        }
        return Optional.empty();
    }

    @Override
    public Set<Long> findExistingIds(Collection<Long> sessionIds) {
        Set<Long> existing = new HashSet<>();
        if (sessionIds == null || sessionIds.isEmpty()) {
            return existing;
        }
        for (List<Long> slice : partition(new LinkedHashSet<>(sessionIds), MAX_IN_PARAMETERS)) {
            String sql = SQL_EXISTING_IDS_PREFIX + placeholders(slice.size()) + ")";
            try (PreparedStatement ps = conn().prepareStatement(sql)) {
                for (int i = 0; i < slice.size(); i++) {
                    ps.setLong(i + 1, slice.get(i));
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        existing.add(rs.getLong(1));
                    }
                }
            } catch (SQLException ex) {
                throw translate("Failed to look up existing session ids", ex);
            }
        }
        return existing;
    }

    @Override
    public List<Session> findByOperator(String operatorId) {
        List<Session> sessions = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_BY_OPERATOR)) {
            ps.setString(1, operatorId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    sessions.add(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw translate("Failed to find sessions of operator " + operatorId, ex);
        }
        return sessions;
    }

    @Override
    public long countAll() {
        try (PreparedStatement ps = conn().prepareStatement(SQL_COUNT_ALL);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException ex) {
            throw translate("Failed to count sessions", ex);
        }
    }

    // -----------------------------------------------------------------------
    // DELETE
    // -----------------------------------------------------------------------

    @Override
    public boolean delete(long sessionId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_DELETE)) {
            ps.setLong(1, sessionId);
            boolean deleted = ps.executeUpdate() > 0;
            if (deleted) {
                log.info("Session {} deleted with its events, features and alerts.", sessionId);
            } else {
                log.debug("Delete matched no session with id {}.", sessionId);
            }
            return deleted;
        } catch (SQLException ex) {
            throw translate("Failed to delete session " + sessionId, ex);
        }
    }
}
