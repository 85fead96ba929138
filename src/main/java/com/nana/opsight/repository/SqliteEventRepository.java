package com.nana.opsight.repository;

import com.nana.opsight.domain.Event;
import com.nana.opsight.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite implementation of {@link EventRepository}.
 *
 * <p>{@link #insertBatch(List)} is the loader's hot path: one prepared
 * statement, one {@code addBatch()} per event, one {@code executeBatch()}
 * per chunk. It never commits; the chunk's transaction does.
 */
public class SqliteEventRepository extends JdbcRepositorySupport implements EventRepository {

    private static final Logger log = LoggerFactory.getLogger(SqliteEventRepository.class);

    // -----------------------------------------------------------------------
    // SQL CONSTANTS
    // -----------------------------------------------------------------------

    private static final String COLUMNS = """
            Session_ID, Operator_ID, Timestamp, TimeInterval, Address, FunctionCode,
            CommandResponse, ControlMode, ControlScheme, CRC, DataLength,
            InvalidFunctionCode, InvalidDataLength, PumpState, SolenoidState,
            SetPoint, PipelinePSI, PIDCycleTime, PIDDeadband, PIDGain, PIDRate, PIDReset,
            deltaSetPoint, deltaPipelinePSI, deltaPIDCycleTime, deltaPIDDeadband,
            deltaPIDGain, deltaPIDRate, deltaPIDReset, Label, Source_Row
            """;

    private static final String SQL_INSERT =
            "INSERT INTO Events (" + COLUMNS + ") VALUES ("
            + placeholders(31) + ")";

    private static final String SQL_FIND_BY_ID =
            "SELECT Event_ID, " + COLUMNS + " FROM Events WHERE Event_ID = ?";

    private static final String SQL_FIND_BY_SESSION =
            "SELECT Event_ID, " + COLUMNS + " FROM Events WHERE Session_ID = ? ORDER BY Timestamp, Event_ID";

    private static final String SQL_COUNT_BY_SESSION =
            "SELECT COUNT(*) FROM Events WHERE Session_ID = ?";

    private static final String SQL_COUNT_ALL = "SELECT COUNT(*) FROM Events";

    public SqliteEventRepository(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    // -----------------------------------------------------------------------
    // ROW MAPPING
    // -----------------------------------------------------------------------

    private void bind(PreparedStatement ps, Event e) throws SQLException {
        setLong(ps,      1,  e.getSessionId());
        setString(ps,    2,  e.getOperatorId());
        setTimestamp(ps, 3,  e.getTimestamp());
        setDouble(ps,    4,  e.getTimeInterval());
        setString(ps,    5,  e.getAddress());
        setString(ps,    6,  e.getFunctionCode());
        setString(ps,    7,  e.getCommandResponse());
        setString(ps,    8,  e.getControlMode());
        setString(ps,    9,  e.getControlScheme());
        setInt(ps,       10, e.getCrc());
        setInt(ps,       11, e.getDataLength());
        setString(ps,    12, e.getInvalidFunctionCode());
        setString(ps,    13, e.getInvalidDataLength());
        setString(ps,    14, e.getPumpState());
        setString(ps,    15, e.getSolenoidState());
        setDouble(ps,    16, e.getSetPoint());
        setDouble(ps,    17, e.getPipelinePsi());
        setDouble(ps,    18, e.getPidCycleTime());
        setDouble(ps,    19, e.getPidDeadband());
        setDouble(ps,    20, e.getPidGain());
        setDouble(ps,    21, e.getPidRate());
        setDouble(ps,    22, e.getPidReset());
        setDouble(ps,    23, e.getDeltaSetPoint());
        setDouble(ps,    24, e.getDeltaPipelinePsi());
        setDouble(ps,    25, e.getDeltaPidCycleTime());
        setDouble(ps,    26, e.getDeltaPidDeadband());
        setDouble(ps,    27, e.getDeltaPidGain());
        setDouble(ps,    28, e.getDeltaPidRate());
        setDouble(ps,    29, e.getDeltaPidReset());
        setString(ps,    30, e.getLabel());
        setInt(ps,       31, e.getSourceRow());
    }

    private Event mapRow(ResultSet rs) throws SQLException {
        Event e = new Event();
        e.setId(rs.getLong("Event_ID"));
        e.setSessionId(getLong(rs, "Session_ID"));
        e.setOperatorId(rs.getString("Operator_ID"));
        e.setTimestamp(getTimestamp(rs, "Timestamp"));
        e.setTimeInterval(getDouble(rs, "TimeInterval"));
        e.setAddress(rs.getString("Address"));
        e.setFunctionCode(rs.getString("FunctionCode"));
        e.setCommandResponse(rs.getString("CommandResponse"));
        e.setControlMode(rs.getString("ControlMode"));
        e.setControlScheme(rs.getString("ControlScheme"));
        e.setCrc(getInt(rs, "CRC"));
        e.setDataLength(getInt(rs, "DataLength"));
        e.setInvalidFunctionCode(rs.getString("InvalidFunctionCode"));
        e.setInvalidDataLength(rs.getString("InvalidDataLength"));
        e.setPumpState(rs.getString("PumpState"));
        e.setSolenoidState(rs.getString("SolenoidState"));
        e.setSetPoint(getDouble(rs, "SetPoint"));
        e.setPipelinePsi(getDouble(rs, "PipelinePSI"));
        e.setPidCycleTime(getDouble(rs, "PIDCycleTime"));
        e.setPidDeadband(getDouble(rs, "PIDDeadband"));
        e.setPidGain(getDouble(rs, "PIDGain"));
        e.setPidRate(getDouble(rs, "PIDRate"));
        e.setPidReset(getDouble(rs, "PIDReset"));
        e.setDeltaSetPoint(getDouble(rs, "deltaSetPoint"));
        e.setDeltaPipelinePsi(getDouble(rs, "deltaPipelinePSI"));
        e.setDeltaPidCycleTime(getDouble(rs, "deltaPIDCycleTime"));
        e.setDeltaPidDeadband(getDouble(rs, "deltaPIDDeadband"));
        e.setDeltaPidGain(getDouble(rs, "deltaPIDGain"));
        e.setDeltaPidRate(getDouble(rs, "deltaPIDRate"));
        e.setDeltaPidReset(getDouble(rs, "deltaPIDReset"));
        e.setLabel(rs.getString("Label"));
        e.setSourceRow(getInt(rs, "Source_Row"));
        return e;
    }

    // -----------------------------------------------------------------------
    // CREATE
    // -----------------------------------------------------------------------

    @Override
    public void save(Event event) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT, Statement.RETURN_GENERATED_KEYS)) {
            bind(ps, event);
            ps.executeUpdate();
            event.setId(generatedKey(ps));
        } catch (SQLException ex) {
            throw translate("Failed to save event for session " + event.getSessionId(), ex);
        }
    }

    @Override
    public int insertBatch(List<Event> events) {
        if (events == null || events.isEmpty()) {
            return 0;
        }
        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT)) {
            for (Event event : events) {
                bind(ps, event);
                ps.addBatch();
            }
            int inserted = sumUpdateCounts(ps.executeBatch());
            log.debug("Inserted {} event(s) in one batch.", inserted);
            return inserted;
        } catch (SQLException ex) {
            throw translate("Failed to insert a batch of " + events.size() + " events", ex);
        }
    }

    // -----------------------------------------------------------------------
    // READ
    // -----------------------------------------------------------------------

    @Override
    public Optional<Event> findById(long eventId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_BY_ID)) {
            ps.setLong(1, eventId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw translate("Failed to find event " + eventId, ex);
        }
        return Optional.empty();
    }

    @Override
    public List<Event> findBySession(long sessionId) {
        List<Event> events = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_BY_SESSION)) {
            ps.setLong(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    events.add(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw translate("Failed to find events of session " + sessionId, ex);
        }
        return events;
    }

    @Override
    public long countBySession(long sessionId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_COUNT_BY_SESSION)) {
            ps.setLong(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException ex) {
            throw translate("Failed to count events of session " + sessionId, ex);
        }
    }

    @Override
    public long countAll() {
        try (PreparedStatement ps = conn().prepareStatement(SQL_COUNT_ALL);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException ex) {
            throw translate("Failed to count events", ex);
        }
    }
}
