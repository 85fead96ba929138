package com.nana.opsight.repository;

import com.nana.opsight.domain.Alert;
import com.nana.opsight.domain.AlertCtiLink;
import com.nana.opsight.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Alerts raised from detections, and their links to CTI objects.
 *
 * <p>An alert disappears with its event, session or detection; its links
 * disappear with it. CTI objects are never removed through a link.
 */
public class SqliteAlertRepository extends JdbcRepositorySupport {

    private static final Logger log = LoggerFactory.getLogger(SqliteAlertRepository.class);

    // -----------------------------------------------------------------------
    // SQL CONSTANTS
    // -----------------------------------------------------------------------

    private static final String SQL_INSERT = """
            INSERT INTO Alerts (Event_ID, Session_ID, Detection_ID, Alert_Time,
                                Severity, Alert_Category, Alert_Description)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SQL_SELECT = """
            SELECT Alert_ID, Event_ID, Session_ID, Detection_ID, Alert_Time,
                   Severity, Alert_Category, Alert_Description
            FROM Alerts
            """;

    private static final String SQL_DELETE = "DELETE FROM Alerts WHERE Alert_ID = ?";

    private static final String SQL_INSERT_LINK = """
            INSERT INTO Alert_CTI_Links (Alert_ID, CTI_ID, Match_Reason)
            VALUES (?, ?, ?)
            """;

    private static final String SQL_FIND_LINKS = """
            SELECT Alert_ID, CTI_ID, Match_Reason, Link_Created_At
            FROM Alert_CTI_Links
            WHERE Alert_ID = ?
            ORDER BY CTI_ID
            """;

    public SqliteAlertRepository(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    private Alert mapRow(ResultSet rs) throws SQLException {
        Alert a = new Alert(
                rs.getLong("Event_ID"),
                rs.getLong("Session_ID"),
                rs.getLong("Detection_ID"),
                rs.getInt("Severity"),
                rs.getString("Alert_Category"),
                rs.getString("Alert_Description"));
        a.setId(rs.getLong("Alert_ID"));
        a.setAlertTime(getTimestamp(rs, "Alert_Time"));
        return a;
    }

    // -----------------------------------------------------------------------
    // ALERTS
    // -----------------------------------------------------------------------

    /** Stamps the alert with the current time when it has none. */
    public void save(Alert alert) {
        if (alert.getAlertTime() == null) {
            alert.setAlertTime(LocalDateTime.now());
        }
        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, alert.getEventId());
            ps.setLong(2, alert.getSessionId());
            ps.setLong(3, alert.getDetectionId());
            setTimestamp(ps, 4, alert.getAlertTime());
            ps.setInt(5, alert.getSeverity());
            ps.setString(6, alert.getCategory());
            ps.setString(7, alert.getDescription());
            ps.executeUpdate();
            alert.setId(generatedKey(ps));
            log.info("Alert {} raised: severity={} category={} session={}",
                    alert.getId(), alert.getSeverity(), alert.getCategory(), alert.getSessionId());
        } catch (SQLException ex) {
            throw translate("Failed to save alert for detection " + alert.getDetectionId(), ex);
        }
    }

    public Optional<Alert> findById(long alertId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_SELECT + " WHERE Alert_ID = ?")) {
            ps.setLong(1, alertId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw translate("Failed to find alert " + alertId, ex);
        }
    }

    public List<Alert> findBySession(long sessionId) {
        List<Alert> result = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(
                SQL_SELECT + " WHERE Session_ID = ? ORDER BY Alert_Time, Alert_ID")) {
            ps.setLong(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw translate("Failed to find alerts of session " + sessionId, ex);
        }
        return result;
    }

    /**
     * @return true if an alert was removed
     */
    public boolean delete(long alertId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_DELETE)) {
            ps.setLong(1, alertId);
            return ps.executeUpdate() > 0;
        } catch (SQLException ex) {
            throw translate("Failed to delete alert " + alertId, ex);
        }
    }

    // -----------------------------------------------------------------------
    // CTI LINKS
    // -----------------------------------------------------------------------

    /**
     * Links an alert to a CTI object. Linking the same pair twice is an
     * {@link IntegrityViolationException}.
     */
    public AlertCtiLink link(long alertId, long ctiId, String matchReason) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT_LINK)) {
            ps.setLong(1, alertId);
            ps.setLong(2, ctiId);
            setString(ps, 3, matchReason);
            ps.executeUpdate();
        } catch (SQLException ex) {
            throw translate("Failed to link alert " + alertId + " to CTI object " + ctiId, ex);
        }
        AlertCtiLink link = new AlertCtiLink(alertId, ctiId, matchReason);
        link.setCreatedAt(LocalDateTime.now());
        return link;
    }

    public List<AlertCtiLink> findLinks(long alertId) {
        List<AlertCtiLink> links = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_LINKS)) {
            ps.setLong(1, alertId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    AlertCtiLink link = new AlertCtiLink(
                            rs.getLong("Alert_ID"),
                            rs.getLong("CTI_ID"),
                            rs.getString("Match_Reason"));
                    link.setCreatedAt(getTimestamp(rs, "Link_Created_At"));
                    links.add(link);
                }
            }
        } catch (SQLException ex) {
            throw translate("Failed to find CTI links of alert " + alertId, ex);
        }
        return links;
    }
}
