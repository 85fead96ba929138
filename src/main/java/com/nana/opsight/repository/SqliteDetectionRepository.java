package com.nana.opsight.repository;

import com.nana.opsight.domain.Detection;
import com.nana.opsight.util.DatabaseManager;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Model verdicts on events. (event, baseline, model type) is unique.
 */
public class SqliteDetectionRepository extends JdbcRepositorySupport {

    private static final String SQL_INSERT = """
            INSERT INTO Detection (Event_ID, Baseline_ID, Model_Type, Anomaly_Score,
                                   Threshold, Evidence_JSON, Predicted_Label, Detection_Time)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SQL_SELECT = """
            SELECT Detection_ID, Event_ID, Baseline_ID, Model_Type, Anomaly_Score,
                   Threshold, Evidence_JSON, Predicted_Label, Detection_Time
            FROM Detection
            """;

    public SqliteDetectionRepository(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    private Detection mapRow(ResultSet rs) throws SQLException {
        Detection d = new Detection(
                rs.getLong("Event_ID"),
                rs.getLong("Baseline_ID"),
                rs.getString("Model_Type"),
                rs.getDouble("Anomaly_Score"),
                rs.getDouble("Threshold"),
                rs.getString("Evidence_JSON"),
                rs.getString("Predicted_Label"));
        d.setId(rs.getLong("Detection_ID"));
        d.setDetectionTime(getTimestamp(rs, "Detection_Time"));
        return d;
    }

    /** Stamps the detection with the current time when it has none. */
    public void save(Detection detection) {
        if (detection.getDetectionTime() == null) {
            detection.setDetectionTime(LocalDateTime.now());
        }
        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, detection.getEventId());
            ps.setLong(2, detection.getBaselineId());
            ps.setString(3, detection.getModelType());
            ps.setDouble(4, detection.getAnomalyScore());
            ps.setDouble(5, detection.getThreshold());
            ps.setString(6, detection.getEvidenceJson());
            ps.setString(7, detection.getPredictedLabel());
            setTimestamp(ps, 8, detection.getDetectionTime());
            ps.executeUpdate();
            detection.setId(generatedKey(ps));
        } catch (SQLException ex) {
            throw translate("Failed to save " + detection.getModelType()
                    + " detection for event " + detection.getEventId(), ex);
        }
    }

    public Optional<Detection> findById(long detectionId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_SELECT + " WHERE Detection_ID = ?")) {
            ps.setLong(1, detectionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw translate("Failed to find detection " + detectionId, ex);
        }
    }

    public List<Detection> findByEvent(long eventId) {
        List<Detection> result = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(
                SQL_SELECT + " WHERE Event_ID = ? ORDER BY Detection_Time, Detection_ID")) {
            ps.setLong(1, eventId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw translate("Failed to find detections of event " + eventId, ex);
        }
        return result;
    }
}
