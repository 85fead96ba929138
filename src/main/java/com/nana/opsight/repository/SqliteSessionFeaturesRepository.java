package com.nana.opsight.repository;

import com.nana.opsight.domain.SessionFeatures;
import com.nana.opsight.util.DatabaseManager;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

/**
 * One feature vector per session. A second vector for the same session is
 * an {@link IntegrityViolationException}; deleting the session removes it.
 */
public class SqliteSessionFeaturesRepository extends JdbcRepositorySupport {

    private static final String METRIC_COLUMNS = """
            Command_Frequency, Inter_Command_Mean, Inter_Command_Std, Command_Burst_Rate,
            Control_Mode_Change_Rate, High_Risk_Command_Ratio, Invalid_Command_Rate,
            Pump_State_Change_Rate, SetPoint_Shock_Event_Rate, PID_Modification_Rate,
            Command_Entropy, Process_Command_Correlation
            """;

    private static final String SQL_INSERT =
            "INSERT INTO Session_Features (Session_ID, " + METRIC_COLUMNS + ") VALUES ("
            + placeholders(13) + ")";

    private static final String SQL_FIND_BY_SESSION =
            "SELECT Session_features_ID, Session_ID, Created_At, " + METRIC_COLUMNS
            + " FROM Session_Features WHERE Session_ID = ?";

    public SqliteSessionFeaturesRepository(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    public void save(SessionFeatures f) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, f.getSessionId());
            ps.setDouble(2, f.getCommandFrequency());
            ps.setDouble(3, f.getInterCommandMean());
            ps.setDouble(4, f.getInterCommandStd());
            ps.setDouble(5, f.getCommandBurstRate());
            ps.setDouble(6, f.getControlModeChangeRate());
            ps.setDouble(7, f.getHighRiskCommandRatio());
            ps.setDouble(8, f.getInvalidCommandRate());
            ps.setDouble(9, f.getPumpStateChangeRate());
            ps.setDouble(10, f.getSetPointShockEventRate());
            ps.setDouble(11, f.getPidModificationRate());
            ps.setDouble(12, f.getCommandEntropy());
            ps.setDouble(13, f.getProcessCommandCorrelation());
            ps.executeUpdate();
            f.setId(generatedKey(ps));
        } catch (SQLException ex) {
            throw translate("Failed to save features of session " + f.getSessionId(), ex);
        }
    }

    public Optional<SessionFeatures> findBySession(long sessionId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_BY_SESSION)) {
            ps.setLong(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                SessionFeatures f = new SessionFeatures(rs.getLong("Session_ID"));
                f.setId(rs.getLong("Session_features_ID"));
                f.setCreatedAt(getTimestamp(rs, "Created_At"));
                f.setCommandFrequency(rs.getDouble("Command_Frequency"));
                f.setInterCommandMean(rs.getDouble("Inter_Command_Mean"));
                f.setInterCommandStd(rs.getDouble("Inter_Command_Std"));
                f.setCommandBurstRate(rs.getDouble("Command_Burst_Rate"));
                f.setControlModeChangeRate(rs.getDouble("Control_Mode_Change_Rate"));
                f.setHighRiskCommandRatio(rs.getDouble("High_Risk_Command_Ratio"));
                f.setInvalidCommandRate(rs.getDouble("Invalid_Command_Rate"));
                f.setPumpStateChangeRate(rs.getDouble("Pump_State_Change_Rate"));
                f.setSetPointShockEventRate(rs.getDouble("SetPoint_Shock_Event_Rate"));
                f.setPidModificationRate(rs.getDouble("PID_Modification_Rate"));
                f.setCommandEntropy(rs.getDouble("Command_Entropy"));
                f.setProcessCommandCorrelation(rs.getDouble("Process_Command_Correlation"));
                return Optional.of(f);
            }
        } catch (SQLException ex) {
            throw translate("Failed to find features of session " + sessionId, ex);
        }
    }
}
