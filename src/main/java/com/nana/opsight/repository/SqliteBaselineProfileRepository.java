package com.nana.opsight.repository;

import com.nana.opsight.domain.BaselineProfile;
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
 * Versioned behaviour baselines per operator and (optionally) shift.
 *
 * <p>(operator, shift, version) is unique. A baseline with no shift is
 * stored with a NULL Shift_ID, and SQLite treats NULLs as distinct, so the
 * constraint does not stop two shift-less baselines sharing a version.
 */
public class SqliteBaselineProfileRepository extends JdbcRepositorySupport {

    private static final Logger log = LoggerFactory.getLogger(SqliteBaselineProfileRepository.class);

    private static final String SQL_INSERT = """
            INSERT INTO Baseline_Profiles
                (Operator_ID, Shift_ID, Baseline_Version, Trained_From, Trained_To, Profile_JSON)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String SQL_SELECT = """
            SELECT Baseline_ID, Operator_ID, Shift_ID, Baseline_Version,
                   Trained_From, Trained_To, Profile_JSON, Created_At
            FROM Baseline_Profiles
            """;

    private static final String SQL_FIND_LATEST = SQL_SELECT + """
            WHERE Operator_ID = ? AND Shift_ID = ?
            ORDER BY Trained_To DESC, Baseline_ID DESC
            LIMIT 1
            """;

    public SqliteBaselineProfileRepository(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    private BaselineProfile mapRow(ResultSet rs) throws SQLException {
        BaselineProfile b = new BaselineProfile(
                rs.getString("Operator_ID"),
                getLong(rs, "Shift_ID"),
                rs.getString("Baseline_Version"),
                getTimestamp(rs, "Trained_From"),
                getTimestamp(rs, "Trained_To"),
                rs.getString("Profile_JSON"));
        b.setId(rs.getLong("Baseline_ID"));
        b.setCreatedAt(getTimestamp(rs, "Created_At"));
        return b;
    }

    public void save(BaselineProfile baseline) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, baseline.getOperatorId());
            setLong(ps, 2, baseline.getShiftId());
            ps.setString(3, baseline.getVersion());
            setTimestamp(ps, 4, baseline.getTrainedFrom());
            setTimestamp(ps, 5, baseline.getTrainedTo());
            ps.setString(6, baseline.getProfileJson());
            ps.executeUpdate();
            baseline.setId(generatedKey(ps));
            log.info("Baseline {} saved for operator {} (shift {}).",
                    baseline.getVersion(), baseline.getOperatorId(), baseline.getShiftId());
        } catch (SQLException ex) {
            throw translate("Failed to save baseline " + baseline.getVersion()
                    + " for operator " + baseline.getOperatorId(), ex);
        }
    }

    public Optional<BaselineProfile> findById(long baselineId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_SELECT + " WHERE Baseline_ID = ?")) {
            ps.setLong(1, baselineId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw translate("Failed to find baseline " + baselineId, ex);
        }
    }

    public List<BaselineProfile> findByOperator(String operatorId) {
        List<BaselineProfile> result = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(
                SQL_SELECT + " WHERE Operator_ID = ? ORDER BY Trained_To, Baseline_ID")) {
            ps.setString(1, operatorId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw translate("Failed to find baselines of operator " + operatorId, ex);
        }
        return result;
    }

    /**
     * @return the baseline with the latest training window for the
     *         operator on that shift, if any
     */
    public Optional<BaselineProfile> findLatest(String operatorId, long shiftId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_LATEST)) {
            ps.setString(1, operatorId);
            ps.setLong(2, shiftId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw translate("Failed to find latest baseline of operator " + operatorId, ex);
        }
    }
}
