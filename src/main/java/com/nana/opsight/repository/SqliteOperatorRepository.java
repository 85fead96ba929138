package com.nana.opsight.repository;

import com.nana.opsight.domain.Operator;
import com.nana.opsight.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * SQLite implementation of {@link OperatorRepository}.
 */
public class SqliteOperatorRepository extends JdbcRepositorySupport implements OperatorRepository {

    private static final Logger log = LoggerFactory.getLogger(SqliteOperatorRepository.class);

    // -----------------------------------------------------------------------
    // SQL CONSTANTS
    // -----------------------------------------------------------------------

    private static final String SQL_INSERT = """
            INSERT INTO Operators (Operator_ID, Crew_ID, Default_Shift_ID, Operator_Rank)
            VALUES (?, ?, ?, ?)
            """;

    private static final String SQL_FIND_BY_ID = """
            SELECT Operator_ID, Crew_ID, Default_Shift_ID, Operator_Rank, Created_At
            FROM Operators
            WHERE Operator_ID = ?
            """;

    private static final String SQL_FIND_BY_CREW = """
            SELECT Operator_ID, Crew_ID, Default_Shift_ID, Operator_Rank, Created_At
            FROM Operators
            WHERE Crew_ID = ?
            ORDER BY Operator_ID
            """;

    private static final String SQL_EXISTING_IDS_PREFIX =
            "SELECT Operator_ID FROM Operators WHERE Operator_ID IN (";

    private static final String SQL_COUNT_ALL = "SELECT COUNT(*) FROM Operators";

    public SqliteOperatorRepository(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    private Operator mapRow(ResultSet rs) throws SQLException {
        Operator operator = new Operator(
                rs.getString("Operator_ID"),
                getLong(rs, "Crew_ID"),
                getLong(rs, "Default_Shift_ID"),
                rs.getInt("Operator_Rank") != 0);
        operator.setCreatedAt(getTimestamp(rs, "Created_At"));
        return operator;
    }

    private void bind(PreparedStatement ps, Operator operator) throws SQLException {
        ps.setString(1, operator.getOperatorId());
        setLong(ps, 2, operator.getCrewId());
        setLong(ps, 3, operator.getDefaultShiftId());
        ps.setInt(4, operator.isRank() ? 1 : 0);
    }

    // -----------------------------------------------------------------------
    // CREATE
    // -----------------------------------------------------------------------

    @Override
    public void save(Operator operator) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT)) {
            bind(ps, operator);
            ps.executeUpdate();
            log.debug("Operator saved: {}", operator.getOperatorId());
        } catch (SQLException ex) {
            throw translate("Failed to save operator " + operator.getOperatorId(), ex);
        }
    }

    @Override
    public int saveAll(Collection<Operator> operators) {
        if (operators == null || operators.isEmpty()) {
            return 0;
        }
        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT)) {
            for (Operator operator : operators) {
                bind(ps, operator);
                ps.addBatch();
            }
            int inserted = sumUpdateCounts(ps.executeBatch());
            log.debug("Inserted {} operator(s) in one batch.", inserted);
            return inserted;
        } catch (SQLException ex) {
            throw translate("Failed to insert " + operators.size() + " operators", ex);
        }
    }

    // -----------------------------------------------------------------------
    // READ
    // -----------------------------------------------------------------------

    @Override
    public Optional<Operator> findById(String operatorId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_BY_ID)) {
            ps.setString(1, operatorId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw translate("Failed to find operator " + operatorId, ex);
        }
        return Optional.empty();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Large id sets are queried in slices of {@value #MAX_IN_PARAMETERS}.
     */
    @Override
    public Set<String> findExistingIds(Collection<String> operatorIds) {
        Set<String> existing = new HashSet<>();
        if (operatorIds == null || operatorIds.isEmpty()) {
            return existing;
        }
        for (List<String> slice : partition(new LinkedHashSet<>(operatorIds), MAX_IN_PARAMETERS)) {
            String sql = SQL_EXISTING_IDS_PREFIX + placeholders(slice.size()) + ")";
            try (PreparedStatement ps = conn().prepareStatement(sql)) {
                for (int i = 0; i < slice.size(); i++) {
                    ps.setString(i + 1, slice.get(i));
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        existing.add(rs.getString(1));
                    }
                }
            } catch (SQLException ex) {
                throw translate("Failed to look up existing operator ids", ex);
            }
        }
        return existing;
    }

    @Override
    public List<Operator> findByCrew(long crewId) {
        List<Operator> operators = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_BY_CREW)) {
            ps.setLong(1, crewId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    operators.add(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw translate("Failed to find operators of crew " + crewId, ex);
        }
        return operators;
    }

    @Override
    public long countAll() {
        try (PreparedStatement ps = conn().prepareStatement(SQL_COUNT_ALL);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException ex) {
            throw translate("Failed to count operators", ex);
        }
    }
}
