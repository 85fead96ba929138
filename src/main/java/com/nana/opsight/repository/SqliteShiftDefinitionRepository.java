package com.nana.opsight.repository;

import com.nana.opsight.domain.ShiftDefinition;
import com.nana.opsight.util.DatabaseManager;
import com.nana.opsight.util.TimestampParser;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shift definitions. Ids 1 and 2 are reference rows seeded with the schema.
 */
public class SqliteShiftDefinitionRepository extends JdbcRepositorySupport {

    private static final String SQL_INSERT = """
            INSERT INTO shift_definitions (shift_name, start_time, end_time, duration_hours)
            VALUES (?, ?, ?, ?)
            """;

    private static final String SQL_SELECT = """
            SELECT shift_id, shift_name, start_time, end_time, duration_hours, Created_At
            FROM shift_definitions
            """;

    public SqliteShiftDefinitionRepository(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    private ShiftDefinition mapRow(ResultSet rs) throws SQLException {
        ShiftDefinition def = new ShiftDefinition(
                rs.getLong("shift_id"),
                rs.getString("shift_name"),
                TimestampParser.parseStoredTime(rs.getString("start_time")),
                TimestampParser.parseStoredTime(rs.getString("end_time")),
                getDouble(rs, "duration_hours"));
        def.setCreatedAt(getTimestamp(rs, "Created_At"));
        return def;
    }

    public void save(ShiftDefinition definition) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT, Statement.RETURN_GENERATED_KEYS)) {
            setString(ps, 1, definition.getName());
            setString(ps, 2, TimestampParser.formatTime(definition.getStartTime()));
            setString(ps, 3, TimestampParser.formatTime(definition.getEndTime()));
            setDouble(ps, 4, definition.getDurationHours());
            ps.executeUpdate();
            definition.setId(generatedKey(ps));
        } catch (SQLException ex) {
            throw translate("Failed to save shift definition " + definition.getName(), ex);
        }
    }

    public Optional<ShiftDefinition> findById(long shiftId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_SELECT + " WHERE shift_id = ?")) {
            ps.setLong(1, shiftId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw translate("Failed to find shift definition " + shiftId, ex);
        }
    }

    public List<ShiftDefinition> findAll() {
        List<ShiftDefinition> all = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(SQL_SELECT + " ORDER BY shift_id");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                all.add(mapRow(rs));
            }
        } catch (SQLException ex) {
            throw translate("Failed to list shift definitions", ex);
        }
        return all;
    }
}
