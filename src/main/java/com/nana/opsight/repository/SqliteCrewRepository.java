package com.nana.opsight.repository;

import com.nana.opsight.domain.Crew;
import com.nana.opsight.domain.CrewRotation;
import com.nana.opsight.domain.ShiftInstance;
import com.nana.opsight.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Crews together with the rows that hang off them: rotations and shift
 * instances.
 */
public class SqliteCrewRepository extends JdbcRepositorySupport {

    private static final Logger log = LoggerFactory.getLogger(SqliteCrewRepository.class);

    // -----------------------------------------------------------------------
    // SQL CONSTANTS
    // -----------------------------------------------------------------------

    private static final String SQL_INSERT_CREW =
            "INSERT INTO crews (crew_name) VALUES (?)";

    private static final String SQL_FIND_CREW =
            "SELECT Crew_ID, crew_name, Created_At FROM crews WHERE Crew_ID = ?";

    private static final String SQL_INSERT_ROTATION = """
            INSERT INTO Crew_Rotation (Crew_ID, Anchor_Date, On_Days, Off_Days)
            VALUES (?, ?, ?, ?)
            """;

    private static final String SQL_FIND_ROTATIONS = """
            SELECT Rotation_ID, Crew_ID, Anchor_Date, On_Days, Off_Days, Created_At
            FROM Crew_Rotation
            WHERE Crew_ID = ?
            ORDER BY Anchor_Date
            """;

    private static final String SQL_INSERT_SHIFT_INSTANCE = """
            INSERT INTO shift_instances (crew_id, shift_id, shift_start, shift_end)
            VALUES (?, ?, ?, ?)
            """;

    private static final String SQL_FIND_SHIFT_INSTANCES = """
            SELECT shift_instance_id, crew_id, shift_id, shift_start, shift_end, Created_At
            FROM shift_instances
            WHERE crew_id = ?
            ORDER BY shift_start
            """;

    public SqliteCrewRepository(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    // -----------------------------------------------------------------------
    // CREWS
    // -----------------------------------------------------------------------

    public void saveCrew(Crew crew) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT_CREW, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, crew.getName());
            ps.executeUpdate();
            crew.setId(generatedKey(ps));
            log.debug("Crew saved: {}", crew);
        } catch (SQLException ex) {
            throw translate("Failed to save crew " + crew.getName(), ex);
        }
    }

    public Optional<Crew> findCrewById(long crewId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_CREW)) {
            ps.setLong(1, crewId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    Crew crew = new Crew(rs.getString("crew_name"));
                    crew.setId(rs.getLong("Crew_ID"));
                    crew.setCreatedAt(getTimestamp(rs, "Created_At"));
                    return Optional.of(crew);
                }
            }
        } catch (SQLException ex) {
            throw translate("Failed to find crew " + crewId, ex);
        }
        return Optional.empty();
    }

    // -----------------------------------------------------------------------
    // ROTATIONS
    // -----------------------------------------------------------------------

    public void saveRotation(CrewRotation rotation) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT_ROTATION, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, rotation.getCrewId());
            ps.setString(2, rotation.getAnchorDate().toString());
            ps.setInt(3, rotation.getOnDays());
            ps.setInt(4, rotation.getOffDays());
            ps.executeUpdate();
            rotation.setId(generatedKey(ps));
        } catch (SQLException ex) {
            throw translate("Failed to save rotation for crew " + rotation.getCrewId(), ex);
        }
    }

    public List<CrewRotation> findRotationsByCrew(long crewId) {
        List<CrewRotation> rotations = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_ROTATIONS)) {
            ps.setLong(1, crewId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    CrewRotation r = new CrewRotation(
                            rs.getLong("Crew_ID"),
                            LocalDate.parse(rs.getString("Anchor_Date")),
                            rs.getInt("On_Days"),
                            rs.getInt("Off_Days"));
                    r.setId(rs.getLong("Rotation_ID"));
                    r.setCreatedAt(getTimestamp(rs, "Created_At"));
                    rotations.add(r);
                }
            }
        } catch (SQLException ex) {
            throw translate("Failed to find rotations of crew " + crewId, ex);
        }
        return rotations;
    }

    // -----------------------------------------------------------------------
    // SHIFT INSTANCES
    // -----------------------------------------------------------------------

    public void saveShiftInstance(ShiftInstance instance) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT_SHIFT_INSTANCE,
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, instance.getCrewId());
            ps.setLong(2, instance.getShiftId());
            setTimestamp(ps, 3, instance.getShiftStart());
            setTimestamp(ps, 4, instance.getShiftEnd());
            ps.executeUpdate();
            instance.setId(generatedKey(ps));
        } catch (SQLException ex) {
            throw translate("Failed to save shift instance for crew " + instance.getCrewId(), ex);
        }
    }

    public List<ShiftInstance> findShiftInstancesByCrew(long crewId) {
        List<ShiftInstance> instances = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_SHIFT_INSTANCES)) {
            ps.setLong(1, crewId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ShiftInstance si = new ShiftInstance(
                            rs.getLong("crew_id"),
                            rs.getLong("shift_id"),
                            getTimestamp(rs, "shift_start"),
                            getTimestamp(rs, "shift_end"));
                    si.setId(rs.getLong("shift_instance_id"));
                    si.setCreatedAt(getTimestamp(rs, "Created_At"));
                    instances.add(si);
                }
            }
        } catch (SQLException ex) {
            throw translate("Failed to find shift instances of crew " + crewId, ex);
        }
        return instances;
    }
}
