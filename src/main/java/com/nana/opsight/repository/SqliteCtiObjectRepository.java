package com.nana.opsight.repository;

import com.nana.opsight.domain.CtiObject;
import com.nana.opsight.util.DatabaseManager;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Threat-intelligence reference objects (techniques, indicators, rules).
 */
public class SqliteCtiObjectRepository extends JdbcRepositorySupport {

    private static final String SQL_INSERT = """
            INSERT INTO CTI_Objects (CTI_Type, CTI_Name, External_ID, Rule, Confidence)
            VALUES (?, ?, ?, ?, ?)
            """;

    private static final String SQL_SELECT = """
            SELECT CTI_ID, CTI_Type, CTI_Name, External_ID, Rule, Confidence, Created_At
            FROM CTI_Objects
            """;

    public SqliteCtiObjectRepository(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    private CtiObject mapRow(ResultSet rs) throws SQLException {
        CtiObject cti = new CtiObject(
                rs.getString("CTI_Type"),
                rs.getString("CTI_Name"),
                rs.getString("External_ID"),
                rs.getString("Rule"),
                getInt(rs, "Confidence"));
        cti.setId(rs.getLong("CTI_ID"));
        cti.setCreatedAt(getTimestamp(rs, "Created_At"));
        return cti;
    }

    public void save(CtiObject cti) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, cti.getType());
            ps.setString(2, cti.getName());
            setString(ps, 3, cti.getExternalId());
            setString(ps, 4, cti.getRule());
            setInt(ps, 5, cti.getConfidence());
            ps.executeUpdate();
            cti.setId(generatedKey(ps));
        } catch (SQLException ex) {
            throw translate("Failed to save CTI object " + cti.getName(), ex);
        }
    }

    public Optional<CtiObject> findById(long ctiId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_SELECT + " WHERE CTI_ID = ?")) {
            ps.setLong(1, ctiId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw translate("Failed to find CTI object " + ctiId, ex);
        }
    }

    public List<CtiObject> findByType(String type) {
        List<CtiObject> result = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(SQL_SELECT + " WHERE CTI_Type = ? ORDER BY CTI_ID")) {
            ps.setString(1, type);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw translate("Failed to find CTI objects of type " + type, ex);
        }
        return result;
    }
}
