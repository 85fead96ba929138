package com.nana.opsight.repository;

import com.nana.opsight.domain.User;
import com.nana.opsight.domain.UserRole;
import com.nana.opsight.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Stores monitoring-tool accounts. Username and email are unique; a clash
 * surfaces as {@link IntegrityViolationException}.
 */
public class SqliteUserRepository extends JdbcRepositorySupport {

    private static final Logger log = LoggerFactory.getLogger(SqliteUserRepository.class);

    private static final String SQL_INSERT = """
            INSERT INTO Users (Username, Password_Hash, Role, Email, Is_Active)
            VALUES (?, ?, ?, ?, ?)
            """;

    private static final String SQL_SELECT = """
            SELECT User_ID, Username, Password_Hash, Role, Email, Is_Active,
                   Created_At, Last_Login
            FROM Users
            """;

    private static final String SQL_RECORD_LOGIN =
            "UPDATE Users SET Last_Login = ? WHERE User_ID = ?";

    public SqliteUserRepository(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    private User mapRow(ResultSet rs) throws SQLException {
        User user = new User(
                rs.getString("Username"),
                rs.getString("Password_Hash"),
                UserRole.fromString(rs.getString("Role")),
                rs.getString("Email"));
        user.setId(rs.getLong("User_ID"));
        user.setActive(rs.getInt("Is_Active") != 0);
        user.setCreatedAt(getTimestamp(rs, "Created_At"));
        user.setLastLogin(getTimestamp(rs, "Last_Login"));
        return user;
    }

    public void save(User user) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, user.getUsername());
            ps.setString(2, user.getPasswordHash());
            ps.setString(3, user.getRole().name());
            ps.setString(4, user.getEmail());
            ps.setInt(5, user.isActive() ? 1 : 0);
            ps.executeUpdate();
            user.setId(generatedKey(ps));
            log.info("User '{}' created with id={}.", user.getUsername(), user.getId());
        } catch (SQLException ex) {
            throw translate("Failed to save user " + user.getUsername(), ex);
        }
    }

    public Optional<User> findById(long userId) {
        return findOne(SQL_SELECT + " WHERE User_ID = ?", userId);
    }

    /** Usernames are matched exactly. */
    public Optional<User> findByUsername(String username) {
        return findOne(SQL_SELECT + " WHERE Username = ?", username);
    }

    /**
     * Sets the last-login time of a user.
     *
     * @throws RepositoryException if no user has that id
     */
    public void recordLogin(long userId, LocalDateTime at) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_RECORD_LOGIN)) {
            setTimestamp(ps, 1, at);
            ps.setLong(2, userId);
            if (ps.executeUpdate() == 0) {
                throw new RepositoryException("Update affected 0 rows; no user with id " + userId);
            }
        } catch (SQLException ex) {
            throw translate("Failed to record login of user " + userId, ex);
        }
    }

    private Optional<User> findOne(String sql, Object key) {
        try (PreparedStatement ps = conn().prepareStatement(sql)) {
            ps.setObject(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw translate("Failed to find user " + key, ex);
        }
    }
}
