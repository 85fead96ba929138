package com.nana.opsight.repository;

import com.nana.opsight.util.DatabaseManager;
import com.nana.opsight.util.TimestampParser;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Shared plumbing for the SQLite repositories: connection lookup, exception
 * translation and the nullable bind/read helpers JDBC lacks.
 *
 * <p>Repositories obtain the {@link Connection} from their
 * {@link DatabaseManager} on every call instead of holding it, so they
 * always join whatever transaction the caller has open on that connection.
 */
public abstract class JdbcRepositorySupport {

    /**
     * Upper bound for bound parameters in one {@code IN (...)} list; older
     * SQLite builds cap a statement at 999 variables.
     */
    protected static final int MAX_IN_PARAMETERS = 500;

    private final DatabaseManager databaseManager;

    protected JdbcRepositorySupport(DatabaseManager databaseManager) {
        this.databaseManager = databaseManager;
    }

    protected Connection conn() {
        return databaseManager.getConnection();
    }

    /**
     * Wraps a JDBC failure, choosing {@link IntegrityViolationException} for
     * constraint failures.
     *
     * @param message what was being attempted
     * @param ex      the JDBC failure
     * @return the exception to throw
     */
    protected static RepositoryException translate(String message, SQLException ex) {
        if (IntegrityViolationException.isConstraintViolation(ex)) {
            return new IntegrityViolationException(message + ": " + ex.getMessage(), ex);
        }
        return new RepositoryException(message, ex);
    }

    // -----------------------------------------------------------------------
    // BINDING
    // -----------------------------------------------------------------------

    protected static void setString(PreparedStatement ps, int index, String value)
            throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    protected static void setLong(PreparedStatement ps, int index, Long value)
            throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    protected static void setInt(PreparedStatement ps, int index, Integer value)
            throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    protected static void setDouble(PreparedStatement ps, int index, Double value)
            throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.REAL);
        } else {
            ps.setDouble(index, value);
        }
    }

    protected static void setTimestamp(PreparedStatement ps, int index, LocalDateTime value)
            throws SQLException {
        setString(ps, index, TimestampParser.format(value));
    }

    // -----------------------------------------------------------------------
    // READING
    // -----------------------------------------------------------------------

    protected static Long getLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    protected static Integer getInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    protected static Double getDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    protected static LocalDateTime getTimestamp(ResultSet rs, String column) throws SQLException {
        return TimestampParser.parseStored(rs.getString(column));
    }

    /**
     * Reads the surrogate key assigned by the last insert on {@code ps}.
     *
     * @throws SQLException if the driver returned no key
     */
    protected static long generatedKey(PreparedStatement ps) throws SQLException {
        try (ResultSet keys = ps.getGeneratedKeys()) {
            if (keys.next()) {
                return keys.getLong(1);
            }
        }
        throw new SQLException("Insert returned no generated key.");
    }

    // -----------------------------------------------------------------------
    // IN-LIST HELPERS
    // -----------------------------------------------------------------------

    /** @return {@code "?, ?, ?"} with {@code count} placeholders */
    protected static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    protected static <T> List<List<T>> partition(Collection<T> values, int size) {
        List<List<T>> parts = new ArrayList<>();
        List<T> current = new ArrayList<>(Math.min(size, values.size()));
        for (T value : values) {
            current.add(value);
            if (current.size() == size) {
                parts.add(current);
                current = new ArrayList<>(size);
            }
        }
        if (!current.isEmpty()) {
            parts.add(current);
        }
        return parts;
    }

    /**
     * Sums the update counts of a batch. SQLite reports real counts, but
     * {@link Statement#SUCCESS_NO_INFO} is counted as one row.
     */
    protected static int sumUpdateCounts(int[] counts) {
        int total = 0;
        for (int c : counts) {
            if (c >= 0) {
                total += c;
            } else if (c == Statement.SUCCESS_NO_INFO) {
                total++;
            }
        }
        return total;
    }
}
