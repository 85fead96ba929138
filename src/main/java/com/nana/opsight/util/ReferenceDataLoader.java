package com.nana.opsight.util;

import com.nana.opsight.domain.ShiftDefinition;
import com.nana.opsight.domain.ShiftType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * ReferenceDataLoader - seeds the rows the loader relies on.
 *
 * <p>The shift labels in event exports resolve to fixed shift ids
 * ({@link ShiftType}), so those {@code shift_definitions} rows must exist
 * before the first session is written. Rows that already exist are left
 * as they are, including any edits made to them since.
 */
public final class ReferenceDataLoader {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDataLoader.class);

    private static final String SQL_SEED_SHIFT = """
            INSERT OR IGNORE INTO shift_definitions
                (shift_id, shift_name, start_time, end_time, duration_hours)
            VALUES (?, ?, ?, ?, ?)
            """;

    private ReferenceDataLoader() {
        throw new UnsupportedOperationException("ReferenceDataLoader is a static utility class.");
    }

    /**
     * Inserts one {@code shift_definitions} row per {@link ShiftType} whose id
     * is not present yet.
     *
     * @param connection an open connection with the schema already created
     * @return the number of rows inserted
     * @throws SQLException if an insert fails
     */
    public static int seedShiftDefinitions(Connection connection) throws SQLException {
        int inserted = 0;
        try (PreparedStatement ps = connection.prepareStatement(SQL_SEED_SHIFT)) {
            for (ShiftType type : ShiftType.values()) {
                ShiftDefinition def = ShiftDefinition.of(type);
                ps.setLong(1, def.getId());
                ps.setString(2, def.getName());
                ps.setString(3, TimestampParser.formatTime(def.getStartTime()));
                ps.setString(4, TimestampParser.formatTime(def.getEndTime()));
                ps.setDouble(5, def.getDurationHours());
                inserted += ps.executeUpdate();
            }
        }
        if (inserted > 0) {
            log.info("Seeded {} shift definition(s).", inserted);
            AppLogger.logEvent("REFERENCE_DATA_SEEDED", "shiftDefinitions=" + inserted);
        } else {
            log.debug("Shift definitions already present; nothing seeded.");
        }
        return inserted;
    }
}
