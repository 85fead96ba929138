package com.nana.opsight.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DatabaseManager")
class DatabaseManagerTest {

    @TempDir
    Path tempDir;

    private DatabaseManager db;

    @BeforeEach
    void setUp() {
        db = new DatabaseManager("jdbc:sqlite:" + tempDir.resolve("nested/dir/opsight.db"));
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private Set<String> tableNames() throws SQLException {
        Set<String> names = new HashSet<>();
        try (Statement st = db.getConnection().createStatement();
             ResultSet rs = st.executeQuery("SELECT name FROM sqlite_master WHERE type = 'table'")) {
            while (rs.next()) {
                names.add(rs.getString(1));
            }
        }
        return names;
    }

    private long count(String sql) throws SQLException {
        try (PreparedStatement ps = db.getConnection().prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : -1;
        }
    }

    @Test
    void constructor_createsParentDirectory() {
        assertTrue(Files.isDirectory(tempDir.resolve("nested/dir")));
    }

    @Test
    void initializeSchema_createsEveryEntityTable() throws SQLException {
        db.initializeSchema();

        Set<String> tables = tableNames();
        for (String name : OpsightSchema.TABLE_NAMES) {
            assertTrue(tables.contains(name), "missing table " + name);
        }
        assertEquals(14, OpsightSchema.TABLE_NAMES.size());
    }

    @Test
    void initializeSchema_seedsDayAndNightShifts() throws SQLException {
        db.initializeSchema();

        assertEquals(2, count("SELECT COUNT(*) FROM shift_definitions"));
        assertEquals(1, count("SELECT shift_id FROM shift_definitions WHERE shift_name = 'DAY'"));
        assertEquals(2, count("SELECT shift_id FROM shift_definitions WHERE shift_name = 'NIGHT'"));
    }

    @Test
    void initializeSchema_twice_isIdempotent() throws SQLException {
        db.initializeSchema();
        db.initializeSchema();

        assertEquals(2, count("SELECT COUNT(*) FROM shift_definitions"));
        assertEquals(1, count("SELECT COUNT(*) FROM schema_version"));
        assertEquals(DatabaseManager.CURRENT_SCHEMA_VERSION, db.getSchemaVersion());
    }

    @Test
    void initializeSchema_otherStoredVersion_isRefused() throws SQLException {
        db.initializeSchema();
        try (Statement st = db.getConnection().createStatement()) {
            st.executeUpdate("UPDATE schema_version SET version = 2");
        }

        assertThrows(DatabaseManager.DatabaseInitException.class, db::initializeSchema);
    }

    @Test
    void initializeSchema_olderStoredVersion_isRefused() throws SQLException {
        db.initializeSchema();
        try (Statement st = db.getConnection().createStatement()) {
            st.executeUpdate("UPDATE schema_version SET version = 0");
        }

        assertThrows(DatabaseManager.DatabaseInitException.class, db::initializeSchema);
        assertEquals(0, db.getSchemaVersion());
    }

    @Test
    void connection_enforcesForeignKeys() throws SQLException {
        assertEquals(1, count("PRAGMA foreign_keys"));
    }

    @Test
    void getConnection_afterShutdown_reopens() throws SQLException {
        db.initializeSchema();
        db.shutdown();

        assertFalse(db.getConnection().isClosed());
        assertEquals(2, count("SELECT COUNT(*) FROM shift_definitions"));
    }

    @Test
    void unreachableLocation_throwsDatabaseInitException() throws Exception {
        Path blocker = tempDir.resolve("file-not-dir");
        Files.writeString(blocker, "x");
        assertThrows(DatabaseManager.DatabaseInitException.class,
                () -> new DatabaseManager("jdbc:sqlite:" + blocker.resolve("sub/opsight.db")));
    }
}
