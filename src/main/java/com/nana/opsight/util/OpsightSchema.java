package com.nana.opsight.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * OpsightSchema - DDL for every table and index of the operator behaviour store.
 *
 * <p>Statements are ordered parents first so that each foreign key refers to
 * a table that already exists. Every statement is idempotent
 * ({@code IF NOT EXISTS}) and {@link DatabaseManager} runs the whole list on
 * every start.
 *
 * <p>TYPE MAPPING:
 * <ul>
 *   <li>Timestamps are TEXT in {@code yyyy-MM-dd HH:mm:ss.SSS}; this sorts
 *       chronologically, so MIN/MAX and range scans work on the raw text.</li>
 *   <li>Booleans are INTEGER 0/1.</li>
 *   <li>VARCHAR(n) widths document the intended maximum; SQLite does not
 *       enforce them, which is why the loader truncates before inserting.</li>
 * </ul>
 *
 * <p>CASCADES: removing a Session removes its Events, Session_Features and
 * Alerts; removing an Event removes its Detections and Alerts; removing a
 * Detection removes its Alerts; removing an Alert removes its CTI links.
 * Nothing cascades upwards into Operators, shift definitions, baselines or
 * CTI objects.
 */
public final class OpsightSchema {

    /** Current-time default matching the stored timestamp format. */
    private static final String NOW = "(strftime('%Y-%m-%d %H:%M:%f', 'now'))";

    // -----------------------------------------------------------------------
    // TABLES
    // -----------------------------------------------------------------------

    static final String USERS = """
            CREATE TABLE IF NOT EXISTS Users (
                User_ID        INTEGER PRIMARY KEY AUTOINCREMENT,
                Username       VARCHAR(50)  NOT NULL,
                Password_Hash  VARCHAR(255) NOT NULL,
                Role           VARCHAR(30)  NOT NULL,
                Email          VARCHAR(100) NOT NULL,
                Is_Active      INTEGER      NOT NULL DEFAULT 1,
                Created_At     TEXT         NOT NULL DEFAULT %s,
                Last_Login     TEXT,
                CONSTRAINT uq_users_username UNIQUE (Username),
                CONSTRAINT uq_users_email    UNIQUE (Email)
            )
            """.formatted(NOW);

    static final String CREWS = """
            CREATE TABLE IF NOT EXISTS crews (
                Crew_ID     INTEGER PRIMARY KEY AUTOINCREMENT,
                crew_name   VARCHAR(10) NOT NULL,
                Created_At  TEXT        NOT NULL DEFAULT %s
            )
            """.formatted(NOW);

    static final String SHIFT_DEFINITIONS = """
            CREATE TABLE IF NOT EXISTS shift_definitions (
                shift_id        INTEGER PRIMARY KEY AUTOINCREMENT,
                shift_name      VARCHAR(20),
                start_time      TEXT,
                end_time        TEXT,
                duration_hours  REAL,
                Created_At      TEXT NOT NULL DEFAULT %s
            )
            """.formatted(NOW);

    static final String OPERATORS = """
            CREATE TABLE IF NOT EXISTS Operators (
                Operator_ID       VARCHAR(10) PRIMARY KEY NOT NULL,
                Crew_ID           INTEGER REFERENCES crews (Crew_ID),
                Default_Shift_ID  INTEGER REFERENCES shift_definitions (shift_id),
                Operator_Rank     INTEGER NOT NULL DEFAULT 1,
                Created_At        TEXT    NOT NULL DEFAULT %s
            )
            """.formatted(NOW);

    static final String CREW_ROTATION = """
            CREATE TABLE IF NOT EXISTS Crew_Rotation (
                Rotation_ID  INTEGER PRIMARY KEY AUTOINCREMENT,
                Crew_ID      INTEGER NOT NULL REFERENCES crews (Crew_ID),
                Anchor_Date  TEXT    NOT NULL,
                On_Days      INTEGER NOT NULL,
                Off_Days     INTEGER NOT NULL,
                Created_At   TEXT    NOT NULL DEFAULT %s
            )
            """.formatted(NOW);

    static final String SHIFT_INSTANCES = """
            CREATE TABLE IF NOT EXISTS shift_instances (
                shift_instance_id  INTEGER PRIMARY KEY AUTOINCREMENT,
                crew_id            INTEGER NOT NULL REFERENCES crews (Crew_ID),
                shift_id           INTEGER NOT NULL REFERENCES shift_definitions (shift_id),
                shift_start        TEXT,
                shift_end          TEXT,
                Created_At         TEXT NOT NULL DEFAULT %s
            )
            """.formatted(NOW);

    static final String SESSIONS = """
            CREATE TABLE IF NOT EXISTS Sessions (
                Session_ID                INTEGER PRIMARY KEY AUTOINCREMENT,
                shift_instance_id         INTEGER REFERENCES shift_instances (shift_instance_id),
                Operator_ID               VARCHAR(10) NOT NULL REFERENCES Operators (Operator_ID),
                Shift_ID                  INTEGER     NOT NULL REFERENCES shift_definitions (shift_id),
                Session_Start             TEXT        NOT NULL,
                Session_End               TEXT,
                Inactivity_Threshold_Min  INTEGER     NOT NULL,
                Created_At                TEXT        NOT NULL DEFAULT %s
            )
            """.formatted(NOW);

    static final String EVENTS = """
            CREATE TABLE IF NOT EXISTS Events (
                Event_ID             INTEGER PRIMARY KEY AUTOINCREMENT,
                Session_ID           INTEGER      NOT NULL
                                     REFERENCES Sessions (Session_ID) ON DELETE CASCADE,
                Operator_ID          VARCHAR(10)  NOT NULL REFERENCES Operators (Operator_ID),
                Timestamp            TEXT         NOT NULL,
                TimeInterval         REAL         NOT NULL,
                Address              VARCHAR(50)  NOT NULL,
                FunctionCode         VARCHAR(10)  NOT NULL,
                CommandResponse      VARCHAR(50)  NOT NULL,
                ControlMode          VARCHAR(50)  NOT NULL,
                ControlScheme        VARCHAR(100) NOT NULL,
                CRC                  INTEGER      NOT NULL,
                DataLength           INTEGER      NOT NULL,
                InvalidFunctionCode  VARCHAR(5)   NOT NULL,
                InvalidDataLength    VARCHAR(5)   NOT NULL,
                PumpState            VARCHAR(50)  NOT NULL,
                SolenoidState        VARCHAR(50)  NOT NULL,
                SetPoint             REAL         NOT NULL,
                PipelinePSI          REAL         NOT NULL,
                PIDCycleTime         REAL         NOT NULL,
                PIDDeadband          REAL         NOT NULL,
                PIDGain              REAL         NOT NULL,
                PIDRate              REAL         NOT NULL,
                PIDReset             REAL         NOT NULL,
                deltaSetPoint        REAL         NOT NULL,
                deltaPipelinePSI     REAL         NOT NULL,
                deltaPIDCycleTime    REAL         NOT NULL,
                deltaPIDDeadband     REAL         NOT NULL,
                deltaPIDGain         REAL         NOT NULL,
                deltaPIDRate         REAL         NOT NULL,
                deltaPIDReset        REAL         NOT NULL,
                Label                VARCHAR(50)  NOT NULL,
                Source_Row           INTEGER
            )
            """;

    static final String SESSION_FEATURES = """
            CREATE TABLE IF NOT EXISTS Session_Features (
                Session_features_ID          INTEGER PRIMARY KEY AUTOINCREMENT,
                Session_ID                   INTEGER NOT NULL
                                             REFERENCES Sessions (Session_ID) ON DELETE CASCADE,
                Created_At                   TEXT NOT NULL DEFAULT %s,
                Command_Frequency            REAL NOT NULL,
                Inter_Command_Mean           REAL NOT NULL,
                Inter_Command_Std            REAL NOT NULL,
                Command_Burst_Rate           REAL NOT NULL,
                Control_Mode_Change_Rate     REAL NOT NULL,
                High_Risk_Command_Ratio      REAL NOT NULL,
                Invalid_Command_Rate         REAL NOT NULL,
                Pump_State_Change_Rate       REAL NOT NULL,
                SetPoint_Shock_Event_Rate    REAL NOT NULL,
                PID_Modification_Rate        REAL NOT NULL,
                Command_Entropy              REAL NOT NULL,
                Process_Command_Correlation  REAL NOT NULL,
                CONSTRAINT uq_session_features_session UNIQUE (Session_ID)
            )
            """.formatted(NOW);

    static final String BASELINE_PROFILES = """
            CREATE TABLE IF NOT EXISTS Baseline_Profiles (
                Baseline_ID       INTEGER PRIMARY KEY AUTOINCREMENT,
                Operator_ID       VARCHAR(10) NOT NULL REFERENCES Operators (Operator_ID),
                Shift_ID          INTEGER REFERENCES shift_definitions (shift_id),
                Baseline_Version  VARCHAR(20) NOT NULL,
                Trained_From      TEXT        NOT NULL,
                Trained_To        TEXT        NOT NULL,
                Profile_JSON      TEXT        NOT NULL,
                Created_At        TEXT        NOT NULL DEFAULT %s,
                CONSTRAINT uq_baseline_operator_shift_version
                    UNIQUE (Operator_ID, Shift_ID, Baseline_Version)
            )
            """.formatted(NOW);

    static final String DETECTION = """
            CREATE TABLE IF NOT EXISTS Detection (
                Detection_ID     INTEGER PRIMARY KEY AUTOINCREMENT,
                Event_ID         INTEGER NOT NULL
                                 REFERENCES Events (Event_ID) ON DELETE CASCADE,
                Baseline_ID      INTEGER NOT NULL REFERENCES Baseline_Profiles (Baseline_ID),
                Model_Type       VARCHAR(30) NOT NULL,
                Anomaly_Score    REAL        NOT NULL,
                Threshold        REAL        NOT NULL,
                Evidence_JSON    TEXT        NOT NULL,
                Predicted_Label  VARCHAR(15) NOT NULL,
                Detection_Time   TEXT        NOT NULL DEFAULT %s,
                CONSTRAINT uq_detection_event_baseline_model
                    UNIQUE (Event_ID, Baseline_ID, Model_Type)
            )
            """.formatted(NOW);

    static final String ALERTS = """
            CREATE TABLE IF NOT EXISTS Alerts (
                Alert_ID           INTEGER PRIMARY KEY AUTOINCREMENT,
                Event_ID           INTEGER NOT NULL
                                   REFERENCES Events (Event_ID) ON DELETE CASCADE,
                Session_ID         INTEGER NOT NULL
                                   REFERENCES Sessions (Session_ID) ON DELETE CASCADE,
                Detection_ID       INTEGER NOT NULL
                                   REFERENCES Detection (Detection_ID) ON DELETE CASCADE,
                Alert_Time         TEXT         NOT NULL DEFAULT %s,
                Severity           INTEGER      NOT NULL,
                Alert_Category     VARCHAR(30)  NOT NULL,
                Alert_Description  VARCHAR(500) NOT NULL
            )
            """.formatted(NOW);

    static final String CTI_OBJECTS = """
            CREATE TABLE IF NOT EXISTS CTI_Objects (
                CTI_ID       INTEGER PRIMARY KEY AUTOINCREMENT,
                CTI_Type     VARCHAR(30)  NOT NULL,
                CTI_Name     VARCHAR(150) NOT NULL,
                External_ID  VARCHAR(50),
                Rule         VARCHAR(500),
                Confidence   INTEGER,
                Created_At   TEXT NOT NULL DEFAULT %s
            )
            """.formatted(NOW);

    static final String ALERT_CTI_LINKS = """
            CREATE TABLE IF NOT EXISTS Alert_CTI_Links (
                Alert_ID         INTEGER NOT NULL
                                 REFERENCES Alerts (Alert_ID) ON DELETE CASCADE,
                CTI_ID           INTEGER NOT NULL REFERENCES CTI_Objects (CTI_ID),
                Match_Reason     VARCHAR(250),
                Link_Created_At  TEXT NOT NULL DEFAULT %s,
                PRIMARY KEY (Alert_ID, CTI_ID)
            )
            """.formatted(NOW);

    static final String SCHEMA_VERSION = """
            CREATE TABLE IF NOT EXISTS schema_version (
                version  INTEGER NOT NULL
            )
            """;

    // -----------------------------------------------------------------------
    // INDEXES
    // -----------------------------------------------------------------------

    private static final List<String> INDEXES = List.of(
            "CREATE INDEX IF NOT EXISTS ix_sessions_operator_start ON Sessions (Operator_ID, Session_Start)",
            "CREATE INDEX IF NOT EXISTS ix_sessions_shift_start ON Sessions (Shift_ID, Session_Start)",
            "CREATE INDEX IF NOT EXISTS ix_events_session_time ON Events (Session_ID, Timestamp)",
            "CREATE INDEX IF NOT EXISTS ix_events_operator_time ON Events (Operator_ID, Timestamp)",
            "CREATE INDEX IF NOT EXISTS ix_events_address_fc ON Events (Address, FunctionCode)",
            // Loaded events are keyed by their position in the source file, so
            // loading the same file twice is rejected instead of duplicated.
            "CREATE UNIQUE INDEX IF NOT EXISTS uq_events_source_row "
                    + "ON Events (Session_ID, Operator_ID, Timestamp, Source_Row)",
            "CREATE INDEX IF NOT EXISTS ix_baseline_operator_shift ON Baseline_Profiles (Operator_ID, Shift_ID)",
            "CREATE INDEX IF NOT EXISTS ix_detection_event_id ON Detection (Event_ID)",
            "CREATE INDEX IF NOT EXISTS ix_detection_baseline_time ON Detection (Baseline_ID, Detection_Time)",
            "CREATE INDEX IF NOT EXISTS ix_alerts_time_severity ON Alerts (Alert_Time, Severity)",
            "CREATE INDEX IF NOT EXISTS ix_alerts_detection_id ON Alerts (Detection_ID)"
    );

    private static final List<String> TABLES = List.of(
            USERS,
            CREWS,
            SHIFT_DEFINITIONS,
            OPERATORS,
            CREW_ROTATION,
            SHIFT_INSTANCES,
            SESSIONS,
            EVENTS,
            SESSION_FEATURES,
            BASELINE_PROFILES,
            DETECTION,
            ALERTS,
            CTI_OBJECTS,
            ALERT_CTI_LINKS,
            SCHEMA_VERSION
    );

    /** Names of the entity tables, in creation order. */
    public static final List<String> TABLE_NAMES = List.of(
            "Users", "crews", "shift_definitions", "Operators", "Crew_Rotation",
            "shift_instances", "Sessions", "Events", "Session_Features",
            "Baseline_Profiles", "Detection", "Alerts", "CTI_Objects", "Alert_CTI_Links"
    );

    private OpsightSchema() {
        throw new UnsupportedOperationException("OpsightSchema is a static holder class.");
    }

    /**
     * Every DDL statement in execution order: tables first, then indexes.
     *
     * @return an unmodifiable list of statements
     */
    public static List<String> statements() {
        List<String> all = new ArrayList<>(TABLES.size() + INDEXES.size());
        all.addAll(TABLES);
        all.addAll(INDEXES);
        return Collections.unmodifiableList(all);
    }
}
