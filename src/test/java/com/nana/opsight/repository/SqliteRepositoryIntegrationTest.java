package com.nana.opsight.repository;

import com.nana.opsight.domain.Alert;
import com.nana.opsight.domain.AlertCtiLink;
import com.nana.opsight.domain.BaselineProfile;
import com.nana.opsight.domain.Crew;
import com.nana.opsight.domain.CrewRotation;
import com.nana.opsight.domain.CtiObject;
import com.nana.opsight.domain.Detection;
import com.nana.opsight.domain.Event;
import com.nana.opsight.domain.Operator;
import com.nana.opsight.domain.Session;
import com.nana.opsight.domain.SessionFeatures;
import com.nana.opsight.domain.ShiftDefinition;
import com.nana.opsight.domain.ShiftInstance;
import com.nana.opsight.domain.User;
import com.nana.opsight.domain.UserRole;
import com.nana.opsight.util.DatabaseManager;
import com.nana.opsight.util.EventColumn;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SQLite repositories")
class SqliteRepositoryIntegrationTest {

    @TempDir
    Path tempDir;

    private DatabaseManager db;

    private SqliteOperatorRepository operators;
    private SqliteSessionRepository sessions;
    private SqliteEventRepository events;
    private SqliteSessionFeaturesRepository features;
    private SqliteBaselineProfileRepository baselines;
    private SqliteDetectionRepository detections;
    private SqliteAlertRepository alerts;
    private SqliteCtiObjectRepository ctiObjects;

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 1, 7, 0);

    @BeforeEach
    void setUp() {
        db = new DatabaseManager("jdbc:sqlite:" + tempDir.resolve("repo.db"));
        db.initializeSchema();
        operators  = new SqliteOperatorRepository(db);
        sessions   = new SqliteSessionRepository(db);
        events     = new SqliteEventRepository(db);
        features   = new SqliteSessionFeaturesRepository(db);
        baselines  = new SqliteBaselineProfileRepository(db);
        detections = new SqliteDetectionRepository(db);
        alerts     = new SqliteAlertRepository(db);
        ctiObjects = new SqliteCtiObjectRepository(db);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    // -------------------------------------------------------------------------
    // Fixtures
    // -------------------------------------------------------------------------

    private static Event event(long sessionId, String operatorId, LocalDateTime ts, int sourceRow) {
        Event e = new Event();
        e.setSessionId(sessionId);
        e.setOperatorId(operatorId);
        e.setTimestamp(ts);
        e.setSourceRow(sourceRow);
        for (EventColumn column : EventColumn.values()) {
            switch (column.getType()) {
                case TEXT    -> column.apply(e, "x");
                case INTEGER -> column.apply(e, "3");
                case REAL    -> column.apply(e, "0.5");
            }
        }
        return e;
    }

    private Session storedSession(long id, String operatorId) {
        operators.saveAll(List.of(new Operator(operatorId)));
        Session s = new Session(id, operatorId, 1, T0, T0.plusHours(1), 10);
        sessions.save(s);
        return s;
    }

    private long storedEvent(long sessionId, String operatorId, int row) {
        Event e = event(sessionId, operatorId, T0.plusMinutes(row), row);
        events.save(e);
        return e.getId();
    }

    private BaselineProfile storedBaseline(String operatorId, String version, LocalDateTime trainedTo) {
        BaselineProfile b = new BaselineProfile(operatorId, 1L, version, T0.minusDays(30), trainedTo, "{\"mean\":1}");
        baselines.save(b);
        return b;
    }

    // =========================================================================
    // Operators
    // =========================================================================

    @Nested
    @DisplayName("Operators")
    class OperatorTests {

        @Test
        void saveAll_thenFindExistingIds_returnsOnlyStored() {
            assertEquals(2, operators.saveAll(List.of(new Operator("OP1"), new Operator("OP2"))));

            Set<String> existing = operators.findExistingIds(List.of("OP1", "OP3"));
            assertEquals(Set.of("OP1"), existing);
        }

        @Test
        void savedOperator_defaultsToRankTrue() {
            operators.save(new Operator("OP9"));

            Operator found = operators.findById("OP9").orElseThrow();
            assertTrue(found.isRank());
            assertNotNull(found.getCreatedAt());
        }

        @Test
        void duplicateId_isIntegrityViolation() {
            operators.save(new Operator("OP1"));
            assertThrows(IntegrityViolationException.class, () -> operators.save(new Operator("OP1")));
        }

        @Test
        void findExistingIds_empty_returnsEmpty() {
            assertTrue(operators.findExistingIds(List.of()).isEmpty());
        }
    }

    // =========================================================================
    // Sessions and events
    // =========================================================================

    @Nested
    @DisplayName("Sessions and events")
    class SessionEventTests {

        @Test
        void sessionWithoutId_getsGeneratedId() {
            operators.save(new Operator("OP1"));
            Session s = new Session(null, "OP1", 2, T0, null, 10);
            sessions.save(s);

            assertNotNull(s.getId());
            assertTrue(sessions.findById(s.getId()).orElseThrow().isOngoing());
            assertEquals(1, sessions.findByOperator("OP1").size());
        }

        @Test
        void sessionWithUnknownShift_isIntegrityViolation() {
            operators.save(new Operator("OP1"));
            Session s = new Session(1L, "OP1", 99, T0, null, 10);
            assertThrows(IntegrityViolationException.class, () -> sessions.save(s));
        }

        @Test
        void eventWithUnknownOperator_isIntegrityViolation() {
            storedSession(1, "OP1");
            Event e = event(1, "GHOST", T0, 1);
            assertThrows(IntegrityViolationException.class, () -> events.save(e));
        }

        @Test
        void eventWithMissingLabel_isIntegrityViolation() {
            storedSession(1, "OP1");
            Event e = event(1, "OP1", T0, 1);
            e.setLabel(null);
            assertThrows(IntegrityViolationException.class, () -> events.insertBatch(List.of(e)));
        }

        @Test
        void event_roundTripsPayload() {
            storedSession(1, "OP1");
            long id = storedEvent(1, "OP1", 4);

            Event found = events.findById(id).orElseThrow();
            assertEquals(T0.plusMinutes(4), found.getTimestamp());
            assertEquals(3, found.getDataLength());
            assertEquals(0.5, found.getDeltaPidReset());
            assertEquals("x", found.getSolenoidState());
            assertEquals(4, found.getSourceRow());
        }

        @Test
        void deleteSession_cascadesToDependentsButKeepsOperatorAndShift() {
            storedSession(1, "OP1");
            long eventId = storedEvent(1, "OP1", 1);
            features.save(new SessionFeatures(1L));
            BaselineProfile baseline = storedBaseline("OP1", "v1", T0);
            Detection detection = new Detection(eventId, baseline.getId(), "IsolationForest", 0.9, 0.7, "{}", "anomaly");
            detections.save(detection);
            Alert alert = new Alert(eventId, 1L, detection.getId(), 3, "behaviour", "Unusual setpoint shock");
            alerts.save(alert);
            CtiObject technique = new CtiObject("technique", "Modify Parameter", "T0836", null, 80);
            ctiObjects.save(technique);
            alerts.link(alert.getId(), technique.getId(), "setpoint change");

            assertTrue(sessions.delete(1L));

            assertEquals(0L, events.countAll());
            assertTrue(features.findBySession(1L).isEmpty());
            assertTrue(detections.findById(detection.getId()).isEmpty());
            assertTrue(alerts.findById(alert.getId()).isEmpty());
            assertTrue(alerts.findLinks(alert.getId()).isEmpty());
            assertTrue(operators.findById("OP1").isPresent());
            assertTrue(ctiObjects.findById(technique.getId()).isPresent());
            assertTrue(baselines.findById(baseline.getId()).isPresent());
            assertEquals(2, new SqliteShiftDefinitionRepository(db).findAll().size());
        }

        @Test
        void deleteUnknownSession_returnsFalse() {
            assertFalse(sessions.delete(404L));
        }
    }

    // =========================================================================
    // Analytics tables
    // =========================================================================

    @Nested
    @DisplayName("Features, baselines, detections")
    class AnalyticsTests {

        @Test
        void features_onePerSession() {
            storedSession(1, "OP1");
            SessionFeatures f = new SessionFeatures(1L);
            f.setCommandFrequency(4.5);
            f.setCommandEntropy(1.25);
            features.save(f);

            SessionFeatures found = features.findBySession(1L).orElseThrow();
            assertEquals(4.5, found.getCommandFrequency());
            assertEquals(1.25, found.getCommandEntropy());
            assertThrows(IntegrityViolationException.class, () -> features.save(new SessionFeatures(1L)));
        }

        @Test
        void baseline_findLatest_prefersMostRecentTraining() {
            operators.save(new Operator("OP1"));
            storedBaseline("OP1", "v1", T0.minusDays(10));
            BaselineProfile newer = storedBaseline("OP1", "v2", T0);

            assertEquals("v2", baselines.findLatest("OP1", 1L).orElseThrow().getVersion());
            assertEquals(newer.getId(), baselines.findLatest("OP1", 1L).orElseThrow().getId());
            assertTrue(baselines.findLatest("OP1", 2L).isEmpty());
            assertEquals(2, baselines.findByOperator("OP1").size());
        }

        @Test
        void baseline_sameOperatorShiftVersion_isRejected() {
            operators.save(new Operator("OP1"));
            storedBaseline("OP1", "v1", T0);
            assertThrows(IntegrityViolationException.class, () -> storedBaseline("OP1", "v1", T0));
        }

        @Test
        void detection_sameEventBaselineModel_isRejected() {
            storedSession(1, "OP1");
            long eventId = storedEvent(1, "OP1", 1);
            long baselineId = storedBaseline("OP1", "v1", T0).getId();
            detections.save(new Detection(eventId, baselineId, "LOF", 0.2, 0.5, "{}", "normal"));

            assertThrows(IntegrityViolationException.class, () -> detections.save(
                    new Detection(eventId, baselineId, "LOF", 0.3, 0.5, "{}", "normal")));

            Detection stored = detections.findByEvent(eventId).get(0);
            assertNotNull(stored.getDetectionTime());
            assertFalse(stored.isAnomalous());
        }

        @Test
        void detection_unknownBaseline_isRejected() {
            storedSession(1, "OP1");
            long eventId = storedEvent(1, "OP1", 1);
            assertThrows(IntegrityViolationException.class, () -> detections.save(
                    new Detection(eventId, 999L, "LOF", 0.2, 0.5, "{}", "normal")));
        }
    }

    // =========================================================================
    // Alerts and CTI
    // =========================================================================

    @Nested
    @DisplayName("Alerts and CTI")
    class AlertTests {

        private Alert storedAlert() {
            storedSession(1, "OP1");
            long eventId = storedEvent(1, "OP1", 1);
            long baselineId = storedBaseline("OP1", "v1", T0).getId();
            Detection d = new Detection(eventId, baselineId, "LOF", 0.9, 0.5, "{}", "anomaly");
            detections.save(d);
            Alert alert = new Alert(eventId, 1L, d.getId(), 4, "process", "PSI spike");
            alerts.save(alert);
            return alert;
        }

        @Test
        void save_stampsAlertTime() {
            Alert alert = storedAlert();
            assertNotNull(alert.getAlertTime());
            assertEquals(1, alerts.findBySession(1L).size());
        }

        @Test
        void link_samePairTwice_isRejected() {
            Alert alert = storedAlert();
            CtiObject cti = new CtiObject("tactic", "Impair Process Control", "TA0106", null, null);
            ctiObjects.save(cti);

            alerts.link(alert.getId(), cti.getId(), "first");
            assertThrows(IntegrityViolationException.class,
                    () -> alerts.link(alert.getId(), cti.getId(), "again"));

            List<AlertCtiLink> links = alerts.findLinks(alert.getId());
            assertEquals(1, links.size());
            assertEquals("first", links.get(0).getMatchReason());
        }

        @Test
        void deleteAlert_removesLinksButKeepsCti() {
            Alert alert = storedAlert();
            CtiObject cti = new CtiObject("tactic", "Inhibit Response", "TA0107", "rule-1", 60);
            ctiObjects.save(cti);
            alerts.link(alert.getId(), cti.getId(), null);

            assertTrue(alerts.delete(alert.getId()));

            assertTrue(alerts.findLinks(alert.getId()).isEmpty());
            CtiObject kept = ctiObjects.findById(cti.getId()).orElseThrow();
            assertEquals(60, kept.getConfidence());
            assertEquals(1, ctiObjects.findByType("tactic").size());
        }
    }

    // =========================================================================
    // Users, crews, shifts
    // =========================================================================

    @Nested
    @DisplayName("Users, crews, shifts")
    class ReferenceTests {

        @Test
        void user_saveFindAndRecordLogin() {
            SqliteUserRepository users = new SqliteUserRepository(db);
            User alice = new User("alice", "$2a$10$hash", UserRole.ANALYST, "alice@example.org");
            users.save(alice);

            LocalDateTime login = LocalDateTime.of(2024, 3, 2, 8, 30);
            users.recordLogin(alice.getId(), login);

            User found = users.findByUsername("alice").orElseThrow();
            assertEquals(UserRole.ANALYST, found.getRole());
            assertEquals(login, found.getLastLogin());
            assertTrue(found.isActive());
            assertEquals(found, users.findById(alice.getId()).orElseThrow());
        }

        @Test
        void user_duplicateUsername_isRejected() {
            SqliteUserRepository users = new SqliteUserRepository(db);
            users.save(new User("bob", "h", UserRole.VIEWER, "bob@example.org"));
            assertThrows(IntegrityViolationException.class,
                    () -> users.save(new User("bob", "h", UserRole.VIEWER, "bob2@example.org")));
        }

        @Test
        void recordLogin_unknownUser_throws() {
            SqliteUserRepository users = new SqliteUserRepository(db);
            assertThrows(RepositoryException.class, () -> users.recordLogin(404L, T0));
        }

        @Test
        void crew_rotationAndShiftInstances() {
            SqliteCrewRepository crews = new SqliteCrewRepository(db);
            Crew crew = new Crew("A");
            crews.saveCrew(crew);
            crews.saveRotation(new CrewRotation(crew.getId(), LocalDate.of(2024, 3, 1), 4, 4));
            crews.saveShiftInstance(new ShiftInstance(crew.getId(), 2L, T0.withHour(19), T0.plusDays(1)));

            assertEquals("A", crews.findCrewById(crew.getId()).orElseThrow().getName());
            CrewRotation rotation = crews.findRotationsByCrew(crew.getId()).get(0);
            assertEquals(LocalDate.of(2024, 3, 1), rotation.getAnchorDate());
            assertTrue(rotation.isOnDuty(LocalDate.of(2024, 3, 9)));
            assertEquals(2L, crews.findShiftInstancesByCrew(crew.getId()).get(0).getShiftId());

            operators.save(new Operator("OP5", crew.getId(), 2L, false));
            Operator member = operators.findByCrew(crew.getId()).get(0);
            assertFalse(member.isRank());
            assertEquals(2L, member.getDefaultShiftId());
        }

        @Test
        void rotationForUnknownCrew_isRejected() {
            SqliteCrewRepository crews = new SqliteCrewRepository(db);
            assertThrows(IntegrityViolationException.class,
                    () -> crews.saveRotation(new CrewRotation(77L, LocalDate.of(2024, 3, 1), 4, 4)));
        }

        @Test
        void shiftDefinitions_seededAndExtendable() {
            SqliteShiftDefinitionRepository shifts = new SqliteShiftDefinitionRepository(db);
            ShiftDefinition day = shifts.findById(1L).orElseThrow();
            assertEquals("DAY", day.getName());
            assertEquals(LocalTime.of(7, 0), day.getStartTime());

            ShiftDefinition swing = new ShiftDefinition(0L, "SWING", LocalTime.of(15, 0), LocalTime.of(23, 0), 8.0);
            shifts.save(swing);
            assertEquals(3, shifts.findAll().size());
            assertEquals(3L, swing.getId());
        }
    }
}
