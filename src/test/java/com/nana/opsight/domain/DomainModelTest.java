package com.nana.opsight.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Domain model")
class DomainModelTest {

    // =========================================================================
    // ShiftType
    // =========================================================================

    @Nested
    @DisplayName("ShiftType")
    class ShiftTypeTests {

        @ParameterizedTest
        @ValueSource(strings = {"DAY", "day", " Day ", "dAy"})
        void fromLabel_dayVariants_returnsDay(String label) {
            assertEquals(ShiftType.DAY, ShiftType.fromLabel(label).orElseThrow());
        }

        @Test
        void fromLabel_night_returnsNightWithIdTwo() {
            ShiftType night = ShiftType.fromLabel("NIGHT").orElseThrow();
            assertEquals(ShiftType.NIGHT, night);
            assertEquals(2, night.getShiftId());
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"  ", "SWING", "D", "DAYS"})
        void fromLabel_unrecognised_returnsEmpty(String label) {
            assertTrue(ShiftType.fromLabel(label).isEmpty());
        }

        @Test
        void shiftIds_matchSeededRows() {
            assertEquals(1, ShiftType.DAY.getShiftId());
            assertEquals(2, ShiftType.NIGHT.getShiftId());
        }
    }

    // =========================================================================
    // UserRole
    // =========================================================================

    @Nested
    @DisplayName("UserRole")
    class UserRoleTests {

        @Test
        void fromString_analyst_returnsAnalyst() {
            assertEquals(UserRole.ANALYST, UserRole.fromString("analyst"));
        }

        @Test
        void fromString_unknown_fallsBackToViewer() {
            assertEquals(UserRole.VIEWER, UserRole.fromString("superuser"));
        }

        @Test
        void fromString_null_fallsBackToViewer() {
            assertEquals(UserRole.VIEWER, UserRole.fromString(null));
        }
    }

    // =========================================================================
    // CrewRotation
    // =========================================================================

    @Nested
    @DisplayName("CrewRotation.isOnDuty()")
    class CrewRotationTests {

        private final LocalDate anchor = LocalDate.of(2024, 3, 1);
        private final CrewRotation fourOnFourOff = new CrewRotation(1L, anchor, 4, 4);

        @Test
        void anchorDay_isOnDuty() {
            assertTrue(fourOnFourOff.isOnDuty(anchor));
        }

        @Test
        void lastOnDay_isOnDuty_firstOffDay_isNot() {
            assertTrue(fourOnFourOff.isOnDuty(anchor.plusDays(3)));
            assertFalse(fourOnFourOff.isOnDuty(anchor.plusDays(4)));
        }

        @Test
        void nextCycle_repeats() {
            assertTrue(fourOnFourOff.isOnDuty(anchor.plusDays(8)));
            assertFalse(fourOnFourOff.isOnDuty(anchor.plusDays(15)));
        }

        @Test
        void datesBeforeAnchor_followTheSameCycle() {
            assertFalse(fourOnFourOff.isOnDuty(anchor.minusDays(1)));
            assertTrue(fourOnFourOff.isOnDuty(anchor.minusDays(5)));
        }

        @Test
        void emptyCycle_isNeverOnDuty() {
            CrewRotation none = new CrewRotation(1L, anchor, 0, 0);
            assertFalse(none.isOnDuty(anchor));
        }
    }

    // =========================================================================
    // Entities
    // =========================================================================

    @Nested
    @DisplayName("Entities")
    class EntityTests {

        @Test
        void detection_scoreAtThreshold_isAnomalous() {
            Detection d = new Detection(1L, 1L, "IsolationForest", 0.8, 0.8, "{}", "anomaly");
            assertTrue(d.isAnomalous());
        }

        @Test
        void detection_scoreBelowThreshold_isNotAnomalous() {
            Detection d = new Detection(1L, 1L, "IsolationForest", 0.79, 0.8, "{}", "normal");
            assertFalse(d.isAnomalous());
        }

        @Test
        void session_withoutEnd_isOngoing() {
            Session s = new Session(7L, "OP1", 1, LocalDateTime.of(2024, 3, 1, 7, 0), null, 10);
            assertTrue(s.isOngoing());
        }

        @Test
        void session_equalityIsById() {
            LocalDateTime t = LocalDateTime.of(2024, 3, 1, 7, 0);
            Session a = new Session(7L, "OP1", 1, t, t, 10);
            Session b = new Session(7L, "OP2", 2, t.plusHours(1), null, 5);
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
        }

        @Test
        void operator_createdById_hasRankTrue() {
            Operator op = new Operator("OP1");
            assertTrue(op.isRank());
            assertEquals(new Operator("OP1"), op);
        }

        @Test
        void user_defaultsToActiveViewer() {
            User u = new User();
            assertEquals(UserRole.VIEWER, u.getRole());
            assertTrue(u.isActive());
            assertEquals(new User("alice", "h1", UserRole.ADMIN, null),
                         new User("alice", "h2", UserRole.VIEWER, "a@x"));
        }

        @Test
        void alertCtiLink_equalityIsByPair() {
            assertEquals(new AlertCtiLink(1L, 2L, "hash match"), new AlertCtiLink(1L, 2L, null));
            assertNotEquals(new AlertCtiLink(1L, 2L, null), new AlertCtiLink(2L, 1L, null));
        }
    }
}
