package com.nana.opsight.service;

import com.nana.opsight.domain.Event;
import com.nana.opsight.domain.Operator;
import com.nana.opsight.domain.Session;
import com.nana.opsight.repository.OperatorRepository;
import com.nana.opsight.repository.SessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OperatorSessionReconciler")
class OperatorSessionReconcilerTest {

    @Mock
    private OperatorRepository operatorRepository;

    @Mock
    private SessionRepository sessionRepository;

    private OperatorSessionReconciler reconciler;

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 1, 7, 0);

    @BeforeEach
    void setUp() {
        reconciler = new OperatorSessionReconciler(operatorRepository, sessionRepository, 10, 3);
    }

    private static IngestRow row(long sessionId, String operatorId, LocalDateTime ts, String shift) {
        Event e = new Event();
        e.setSessionId(sessionId);
        e.setOperatorId(operatorId);
        e.setTimestamp(ts);
        return new IngestRow(e, shift);
    }

    @SuppressWarnings("unchecked")
    private static <T> ArgumentCaptor<Collection<T>> collectionCaptor() {
        return ArgumentCaptor.forClass((Class<Collection<T>>) (Class<?>) Collection.class);
    }

    // =========================================================================
    // deriveSessions
    // =========================================================================

    @Nested
    @DisplayName("deriveSessions()")
    class DeriveTests {

        @Test
        void rowsOfOneSession_spanMinToMaxTimestamp() throws ValidationException {
            List<IngestRow> rows = List.of(
                    row(5, "OP1", T0.plusMinutes(30), "DAY"),
                    row(5, "OP1", T0, "DAY"),
                    row(5, "OP1", T0.plusMinutes(10), "DAY"));

            List<Session> sessions = reconciler.deriveSessions(rows);

            assertEquals(1, sessions.size());
            Session s = sessions.get(0);
            assertEquals(5L, s.getId());
            assertEquals(T0, s.getSessionStart());
            assertEquals(T0.plusMinutes(30), s.getSessionEnd());
            assertEquals(1L, s.getShiftId());
            assertEquals(10, s.getInactivityThresholdMin());
        }

        @Test
        void operatorAndShift_comeFromFirstRowOfSession() throws ValidationException {
            List<IngestRow> rows = List.of(
                    row(9, "OP7", T0, " night "),
                    row(9, "OP8", T0.plusMinutes(1), "DAY"));

            Session s = reconciler.deriveSessions(rows).get(0);

            assertEquals("OP7", s.getOperatorId());
            assertEquals(2L, s.getShiftId());
        }

        @Test
        void sessions_areOrderedById() throws ValidationException {
            List<IngestRow> rows = List.of(
                    row(30, "OP1", T0, "DAY"),
                    row(10, "OP2", T0, "NIGHT"),
                    row(20, "OP3", T0, "DAY"));

            List<Long> ids = new ArrayList<>();
            for (Session s : reconciler.deriveSessions(rows)) {
                ids.add(s.getId());
            }
            assertEquals(List.of(10L, 20L, 30L), ids);
        }

        @Test
        void unknownShift_throwsNamingTheValue() {
            List<IngestRow> rows = List.of(
                    row(1, "OP1", T0, "DAY"),
                    row(2, "OP1", T0, "SWING"));

            ValidationException ex = assertThrows(ValidationException.class,
                    () -> reconciler.deriveSessions(rows));

            assertTrue(ex.hasError("Shift"));
            assertTrue(ex.getError("Shift").contains("SWING"));
            assertTrue(ex.getError("Shift").contains("expected DAY or NIGHT"));
        }

        @Test
        void unknownShift_examplesAreCapped() {
            List<IngestRow> rows = List.of(
                    row(1, "OP1", T0, "A"),
                    row(2, "OP1", T0, "B"),
                    row(3, "OP1", T0, "C"),
                    row(4, "OP1", T0, "D"));

            ValidationException ex = assertThrows(ValidationException.class,
                    () -> reconciler.deriveSessions(rows));

            assertTrue(ex.getError("Shift").endsWith("A, B, C"));
        }

        @Test
        void missingShift_isRejected() {
            List<IngestRow> rows = List.of(row(1, "OP1", T0, null));

            assertThrows(ValidationException.class, () -> reconciler.deriveSessions(rows));
        }
    }

    // =========================================================================
    // ensureOperators
    // =========================================================================

    @Nested
    @DisplayName("ensureOperators()")
    class EnsureOperatorTests {

        @Test
        void onlyMissingIds_areInserted() {
            when(operatorRepository.findExistingIds(anyCollection())).thenReturn(Set.of("OP1"));
            when(operatorRepository.saveAll(anyCollection())).thenReturn(1);

            int created = reconciler.ensureOperators(List.of("OP1", "OP2", "OP2"));

            assertEquals(1, created);
            ArgumentCaptor<Collection<Operator>> captor = collectionCaptor();
            verify(operatorRepository).saveAll(captor.capture());
            assertEquals(List.of(new Operator("OP2")), new ArrayList<>(captor.getValue()));
            assertTrue(captor.getValue().iterator().next().isRank());
        }

        @Test
        void allPresent_insertsNothing() {
            when(operatorRepository.findExistingIds(anyCollection())).thenReturn(Set.of("OP1", "OP2"));

            assertEquals(0, reconciler.ensureOperators(List.of("OP1", "OP2")));
            verify(operatorRepository, never()).saveAll(anyCollection());
        }

        @Test
        void emptyInput_touchesNoRepository() {
            assertEquals(0, reconciler.ensureOperators(List.of()));
            verifyNoInteractions(operatorRepository, sessionRepository);
        }
    }

    // =========================================================================
    // ensureSessions / reconcile
    // =========================================================================

    @Nested
    @DisplayName("ensureSessions() and reconcile()")
    class EnsureSessionTests {

        @Test
        void storedSession_isNotRewritten() {
            Session stored = new Session(1L, "OP1", 1, T0, T0, 10);
            Session fresh  = new Session(2L, "OP1", 1, T0, T0, 10);
            when(sessionRepository.findExistingIds(anyCollection())).thenReturn(Set.of(1L));
            when(sessionRepository.saveAll(anyCollection())).thenReturn(1);

            assertEquals(1, reconciler.ensureSessions(List.of(stored, fresh)));

            ArgumentCaptor<Collection<Session>> captor = collectionCaptor();
            verify(sessionRepository).saveAll(captor.capture());
            assertEquals(List.of(fresh), new ArrayList<>(captor.getValue()));
        }

        @Test
        void reconcile_reportsBothCounts() throws ValidationException {
            when(operatorRepository.findExistingIds(anyCollection())).thenReturn(Set.of());
            when(operatorRepository.saveAll(anyCollection())).thenReturn(2);
            when(sessionRepository.findExistingIds(anyCollection())).thenReturn(Set.of());
            when(sessionRepository.saveAll(anyCollection())).thenReturn(2);

            OperatorSessionReconciler.Result result = reconciler.reconcile(List.of(
                    row(1, "OP1", T0, "DAY"),
                    row(2, "OP2", T0, "NIGHT")));

            assertEquals(2, result.getOperatorsCreated());
            assertEquals(2, result.getSessionsCreated());
        }

        @Test
        void reconcile_badShift_writesNothing() {
            List<IngestRow> rows = List.of(row(1, "OP1", T0, "SWING"));

            assertThrows(ValidationException.class, () -> reconciler.reconcile(rows));
            verifyNoInteractions(operatorRepository, sessionRepository);
        }

        @Test
        void operatorIds_keepFirstSeenOrderWithoutRepeats() {
            Set<String> ids = OperatorSessionReconciler.operatorIds(List.of(
                    row(1, "OP2", T0, "DAY"),
                    row(2, "OP1", T0, "DAY"),
                    row(3, "OP2", T0, "DAY")));

            assertEquals(List.of("OP2", "OP1"), new ArrayList<>(ids));
        }
    }

    @Test
    void constructor_nullRepository_isRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new OperatorSessionReconciler(null, sessionRepository, 10, 3));
    }
}
