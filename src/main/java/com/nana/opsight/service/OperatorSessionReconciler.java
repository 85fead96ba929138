package com.nana.opsight.service;

import com.nana.opsight.domain.Operator;
import com.nana.opsight.domain.Session;
import com.nana.opsight.domain.ShiftType;
import com.nana.opsight.repository.OperatorRepository;
import com.nana.opsight.repository.SessionRepository;
import com.nana.opsight.util.AppLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * OperatorSessionReconciler - makes sure every operator and session a batch
 * of events refers to exists before the events are inserted.
 *
 * <p>Operators and sessions are only ever added, never updated: a session
 * that is already stored keeps the start, end and shift it was first
 * created with, even when a later file covers more of it.
 *
 * <p>Nothing here commits. Both inserts join the caller's transaction, so a
 * chunk that fails later takes its new operators and sessions with it.
 */
public class OperatorSessionReconciler {

    private static final Logger log = LoggerFactory.getLogger(OperatorSessionReconciler.class);

    private final OperatorRepository operatorRepository;
    private final SessionRepository sessionRepository;
    private final int inactivityThresholdMinutes;
    private final int maxBadShiftExamples;

    /**
     * @param inactivityThresholdMinutes stored on every new session
     * @param maxBadShiftExamples        distinct unrecognised shift labels
     *                                   named in a validation failure
     */
    public OperatorSessionReconciler(OperatorRepository operatorRepository,
                                     SessionRepository sessionRepository,
                                     int inactivityThresholdMinutes,
                                     int maxBadShiftExamples) {
        if (operatorRepository == null || sessionRepository == null) {
            throw new IllegalArgumentException("Repositories must not be null.");
        }
        this.operatorRepository         = operatorRepository;
        this.sessionRepository          = sessionRepository;
        this.inactivityThresholdMinutes = inactivityThresholdMinutes;
        this.maxBadShiftExamples        = Math.max(1, maxBadShiftExamples);
    }

    // -----------------------------------------------------------------------
    // RECONCILE
    // -----------------------------------------------------------------------

    /**
     * Derives the batch's sessions, then adds missing operators and missing
     * sessions. Validation happens before anything is written.
     *
     * @param rows a normalised batch
     * @return how many operators and sessions were added
     * @throws ValidationException if any session's shift label is not recognised
     */
    public Result reconcile(List<IngestRow> rows) throws ValidationException {
        List<Session> sessions = deriveSessions(rows);
        int operators = ensureOperators(operatorIds(rows));
        int created = ensureSessions(sessions);
        return new Result(operators, created);
    }

    /**
     * Operator ids of {@code rows} in first-seen order, without repeats.
     */
    public static Set<String> operatorIds(List<IngestRow> rows) {
        Set<String> ids = new LinkedHashSet<>();
        for (IngestRow row : rows) {
            ids.add(row.getOperatorId());
        }
        return ids;
    }

    // -----------------------------------------------------------------------
    // OPERATORS
    // -----------------------------------------------------------------------

    /**
     * Inserts every id not yet stored as a new operator of rank {@code true}.
     * Stored operators are left as they are.
     *
     * @param operatorIds ids to make sure of; duplicates are ignored
     * @return the number of operators created
     */
    public int ensureOperators(Collection<String> operatorIds) {
        if (operatorIds == null || operatorIds.isEmpty()) {
            return 0;
        }
        Set<String> wanted = new LinkedHashSet<>(operatorIds);
        Set<String> existing = operatorRepository.findExistingIds(wanted);

        List<Operator> missing = new ArrayList<>();
        for (String id : wanted) {
            if (!existing.contains(id)) {
                missing.add(new Operator(id));
            }
        }
        if (missing.isEmpty()) {
            log.debug("All {} operator(s) already stored.", wanted.size());
            return 0;
        }
        int created = operatorRepository.saveAll(missing);
        log.info("Created {} new operator(s); {} already stored.", created, existing.size());
        AppLogger.logEvent("OPERATORS_CREATED", "count=" + created);
        return created;
    }

    // -----------------------------------------------------------------------
    // SESSIONS
    // -----------------------------------------------------------------------

    /**
     * Builds one session per distinct session id, in ascending id order.
     * The operator and shift come from the id's first row; start and end
     * are its earliest and latest timestamps.
     *
     * @param rows a normalised batch
     * @return the derived sessions, not yet stored
     * @throws ValidationException naming up to the configured number of
     *                             distinct shift labels that map to no shift
     */
    public List<Session> deriveSessions(List<IngestRow> rows) throws ValidationException {
        Map<Long, SessionAccumulator> bySession = new TreeMap<>();
        for (IngestRow row : rows) {
            bySession.computeIfAbsent(row.getSessionId(), id -> new SessionAccumulator(row))
                    .add(row.getEvent().getTimestamp());
        }

        Set<String> badLabels = new LinkedHashSet<>();
        List<Session> sessions = new ArrayList<>(bySession.size());
        for (Map.Entry<Long, SessionAccumulator> entry : bySession.entrySet()) {
            SessionAccumulator acc = entry.getValue();
            Optional<ShiftType> shift = ShiftType.fromLabel(acc.shiftLabel);
            if (shift.isEmpty()) {
                if (badLabels.size() < maxBadShiftExamples) {
                    badLabels.add(String.valueOf(acc.shiftLabel));
                }
                continue;
            }
            sessions.add(new Session(entry.getKey(), acc.operatorId, shift.get().getShiftId(),
                    acc.start, acc.end, inactivityThresholdMinutes));
        }

        if (!badLabels.isEmpty()) {
            Map<String, String> errors = new LinkedHashMap<>();
            errors.put("Shift", "Unrecognized shift values (expected DAY or NIGHT). Examples: "
                    + String.join(", ", badLabels));
            log.error("Unrecognised shift labels: {}", badLabels);
            throw new ValidationException(errors);
        }
        log.debug("Derived {} session(s) from {} row(s).", sessions.size(), rows.size());
        return sessions;
    }

    /**
     * Inserts the sessions whose ids are not yet stored. Stored sessions are
     * not touched.
     *
     * @param sessions derived sessions, each with its id set
     * @return the number of sessions created
     */
    public int ensureSessions(List<Session> sessions) {
        if (sessions == null || sessions.isEmpty()) {
            return 0;
        }
        List<Long> ids = new ArrayList<>(sessions.size());
        for (Session s : sessions) {
            ids.add(s.getId());
        }
        Set<Long> existing = sessionRepository.findExistingIds(ids);

        List<Session> missing = new ArrayList<>();
        for (Session s : sessions) {
            if (!existing.contains(s.getId())) {
                missing.add(s);
            }
        }
        if (missing.isEmpty()) {
            log.debug("All {} session(s) already stored.", sessions.size());
            return 0;
        }
        int created = sessionRepository.saveAll(missing);
        log.info("Created {} new session(s); {} already stored.", created, existing.size());
        return created;
    }

    // -----------------------------------------------------------------------
    // INNER TYPES
    // -----------------------------------------------------------------------

    /** Counts of rows added by one {@link #reconcile(List)} call. */
    public static final class Result {

        private final int operatorsCreated;
        private final int sessionsCreated;

        public Result(int operatorsCreated, int sessionsCreated) {
            this.operatorsCreated = operatorsCreated;
            this.sessionsCreated  = sessionsCreated;
        }

        public int getOperatorsCreated() { return operatorsCreated; }

        public int getSessionsCreated()  { return sessionsCreated; }

        @Override
        public String toString() {
            return "Result{operators=" + operatorsCreated + ", sessions=" + sessionsCreated + "}";
        }
    }

    private static final class SessionAccumulator {

        private final String operatorId;
        private final String shiftLabel;
        private LocalDateTime start;
        private LocalDateTime end;

        SessionAccumulator(IngestRow first) {
            this.operatorId = first.getOperatorId();
            this.shiftLabel = first.getShiftLabel();
        }

        void add(LocalDateTime timestamp) {
            if (start == null || timestamp.isBefore(start)) {
                start = timestamp;
            }
            if (end == null || timestamp.isAfter(end)) {
                end = timestamp;
            }
        }
    }
}
