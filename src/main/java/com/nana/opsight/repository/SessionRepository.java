package com.nana.opsight.repository;

import com.nana.opsight.domain.Session;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Data access contract for {@link Session} rows.
 *
 * <p>Sessions derived from an event export keep the export's session id;
 * a session saved with a null id gets one assigned by the store.
 */
public interface SessionRepository {

    /**
     * Inserts one session; when its id is null the generated id is set on it.
     */
    void save(Session session);

    /**
     * Inserts sessions that carry their own ids as a single JDBC batch.
     *
     * @return the number of rows inserted
     * @throws IntegrityViolationException on a duplicate id or a missing
     *         operator or shift definition
     */
    int saveAll(Collection<Session> sessions);

    Optional<Session> findById(long sessionId);

    Set<Long> findExistingIds(Collection<Long> sessionIds);

    /** Sessions of one operator, oldest first. */
    List<Session> findByOperator(String operatorId);

    long countAll();

    /**
     * Deletes a session. The store cascades the delete to the session's
     * events, features and alerts, and from the events to their detections.
     *
     * @return true if a row was deleted
     */
    boolean delete(long sessionId);
}
