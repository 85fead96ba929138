package com.nana.opsight.repository;

import com.nana.opsight.domain.Event;

import java.util.List;
import java.util.Optional;

/**
 * Data access contract for {@link Event} rows.
 */
public interface EventRepository {

    /** Inserts one event and sets its generated id. */
    void save(Event event);

    /**
     * Inserts all events as a single JDBC batch in the caller's transaction.
     *
     * @param events the events to insert; may be empty
     * @return the number of rows inserted
     * @throws IntegrityViolationException if any row breaks a constraint; the
     *         caller must roll back, since earlier rows of the batch may
     *         already be written
     */
    int insertBatch(List<Event> events);

    Optional<Event> findById(long eventId);

    /** Events of one session in timestamp order. */
    List<Event> findBySession(long sessionId);

    long countBySession(long sessionId);

    long countAll();
}
