package com.nana.opsight.service;

import com.nana.opsight.domain.Event;

/**
 * A normalised input row: the event to store plus the raw shift label,
 * which only feeds session derivation and is never stored on the event.
 *
 * <p>Session id, operator id and timestamp on the event are always set.
 */
public final class IngestRow {

    private final Event event;
    private final String shiftLabel;

    public IngestRow(Event event, String shiftLabel) {
        if (event.getSessionId() == null || event.getOperatorId() == null
                || event.getTimestamp() == null) {
            throw new IllegalArgumentException("Row lacks session, operator or timestamp: " + event);
        }
        this.event      = event;
        this.shiftLabel = shiftLabel;
    }

    public Event getEvent()         { return event; }

    public String getShiftLabel()   { return shiftLabel; }

    public long getSessionId()      { return event.getSessionId(); }

    public String getOperatorId()   { return event.getOperatorId(); }
}
