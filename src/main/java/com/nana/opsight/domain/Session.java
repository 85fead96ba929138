package com.nana.opsight.domain;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Session - one continuous stretch of work by a single operator.
 *
 * <p>The session window runs from the first to the last observed event.
 * A null {@code sessionEnd} means the session is still open. Sessions
 * derived from an event export keep the session id used in that export,
 * so {@code id} is caller-supplied there; other callers may leave it null
 * and let the store assign one.
 */
public class Session {

    private Long id;
    private Long shiftInstanceId;
    private String operatorId;
    private long shiftId;
    private LocalDateTime sessionStart;
    private LocalDateTime sessionEnd;
    private int inactivityThresholdMin;
    private LocalDateTime createdAt;

    public Session() {
    }

    public Session(Long id, String operatorId, long shiftId,
                   LocalDateTime sessionStart, LocalDateTime sessionEnd,
                   int inactivityThresholdMin) {
        this.id                     = id;
        this.operatorId             = operatorId;
        this.shiftId                = shiftId;
        this.sessionStart           = sessionStart;
        this.sessionEnd             = sessionEnd;
        this.inactivityThresholdMin = inactivityThresholdMin;
    }

    public Long getId()                          { return id; }
    public void setId(Long id)                   { this.id = id; }
    public Long getShiftInstanceId()             { return shiftInstanceId; }
    public void setShiftInstanceId(Long v)       { this.shiftInstanceId = v; }
    public String getOperatorId()                { return operatorId; }
    public void setOperatorId(String v)          { this.operatorId = v; }
    public long getShiftId()                     { return shiftId; }
    public void setShiftId(long shiftId)         { this.shiftId = shiftId; }
    public LocalDateTime getSessionStart()       { return sessionStart; }
    public void setSessionStart(LocalDateTime v) { this.sessionStart = v; }
    public LocalDateTime getSessionEnd()         { return sessionEnd; }
    public void setSessionEnd(LocalDateTime v)   { this.sessionEnd = v; }
    public int getInactivityThresholdMin()       { return inactivityThresholdMin; }
    public void setInactivityThresholdMin(int v) { this.inactivityThresholdMin = v; }
    public LocalDateTime getCreatedAt()          { return createdAt; }
    public void setCreatedAt(LocalDateTime v)    { this.createdAt = v; }

    public boolean isOngoing() {
        return sessionEnd == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Session other)) return false;
        return id != null && Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Session{id=" + id + ", operator='" + operatorId + "', shift=" + shiftId
               + ", " + sessionStart + " -> " + (sessionEnd == null ? "ongoing" : sessionEnd)
               + "}";
    }
}
