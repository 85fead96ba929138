package com.nana.opsight.domain;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Operator - an ICS operator whose commands are recorded as events.
 *
 * <p>The operator id is assigned by the plant (it arrives in the event
 * export) and is the primary key as-is; it is never generated here.
 * Crew and default shift are optional and usually filled in later by
 * whoever maintains the roster.
 */
public class Operator {

    /** Maximum stored length of an operator id. */
    public static final int MAX_ID_LENGTH = 10;

    private String operatorId;
    private Long crewId;
    private Long defaultShiftId;
    private boolean rank;
    private LocalDateTime createdAt;

    public Operator() {
        this.rank = true;
    }

    public Operator(String operatorId) {
        this();
        this.operatorId = operatorId;
    }

    public Operator(String operatorId, Long crewId, Long defaultShiftId, boolean rank) {
        this.operatorId     = operatorId;
        this.crewId         = crewId;
        this.defaultShiftId = defaultShiftId;
        this.rank           = rank;
    }

    public String getOperatorId()             { return operatorId; }
    public void setOperatorId(String v)       { this.operatorId = v; }
    public Long getCrewId()                   { return crewId; }
    public void setCrewId(Long crewId)        { this.crewId = crewId; }
    public Long getDefaultShiftId()           { return defaultShiftId; }
    public void setDefaultShiftId(Long v)     { this.defaultShiftId = v; }

    /** @return the rank flag; operators created by the loader get {@code true} */
    public boolean isRank()                   { return rank; }
    public void setRank(boolean rank)         { this.rank = rank; }
    public LocalDateTime getCreatedAt()       { return createdAt; }
    public void setCreatedAt(LocalDateTime v) { this.createdAt = v; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Operator other)) return false;
        return Objects.equals(operatorId, other.operatorId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(operatorId);
    }

    @Override
    public String toString() {
        return "Operator{id='" + operatorId + "', crew=" + crewId
               + ", defaultShift=" + defaultShiftId + ", rank=" + rank + "}";
    }
}
