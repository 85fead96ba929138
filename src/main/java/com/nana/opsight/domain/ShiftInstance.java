package com.nana.opsight.domain;

import java.time.LocalDateTime;

/**
 * One concrete occurrence of a shift worked by a crew.
 */
public class ShiftInstance {

    private long id;
    private long crewId;
    private long shiftId;
    private LocalDateTime shiftStart;
    private LocalDateTime shiftEnd;
    private LocalDateTime createdAt;

    public ShiftInstance() {
    }

    public ShiftInstance(long crewId, long shiftId,
                         LocalDateTime shiftStart, LocalDateTime shiftEnd) {
        this.crewId     = crewId;
        this.shiftId    = shiftId;
        this.shiftStart = shiftStart;
        this.shiftEnd   = shiftEnd;
    }

    public long getId()                        { return id; }
    public void setId(long id)                 { this.id = id; }
    public long getCrewId()                    { return crewId; }
    public void setCrewId(long crewId)         { this.crewId = crewId; }
    public long getShiftId()                   { return shiftId; }
    public void setShiftId(long shiftId)       { this.shiftId = shiftId; }
    public LocalDateTime getShiftStart()       { return shiftStart; }
    public void setShiftStart(LocalDateTime v) { this.shiftStart = v; }
    public LocalDateTime getShiftEnd()         { return shiftEnd; }
    public void setShiftEnd(LocalDateTime v)   { this.shiftEnd = v; }
    public LocalDateTime getCreatedAt()        { return createdAt; }
    public void setCreatedAt(LocalDateTime v)  { this.createdAt = v; }

    @Override
    public String toString() {
        return "ShiftInstance{id=" + id + ", crew=" + crewId + ", shift=" + shiftId
               + ", " + shiftStart + " -> " + shiftEnd + "}";
    }
}
