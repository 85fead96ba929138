package com.nana.opsight.domain;

import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * A kind of shift (day, night, ...) with its nominal clock times.
 *
 * <p>Every field except the id is optional. A night shift has an end time
 * earlier than its start time; no check ties the duration to the clock times.
 */
public class ShiftDefinition {

    private long id;
    private String name;
    private LocalTime startTime;
    private LocalTime endTime;
    private Double durationHours;
    private LocalDateTime createdAt;

    public ShiftDefinition() {
    }

    public ShiftDefinition(long id, String name, LocalTime startTime,
                           LocalTime endTime, Double durationHours) {
        this.id            = id;
        this.name          = name;
        this.startTime     = startTime;
        this.endTime       = endTime;
        this.durationHours = durationHours;
    }

    /**
     * Builds the reference definition for one of the fixed shift labels.
     *
     * @param type the shift label
     * @return a definition carrying the label's id and clock times
     */
    public static ShiftDefinition of(ShiftType type) {
        return new ShiftDefinition(type.getShiftId(), type.name(),
                type.getStartTime(), type.getEndTime(), type.getDurationHours());
    }

    public long getId()                       { return id; }
    public void setId(long id)                { this.id = id; }
    public String getName()                   { return name; }
    public void setName(String name)          { this.name = name; }
    public LocalTime getStartTime()           { return startTime; }
    public void setStartTime(LocalTime v)     { this.startTime = v; }
    public LocalTime getEndTime()             { return endTime; }
    public void setEndTime(LocalTime v)       { this.endTime = v; }
    public Double getDurationHours()          { return durationHours; }
    public void setDurationHours(Double v)    { this.durationHours = v; }
    public LocalDateTime getCreatedAt()       { return createdAt; }
    public void setCreatedAt(LocalDateTime v) { this.createdAt = v; }

    @Override
    public String toString() {
        return "ShiftDefinition{id=" + id + ", name='" + name + "', "
               + startTime + "-" + endTime + "}";
    }
}
