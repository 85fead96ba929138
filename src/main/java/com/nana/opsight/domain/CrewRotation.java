package com.nana.opsight.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * An on/off rotation pattern for a crew, counted from an anchor date.
 */
public class CrewRotation {

    private long id;
    private long crewId;
    private LocalDate anchorDate;
    private int onDays;
    private int offDays;
    private LocalDateTime createdAt;

    public CrewRotation() {
    }

    public CrewRotation(long crewId, LocalDate anchorDate, int onDays, int offDays) {
        this.crewId     = crewId;
        this.anchorDate = anchorDate;
        this.onDays     = onDays;
        this.offDays    = offDays;
    }

    /**
     * Whether the crew is on duty on the given date.
     *
     * <p>Day 0 is the anchor date and the first day of an "on" block.
     * Dates before the anchor are projected backwards through the cycle.
     *
     * @param date the calendar date to check
     * @return true if the date falls in an "on" block
     */
    public boolean isOnDuty(LocalDate date) {
        int cycle = onDays + offDays;
        if (cycle <= 0 || anchorDate == null) {
            return false;
        }
        long offset = ChronoUnit.DAYS.between(anchorDate, date);
        return Math.floorMod(offset, cycle) < onDays;
    }

    public long getId()                       { return id; }
    public void setId(long id)                { this.id = id; }
    public long getCrewId()                   { return crewId; }
    public void setCrewId(long crewId)        { this.crewId = crewId; }
    public LocalDate getAnchorDate()          { return anchorDate; }
    public void setAnchorDate(LocalDate v)    { this.anchorDate = v; }
    public int getOnDays()                    { return onDays; }
    public void setOnDays(int onDays)         { this.onDays = onDays; }
    public int getOffDays()                   { return offDays; }
    public void setOffDays(int offDays)       { this.offDays = offDays; }
    public LocalDateTime getCreatedAt()       { return createdAt; }
    public void setCreatedAt(LocalDateTime v) { this.createdAt = v; }

    @Override
    public String toString() {
        return "CrewRotation{id=" + id + ", crew=" + crewId + ", anchor=" + anchorDate
               + ", " + onDays + " on/" + offDays + " off}";
    }
}
