package com.nana.opsight.domain;

import java.time.LocalTime;
import java.util.Optional;

/**
 * Shift labels recognised in operator event exports, and the
 * {@code shift_definitions} row each label resolves to.
 *
 * <p>The mapping is fixed: the shift ids are seeded as reference data when
 * the schema is created, so a label can be resolved without a lookup.
 */
public enum ShiftType {

    DAY(1, "Day", LocalTime.of(7, 0), LocalTime.of(19, 0), 12.0),
    NIGHT(2, "Night", LocalTime.of(19, 0), LocalTime.of(7, 0), 12.0);

    // -----------------------------------------------------------------------
    // FIELDS
    // -----------------------------------------------------------------------

    private final int shiftId;
    private final String displayName;
    private final LocalTime startTime;
    private final LocalTime endTime;
    private final double durationHours;

    ShiftType(int shiftId, String displayName,
              LocalTime startTime, LocalTime endTime, double durationHours) {
        this.shiftId       = shiftId;
        this.displayName   = displayName;
        this.startTime     = startTime;
        this.endTime       = endTime;
        this.durationHours = durationHours;
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public int getShiftId()          { return shiftId; }
    public String getDisplayName()   { return displayName; }
    public LocalTime getStartTime()  { return startTime; }
    public LocalTime getEndTime()    { return endTime; }
    public double getDurationHours() { return durationHours; }

    /**
     * Resolves a raw shift label, ignoring case and surrounding whitespace.
     *
     * <p>Unlike the lenient lookups elsewhere in the domain package this one
     * never falls back to a default: an unknown label has to reach the caller
     * so the load can be rejected.
     *
     * @param label the label as read from the input file; may be null
     * @return the matching shift, or empty for null, blank or unknown labels
     */
    public static Optional<ShiftType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalised = label.trim();
        for (ShiftType type : values()) {
            if (type.name().equalsIgnoreCase(normalised)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return name();
    }
}
