package com.nana.opsight.util;

import com.nana.opsight.domain.Event;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * EventColumn - the payload columns of an event export.
 *
 * <p>Each constant knows its header, how its text is converted and where
 * the converted value goes on an {@link Event}. The loader walks
 * {@code values()} and never names a column itself; adding a column means
 * adding a constant here and a bind/map line in the event repository.
 *
 * <p>The identifying columns ({@link #SESSION_ID}, {@link #OPERATOR_ID},
 * {@link #TIMESTAMP}) and {@link #SHIFT} are handled by the loader directly
 * because a defect in them drops the row or aborts the load rather than
 * being stored.
 *
 * <p>TEXT columns with a maximum length are cut to exactly that many
 * characters. The store declares the same widths but SQLite does not
 * enforce them.
 */
public enum EventColumn {

    // -----------------------------------------------------------------------
    // COLUMN DEFINITIONS
    //   header, value type, maximum length (0 = unbounded), setter
    // -----------------------------------------------------------------------

    TIME_INTERVAL("TimeInterval", ValueType.REAL, 0,
            (e, v) -> e.setTimeInterval((Double) v)),

    ADDRESS("Address", ValueType.TEXT, 50,
            (e, v) -> e.setAddress((String) v)),

    FUNCTION_CODE("FunctionCode", ValueType.TEXT, 10,
            (e, v) -> e.setFunctionCode((String) v)),

    COMMAND_RESPONSE("CommandResponse", ValueType.TEXT, 50,
            (e, v) -> e.setCommandResponse((String) v)),

    CONTROL_MODE("ControlMode", ValueType.TEXT, 50,
            (e, v) -> e.setControlMode((String) v)),

    /** Wider than the rest: solenoid control scheme names run past 20 characters. */
    CONTROL_SCHEME("ControlScheme", ValueType.TEXT, 100,
            (e, v) -> e.setControlScheme((String) v)),

    CRC("CRC", ValueType.INTEGER, 0,
            (e, v) -> e.setCrc((Integer) v)),

    DATA_LENGTH("DataLength", ValueType.INTEGER, 0,
            (e, v) -> e.setDataLength((Integer) v)),

    INVALID_FUNCTION_CODE("InvalidFunctionCode", ValueType.TEXT, 5,
            (e, v) -> e.setInvalidFunctionCode((String) v)),

    INVALID_DATA_LENGTH("InvalidDataLength", ValueType.TEXT, 5,
            (e, v) -> e.setInvalidDataLength((String) v)),

    PUMP_STATE("PumpState", ValueType.TEXT, 50,
            (e, v) -> e.setPumpState((String) v)),

    SOLENOID_STATE("SolenoidState", ValueType.TEXT, 50,
            (e, v) -> e.setSolenoidState((String) v)),

    SET_POINT("SetPoint", ValueType.REAL, 0,
            (e, v) -> e.setSetPoint((Double) v)),

    PIPELINE_PSI("PipelinePSI", ValueType.REAL, 0,
            (e, v) -> e.setPipelinePsi((Double) v)),

    PID_CYCLE_TIME("PIDCycleTime", ValueType.REAL, 0,
            (e, v) -> e.setPidCycleTime((Double) v)),

    PID_DEADBAND("PIDDeadband", ValueType.REAL, 0,
            (e, v) -> e.setPidDeadband((Double) v)),

    PID_GAIN("PIDGain", ValueType.REAL, 0,
            (e, v) -> e.setPidGain((Double) v)),

    PID_RATE("PIDRate", ValueType.REAL, 0,
            (e, v) -> e.setPidRate((Double) v)),

    PID_RESET("PIDReset", ValueType.REAL, 0,
            (e, v) -> e.setPidReset((Double) v)),

    DELTA_SET_POINT("deltaSetPoint", ValueType.REAL, 0,
            (e, v) -> e.setDeltaSetPoint((Double) v)),

    DELTA_PIPELINE_PSI("deltaPipelinePSI", ValueType.REAL, 0,
            (e, v) -> e.setDeltaPipelinePsi((Double) v)),

    DELTA_PID_CYCLE_TIME("deltaPIDCycleTime", ValueType.REAL, 0,
            (e, v) -> e.setDeltaPidCycleTime((Double) v)),

    DELTA_PID_DEADBAND("deltaPIDDeadband", ValueType.REAL, 0,
            (e, v) -> e.setDeltaPidDeadband((Double) v)),

    DELTA_PID_GAIN("deltaPIDGain", ValueType.REAL, 0,
            (e, v) -> e.setDeltaPidGain((Double) v)),

    DELTA_PID_RATE("deltaPIDRate", ValueType.REAL, 0,
            (e, v) -> e.setDeltaPidRate((Double) v)),

    DELTA_PID_RESET("deltaPIDReset", ValueType.REAL, 0,
            (e, v) -> e.setDeltaPidReset((Double) v)),

    /** Trimmed before truncation. */
    LABEL("Label", ValueType.TEXT, 50,
            (e, v) -> e.setLabel((String) v));

    // -----------------------------------------------------------------------
    // IDENTIFYING COLUMNS
    // -----------------------------------------------------------------------

    public static final String SESSION_ID  = "Session_ID";
    public static final String OPERATOR_ID = "Operator_ID";
    public static final String TIMESTAMP   = "Timestamp";

    /** Used to derive the session's shift; never stored on the event. */
    public static final String SHIFT       = "Shift";

    /** Columns a file must have before any row is read. */
    public static final List<String> REQUIRED_HEADERS =
            List.of(SESSION_ID, OPERATOR_ID, TIMESTAMP, SHIFT);

    /**
     * Cell values read as "no value", matching what spreadsheet and
     * dataframe tools write for missing data.
     */
    private static final Set<String> MISSING_TOKENS = Set.of(
            "", "NA", "N/A", "n/a", "NaN", "nan", "-NaN", "-nan", "null", "NULL",
            "None", "#N/A", "#N/A N/A", "#NA", "<NA>", "-1.#IND", "1.#IND",
            "-1.#QNAN", "1.#QNAN");

    // -----------------------------------------------------------------------
    // FIELDS
    // -----------------------------------------------------------------------

    public enum ValueType { TEXT, INTEGER, REAL }

    private final String header;
    private final ValueType type;
    private final int maxLength;
    private final BiConsumer<Event, Object> setter;

    EventColumn(String header, ValueType type, int maxLength, BiConsumer<Event, Object> setter) {
        this.header    = header;
        this.type      = type;
        this.maxLength = maxLength;
        this.setter    = setter;
    }

    public String getHeader()    { return header; }

    public ValueType getType()   { return type; }

    /** @return the maximum stored length in characters, or 0 when unbounded */
    public int getMaxLength()    { return maxLength; }

    // -----------------------------------------------------------------------
    // CONVERSION
    // -----------------------------------------------------------------------

    /**
     * Converts a raw cell to this column's Java type.
     *
     * @param raw the cell text; may be null
     * @return the value, or null when the cell is missing
     * @throws NumberFormatException if a numeric cell cannot be read as this
     *                               column's type
     */
    public Object convert(String raw) {
        if (isMissing(raw)) {
            return null;
        }
        return switch (type) {
            case TEXT    -> truncate(this == LABEL ? raw.trim() : raw);
            case INTEGER -> toInteger(raw);
            case REAL    -> parseDecimal(raw);
        };
    }

    /**
     * Converts {@code raw} and stores it on the event.
     *
     * @throws NumberFormatException see {@link #convert(String)}
     */
    public void apply(Event event, String raw) {
        setter.accept(event, convert(raw));
    }

    /**
     * Cuts {@code value} to the maximum length. Values already short enough,
     * and values of unbounded columns, are returned unchanged.
     */
    public String truncate(String value) {
        if (value == null || maxLength <= 0 || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    // -----------------------------------------------------------------------
    // STATIC HELPERS
    // -----------------------------------------------------------------------

    /**
     * @return the column whose header equals {@code header} exactly
     */
    public static Optional<EventColumn> fromHeader(String header) {
        for (EventColumn column : values()) {
            if (column.header.equals(header)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    /** @return true for null, blank and the usual missing-value markers */
    public static boolean isMissing(String raw) {
        return raw == null || raw.isBlank() || MISSING_TOKENS.contains(raw.trim());
    }

    private static Integer toInteger(String raw) {
        long value = parseWholeNumber(raw);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new NumberFormatException("Out of integer range: " + raw);
        }
        return (int) value;
    }

    /**
     * Reads a finite decimal number in plain or exponent notation. Java
     * literal forms such as {@code 1.5f}, {@code 0x1p3} and {@code Infinity}
     * are rejected.
     *
     * @param raw the cell text, not missing
     * @return the value
     * @throws NumberFormatException if the text is not a finite decimal
     */
    public static double parseDecimal(String raw) {
        double value = new BigDecimal(raw.trim()).doubleValue();
        if (Double.isInfinite(value)) {
            throw new NumberFormatException("Out of range: " + raw);
        }
        return value;
    }

    /**
     * Reads an integral number. Exports often write integers as
     * {@code 12.0}; such values are accepted, {@code 12.5} is not.
     *
     * @param raw the cell text, not missing
     * @return the value
     * @throws NumberFormatException if the text is not a whole number
     */
    public static long parseWholeNumber(String raw) {
        try {
            return new BigDecimal(raw.trim()).longValueExact();
        } catch (ArithmeticException ex) {
            throw new NumberFormatException("Not a whole number: " + raw);
        }
    }
}
