package com.nana.opsight.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Timestamp conversions for the store and for incoming files.
 *
 * <p>The store keeps every timestamp as TEXT in {@link #STORAGE_FORMAT},
 * which sorts chronologically. Incoming files are less disciplined, so
 * {@link #parse(String)} accepts the common layouts below and reports
 * anything else as unparsable rather than guessing. Dates that do not
 * exist on the calendar, such as 30 February, are unparsable too.
 * <ul>
 *   <li>{@code 2024-03-01 07:15:30}, with optional seconds and fraction</li>
 *   <li>{@code 2024-03-01T07:15:30}, ISO local, with optional fraction</li>
 *   <li>{@code 2024-03-01T07:15:30Z} or with an offset (wall time is kept)</li>
 *   <li>{@code 2024/03/01 07:15:30}</li>
 *   <li>{@code 03/01/2024 07:15:30} (month first)</li>
 *   <li>{@code 2024-03-01} (midnight)</li>
 * </ul>
 */
public final class TimestampParser {

    /** Storage layout of every timestamp column. */
    public static final DateTimeFormatter STORAGE_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss.SSS");

    private static final List<Function<String, LocalDateTime>> PARSERS = List.of(
            layout(withOptionalTime("uuuu-MM-dd HH:mm")),
            layout(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
            v -> OffsetDateTime.parse(v).toLocalDateTime(),
            layout(withOptionalTime("uuuu/MM/dd HH:mm")),
            layout(withOptionalTime("MM/dd/uuuu HH:mm")),
            v -> LocalDate.parse(v).atStartOfDay()
    );

    private TimestampParser() {
        throw new UnsupportedOperationException("TimestampParser is a static utility class.");
    }

    /**
     * Parses a timestamp from an input file.
     *
     * @param raw the field text; may be null
     * @return the parsed value, or empty when blank or in no known layout
     */
    public static Optional<LocalDateTime> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        for (Function<String, LocalDateTime> parser : PARSERS) {
            try {
                return Optional.of(parser.apply(value));
            } catch (DateTimeParseException ex) {
                continue;
            }
        }
        return Optional.empty();
    }

    public static String format(LocalDateTime value) {
        return value == null ? null : value.format(STORAGE_FORMAT);
    }

    /**
     * Parses a value read back from the store.
     *
     * @param stored the column text; may be null
     * @return the timestamp, or null when the column was NULL
     * @throws DateTimeParseException if the stored text is not a timestamp
     */
    public static LocalDateTime parseStored(String stored) {
        if (stored == null || stored.isBlank()) {
            return null;
        }
        return parse(stored).orElseThrow(() ->
                new DateTimeParseException("Unrecognised stored timestamp", stored, 0));
    }

    public static String formatTime(LocalTime value) {
        return value == null ? null : value.toString();
    }

    public static LocalTime parseStoredTime(String stored) {
        return stored == null || stored.isBlank() ? null : LocalTime.parse(stored.trim());
    }

    private static Function<String, LocalDateTime> layout(DateTimeFormatter format) {
        return v -> LocalDateTime.parse(v, format);
    }

    private static DateTimeFormatter withOptionalTime(String dateHourMinute) {
        return new DateTimeFormatterBuilder()
                .appendPattern(dateHourMinute)
                .optionalStart()
                .appendPattern(":ss")
                .optionalStart()
                .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                .optionalEnd()
                .optionalEnd()
                .toFormatter()
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
