package com.nana.opsight.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimestampParser")
class TimestampParserTest {

    private static final LocalDateTime SEVEN_FIFTEEN = LocalDateTime.of(2024, 3, 1, 7, 15, 30);

    @ParameterizedTest
    @ValueSource(strings = {
            "2024-03-01 07:15:30",
            "2024-03-01T07:15:30",
            "2024-03-01T07:15:30Z",
            "2024-03-01T07:15:30+02:00",
            "2024/03/01 07:15:30",
            "03/01/2024 07:15:30",
            "  2024-03-01 07:15:30  "
    })
    void parse_knownLayouts_yieldSameWallTime(String raw) {
        assertEquals(SEVEN_FIFTEEN, TimestampParser.parse(raw).orElseThrow());
    }

    @Test
    void parse_fractionalSeconds_areKept() {
        LocalDateTime parsed = TimestampParser.parse("2024-03-01 07:15:30.250").orElseThrow();
        assertEquals(250_000_000, parsed.getNano());
    }

    @Test
    void parse_withoutSeconds_isOnTheMinute() {
        assertEquals(LocalDateTime.of(2024, 3, 1, 7, 15),
                TimestampParser.parse("2024-03-01 07:15").orElseThrow());
    }

    @Test
    void parse_dateOnly_isMidnight() {
        assertEquals(LocalDateTime.of(2024, 3, 1, 0, 0),
                TimestampParser.parse("2024-03-01").orElseThrow());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "yesterday", "2024-13-01 07:00:00", "12345"})
    void parse_unusable_isEmpty(String raw) {
        assertTrue(TimestampParser.parse(raw).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "2024-02-30 10:00:00",
            "2023-02-29 10:00",
            "2024/04/31 08:00:00",
            "02/30/2024 10:00:00",
            "2024-02-30T10:00:00",
            "2024-02-30"
    })
    void parse_dateNotOnTheCalendar_isEmpty(String raw) {
        assertTrue(TimestampParser.parse(raw).isEmpty(), raw);
    }

    @Test
    void parse_leapDay_isAccepted() {
        assertEquals(LocalDateTime.of(2024, 2, 29, 10, 0),
                TimestampParser.parse("2024-02-29 10:00:00").orElseThrow());
    }

    @Test
    void format_thenParseStored_isLossless() {
        LocalDateTime value = LocalDateTime.of(2024, 3, 1, 19, 0, 5, 123_000_000);
        String stored = TimestampParser.format(value);
        assertEquals("2024-03-01 19:00:05.123", stored);
        assertEquals(value, TimestampParser.parseStored(stored));
    }

    @Test
    void storedValues_sortChronologically() {
        String earlier = TimestampParser.format(LocalDateTime.of(2024, 3, 1, 9, 0));
        String later   = TimestampParser.format(LocalDateTime.of(2024, 3, 1, 10, 0));
        assertTrue(earlier.compareTo(later) < 0);
    }

    @Test
    void parseStored_garbage_throws() {
        assertThrows(DateTimeParseException.class, () -> TimestampParser.parseStored("not a time"));
    }

    @Test
    void parseStored_null_isNull() {
        assertNull(TimestampParser.parseStored(null));
        assertNull(TimestampParser.format(null));
    }

    @Test
    void time_roundTrip() {
        assertEquals(LocalTime.of(19, 0), TimestampParser.parseStoredTime(TimestampParser.formatTime(LocalTime.of(19, 0))));
    }
}
