package io.queueflow.jdbc;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CronScheduleTest {

    @Test
    void fiveFieldPatternFiresOnTheMinute() {
        CronSchedule daily = CronSchedule.parse("0 9 * * *", null);
        assertEquals(ZoneOffset.UTC, daily.zone());
        assertEquals(Instant.parse("2024-05-01T09:00:00Z"), daily.next(Instant.parse("2024-05-01T08:15:30Z")));
        assertEquals(Instant.parse("2024-05-02T09:00:00Z"), daily.next(Instant.parse("2024-05-01T09:00:00Z")));
    }

    @Test
    void sixFieldPatternHasSeconds() {
        CronSchedule everyTen = CronSchedule.parse("*/10 * * * * *", null);
        assertEquals(Instant.parse("2024-05-01T08:00:10Z"), everyTen.next(Instant.parse("2024-05-01T08:00:03Z")));
    }

    @Test
    void patternIsEvaluatedInZone() {
        CronSchedule berlin = CronSchedule.parse("0 9 * * *", "Europe/Berlin");
        assertEquals(ZoneId.of("Europe/Berlin"), berlin.zone());
        // CEST is UTC+2
        assertEquals(Instant.parse("2024-07-01T07:00:00Z"), berlin.next(Instant.parse("2024-07-01T00:00:00Z")));
    }

    @Test
    void dayOfWeekUsesUnixNumbering() {
        CronSchedule mondays = CronSchedule.parse("30 6 * * 1", null);
        // 2024-05-01 is a Wednesday
        assertEquals(Instant.parse("2024-05-06T06:30:00Z"), mondays.next(Instant.parse("2024-05-01T00:00:00Z")));
    }

    @Test
    void rejectsWrongFieldCount() {
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("* * * *", null));
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("", null));
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("0 0 0 * * * *", null));
    }

    @Test
    void rejectsMalformedFieldsAndZones() {
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("61 9 * * *", null));
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("0 9 * * *", "Mars/Olympus"));
    }
}
