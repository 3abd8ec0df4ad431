package io.queueflow.jdbc;

import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * A cron pattern bound to a time zone.
 *
 * <p>Patterns have 5 fields ({@code minute hour day-of-month month day-of-week}) or
 * 6 fields with a leading seconds field. Five-field patterns fire at second 0.
 * Field syntax is that of Spring's {@link CronExpression}. Without a zone, patterns
 * are evaluated in UTC.
 */
public final class CronSchedule {

    private final String pattern;
    private final ZoneId zone;
    private final CronExpression expression;

    private CronSchedule(String pattern, ZoneId zone, CronExpression expression) {
        this.pattern = pattern;
        this.zone = zone;
        this.expression = expression;
    }

    /**
     * @param pattern 5- or 6-field cron pattern
     * @param tz      IANA zone id, or {@code null} for UTC
     * @throws IllegalArgumentException if the pattern or zone is malformed
     */
    public static CronSchedule parse(String pattern, String tz) {
        Objects.requireNonNull(pattern, "pattern");
        String trimmed = pattern.trim();
        int fields = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
        String expression;
        if (fields == 5) {
            expression = "0 " + trimmed;
        } else if (fields == 6) {
            expression = trimmed;
        } else {
            throw new IllegalArgumentException(
                    "Cron pattern must have 5 or 6 fields, got " + fields + ": \"" + pattern + "\"");
        }
        ZoneId zone;
        try {
            zone = tz == null ? ZoneOffset.UTC : ZoneId.of(tz);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid time zone: " + tz, e);
        }
        return new CronSchedule(pattern, zone, CronExpression.parse(expression));
    }

    public String pattern() {
        return pattern;
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Returns the first fire time strictly after {@code after}, or {@code null} if the
     * pattern never fires again.
     */
    public Instant next(Instant after) {
        ZonedDateTime next = expression.next(after.atZone(zone));
        return next == null ? null : next.toInstant();
    }

    @Override
    public String toString() {
        return "CronSchedule{" + pattern + " @ " + zone + "}";
    }
}
