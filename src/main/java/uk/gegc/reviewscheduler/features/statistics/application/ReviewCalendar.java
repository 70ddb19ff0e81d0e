package uk.gegc.reviewscheduler.features.statistics.application;

import uk.gegc.reviewscheduler.features.review.config.ReviewProperties;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Review-day arithmetic. A review day starts {@code dayCutoffMinutes} past local midnight in {@code zone}.
 */
public record ReviewCalendar(ZoneId zone, int dayCutoffMinutes) {

    public static final int MAX_DAY_CUTOFF_MINUTES = 1439;

    public ReviewCalendar {
        if (dayCutoffMinutes < 0 || dayCutoffMinutes > MAX_DAY_CUTOFF_MINUTES) {
            throw new IllegalArgumentException("dayCutoffMinutes must be between 0 and " + MAX_DAY_CUTOFF_MINUTES);
        }
    }

    /**
     * Resolves request overrides against the configured defaults. Blank or null values fall back to the defaults.
     */
    public static ReviewCalendar resolve(String timeZone, Integer dayCutoffMinutes, ReviewProperties.Calendar defaults) {
        String zoneValue = timeZone == null || timeZone.isBlank() ? defaults.getZone() : timeZone.trim();
        int cutoff = dayCutoffMinutes == null ? defaults.getDayCutoffMinutes() : dayCutoffMinutes;
        return new ReviewCalendar(normalizeZone(zoneValue), cutoff);
    }

    private static ZoneId normalizeZone(String value) {
        try {
            return ZoneId.of(value);
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("Unknown time zone: " + value);
        }
    }

    public LocalDate reviewDayDate(Instant instant) {
        LocalTime cutoff = cutoffTime();
        ZonedDateTime zoned = instant.atZone(zone);
        LocalDate date = zoned.toLocalDate();
        if (dayCutoffMinutes > 0 && zoned.toLocalTime().isBefore(cutoff)) {
            return date.minusDays(1);
        }
        return date;
    }

    public Instant dayStart(LocalDate date) {
        return date.atTime(cutoffTime()).atZone(zone).toInstant();
    }

    public Instant dayEnd(LocalDate date) {
        return dayStart(date.plusDays(1));
    }

    private LocalTime cutoffTime() {
        return LocalTime.of(dayCutoffMinutes / 60, dayCutoffMinutes % 60);
    }
}
