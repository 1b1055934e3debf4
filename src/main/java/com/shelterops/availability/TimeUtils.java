package com.shelterops.availability;

import com.shelterops.exception.InvalidArgumentException;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions between wall-clock values and the minute-of-day domain [0, 1440).
 */
public final class TimeUtils {

    public static final int MINUTES_PER_DAY = 1440;

    private static final Pattern HH_MM = Pattern.compile("^(\\d{1,2}):(\\d{2})$");

    private TimeUtils() {
    }

    /**
     * Parses "HH:MM" into minutes since midnight. "24:00" is accepted as the end-of-day bound.
     */
    public static int timeToMinutes(String time) {
        if (time == null) {
            throw new MalformedTimeException("Time of day is missing");
        }
        Matcher m = HH_MM.matcher(time.trim());
        if (!m.matches()) {
            throw new MalformedTimeException("Time of day must be HH:MM, got '" + time + "'");
        }
        int hours = Integer.parseInt(m.group(1));
        int minutes = Integer.parseInt(m.group(2));

        if (hours == 24 && minutes == 0) return MINUTES_PER_DAY;
        if (hours > 23 || minutes > 59) {
            throw new MalformedTimeException("Time of day out of range: '" + time + "'");
        }
        return hours * 60 + minutes;
    }

    public static String minutesToTime(int minutes) {
        if (minutes < 0 || minutes > MINUTES_PER_DAY) {
            throw new IllegalArgumentException("Minute of day out of range: " + minutes);
        }
        return String.format("%02d:%02d", minutes / 60, minutes % 60);
    }

    public static DayOfWeek dayOfWeek(LocalDate date) {
        return date.getDayOfWeek();
    }

    public static DayOfWeek parseDay(String day) {
        if (day == null || day.isBlank()) {
            throw new IllegalArgumentException("Day of week is missing");
        }
        return DayOfWeek.valueOf(day.trim().toUpperCase(Locale.ROOT));
    }

    public static String formatDate(LocalDate date) {
        return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    public static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidArgumentException("targetDate is required");
        }
        try {
            return LocalDate.parse(value.trim(), DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            throw new InvalidArgumentException("targetDate must be yyyy-MM-dd, got '" + value + "'", e);
        }
    }

    /**
     * Wall-clock minute of {@code instant} in {@code zone}, relative to {@code date}.
     * Instants falling on an earlier local date map to 0, on a later one to 1440.
     */
    public static int minuteOfDay(Instant instant, ZoneId zone, LocalDate date) {
        ZonedDateTime local = instant.atZone(zone);
        LocalDate localDate = local.toLocalDate();
        if (localDate.isBefore(date)) return 0;
        if (localDate.isAfter(date)) return MINUTES_PER_DAY;
        return local.getHour() * 60 + local.getMinute();
    }

    public static Instant startOfDay(LocalDate date, ZoneId zone) {
        return date.atStartOfDay(zone).toInstant();
    }

    public static int clamp(int minute, int min, int max) {
        return Math.max(min, Math.min(max, minute));
    }
}
