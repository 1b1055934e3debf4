package com.shelterops.availability;

import java.time.LocalDate;

/**
 * A volunteer's one-off override for a single calendar date.
 * Bounds are only meaningful for {@link ExceptionKind#MODIFIED}.
 */
public record DateException(LocalDate date, ExceptionKind kind, Integer startMinute, Integer endMinute) {

    public static DateException unavailable(LocalDate date) {
        return new DateException(date, ExceptionKind.UNAVAILABLE, null, null);
    }

    public static DateException modified(LocalDate date, int startMinute, int endMinute) {
        return new DateException(date, ExceptionKind.MODIFIED, startMinute, endMinute);
    }

    public boolean hasModifiedHours() {
        return kind == ExceptionKind.MODIFIED && startMinute != null && endMinute != null;
    }

    public boolean blocks(int minute) {
        if (kind == ExceptionKind.UNAVAILABLE) return true;
        if (hasModifiedHours()) {
            return minute < startMinute || minute >= endMinute;
        }
        return false;
    }
}
