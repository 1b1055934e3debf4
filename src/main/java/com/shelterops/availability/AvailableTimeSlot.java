package com.shelterops.availability;

/**
 * A bookable window [startMinute, endMinute) on the target date.
 */
public record AvailableTimeSlot(int startMinute, int endMinute, int durationMinutes) {

    public AvailableTimeSlot {
        if (startMinute < 0 || endMinute > TimeUtils.MINUTES_PER_DAY || endMinute <= startMinute) {
            throw new IllegalArgumentException("Invalid slot [" + startMinute + ", " + endMinute + ")");
        }
        if (durationMinutes != endMinute - startMinute) {
            throw new IllegalArgumentException("Duration " + durationMinutes + " does not match slot bounds");
        }
    }

    public static AvailableTimeSlot of(int startMinute, int endMinute) {
        return new AvailableTimeSlot(startMinute, endMinute, endMinute - startMinute);
    }

    public String start() {
        return TimeUtils.minutesToTime(startMinute);
    }

    public String end() {
        return TimeUtils.minutesToTime(endMinute);
    }
}
