package com.shelterops.availability;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

/**
 * One volunteer's schedule resolved for a single target date:
 * the recurring windows of that weekday plus the exception for that exact date, if any.
 */
public final class VolunteerDay {

    private final String volunteerId;
    private final List<ScheduleWindow> windows;
    private final DateException exception;

    private VolunteerDay(String volunteerId, List<ScheduleWindow> windows, DateException exception) {
        this.volunteerId = volunteerId;
        this.windows = windows;
        this.exception = exception;
    }

    public static VolunteerDay resolve(VolunteerSchedule schedule, LocalDate date) {
        DayOfWeek day = TimeUtils.dayOfWeek(date);
        List<ScheduleWindow> windows = schedule.weeklyWindows().stream()
                .filter(w -> w.day() == day)
                .toList();
        return new VolunteerDay(schedule.volunteerId(), windows, schedule.exceptions().get(date));
    }

    public String getVolunteerId() { return volunteerId; }
    public List<ScheduleWindow> getWindows() { return windows; }
    public DateException getException() { return exception; }

    public boolean hasSchedule() {
        return !windows.isEmpty();
    }

    /** Blocked all day: explicit unavailability, or nothing scheduled and nothing overriding. */
    public boolean isFullyBlocked() {
        if (exception != null && exception.kind() == ExceptionKind.UNAVAILABLE) return true;
        return !hasSchedule() && exception == null;
    }

    public boolean usesModifiedHours() {
        return exception != null && exception.hasModifiedHours();
    }

    /** Inside the recurring windows, or inside the modified hours when those replace them. */
    public boolean isWithinSchedule(int minute) {
        if (usesModifiedHours()) {
            return minute >= exception.startMinute() && minute < exception.endMinute();
        }
        for (ScheduleWindow w : windows) {
            if (w.covers(minute)) return true;
        }
        return false;
    }

    public boolean isBlockedByException(int minute) {
        return exception != null && exception.blocks(minute);
    }

    public boolean isAvailableAt(int minute) {
        return isWithinSchedule(minute) && !isBlockedByException(minute);
    }
}
