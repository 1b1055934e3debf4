package com.shelterops.availability;

import java.time.DayOfWeek;

// half-open [startMinute, endMinute)
public record ScheduleWindow(DayOfWeek day, int startMinute, int endMinute) {

    public boolean covers(int minute) {
        return minute >= startMinute && minute < endMinute;
    }
}
