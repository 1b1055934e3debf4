package com.shelterops.availability;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Everything known about one volunteer's availability, already validated.
 * At most one exception exists per date.
 */
public record VolunteerSchedule(String volunteerId,
                                List<ScheduleWindow> weeklyWindows,
                                Map<LocalDate, DateException> exceptions) {

    public VolunteerSchedule {
        weeklyWindows = List.copyOf(weeklyWindows);
        exceptions = Map.copyOf(exceptions);
    }
}
