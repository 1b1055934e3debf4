package com.shelterops.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Stored shape of a date-specific override.
 * type: "unavailable", "available" or "modified"; the times are only used by "modified".
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleException {
    private String date; // yyyy-MM-dd
    private String type;
    private String startTime;
    private String endTime;
}
