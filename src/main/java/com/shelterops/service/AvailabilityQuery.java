package com.shelterops.service;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

public record AvailabilityQuery(List<String> volunteerIds,
                                Long catId,
                                LocalDate date,
                                int durationMinutes,
                                ZoneId zone) {

    public AvailabilityQuery {
        volunteerIds = List.copyOf(volunteerIds);
    }
}
