package com.shelterops.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AvailabilityResponse {

    @Builder.Default
    private final boolean success = true;

    @Builder.Default
    private final List<TimeSlotDto> slots = List.of();

    private final String date; // yyyy-MM-dd

    private final int totalEligibleVolunteers;

    // volunteer records actually found; missing ones are skipped
    private final int volunteersResolved;

    // explains an empty result that is not an error
    private final String note;
}
