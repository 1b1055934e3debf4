package com.shelterops.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Body of POST /api/availability.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilityRequest {

    @NotEmpty(message = "volunteerIds is required and must be a non-empty array")
    private List<String> volunteerIds;

    // optional; restricts volunteers and adds the pet's own blocks
    private Long catId;

    @NotBlank(message = "targetDate is required")
    private String targetDate; // yyyy-MM-dd

    private Integer durationMinutes; // default from availability.default-duration-minutes

    private String timezone; // default from app.business.zone
}
