package com.shelterops.controller;

import com.shelterops.dto.AvailabilityRequest;
import com.shelterops.dto.AvailabilityResponse;
import com.shelterops.service.AvailabilityService;
import jakarta.validation.Valid;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/availability")
public class AvailabilityController {

    private final AvailabilityService availabilityService;

    public AvailabilityController(AvailabilityService availabilityService) {
        this.availabilityService = availabilityService;
    }

    // Bookable windows for an adoption visit on one date
    @PostMapping
    public AvailabilityResponse availableTimeSlots(@Valid @RequestBody AvailabilityRequest request,
                                                   Authentication authentication) {
        return availabilityService.getAvailableTimeSlots(authentication.getName(), request);
    }
}
