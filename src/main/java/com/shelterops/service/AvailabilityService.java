package com.shelterops.service;

import com.shelterops.availability.AvailabilityGrid;
import com.shelterops.availability.AvailabilityGridBuilder;
import com.shelterops.availability.AvailableTimeSlot;
import com.shelterops.availability.EligibilityFilter;
import com.shelterops.availability.EligibilityResult;
import com.shelterops.availability.FreeMinuteSelector;
import com.shelterops.availability.PetProfile;
import com.shelterops.availability.SlotGrouper;
import com.shelterops.availability.TimeUtils;
import com.shelterops.availability.VolunteerDay;
import com.shelterops.availability.VolunteerSchedule;
import com.shelterops.dto.AvailabilityRequest;
import com.shelterops.dto.AvailabilityResponse;
import com.shelterops.dto.TimeSlotDto;
import com.shelterops.exception.InvalidArgumentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Computes the windows in which an adoption visit of a given length can be booked on one date.
 * Read-only: nothing is written while availability is computed.
 */
@Slf4j
@Service
public class AvailabilityService {

    static final String NO_VOLUNTEERS_FOUND = "None of the requested volunteers were found";

    private final AvailabilityDataService dataService;
    private final OrganizationContextService organizationContextService;
    private final ZoneId businessZoneId;
    private final int defaultDurationMinutes;

    public AvailabilityService(AvailabilityDataService dataService,
                               OrganizationContextService organizationContextService,
                               ZoneId businessZoneId,
                               @Value("${availability.default-duration-minutes:60}") int defaultDurationMinutes) {
        this.dataService = dataService;
        this.organizationContextService = organizationContextService;
        this.businessZoneId = businessZoneId;
        this.defaultDurationMinutes = defaultDurationMinutes;
    }

    /** Entry point for an authenticated caller; input is checked before the organization is resolved. */
    public AvailabilityResponse getAvailableTimeSlots(String username, AvailabilityRequest request) {
        AvailabilityQuery query = toQuery(request);
        String orgId = organizationContextService.resolveOrgId(username);
        return computeAvailability(orgId, query);
    }

    public AvailabilityResponse computeAvailability(String orgId, AvailabilityQuery query) {
        String dateStr = TimeUtils.formatDate(query.date());
        log.info("Availability request org={} date={} volunteers={} catId={} duration={} zone={}",
                orgId, dateStr, query.volunteerIds().size(), query.catId(), query.durationMinutes(), query.zone());

        PetProfile pet = null;
        if (query.catId() != null) {
            pet = dataService.findPetProfile(orgId, query.catId()).orElse(null);
            if (pet == null) {
                log.debug("No record for pet {}, volunteers are unrestricted", query.catId());
            }
        }

        EligibilityResult eligibility = EligibilityFilter.filter(query.volunteerIds(), pet);
        if (eligibility.isEmpty()) {
            log.info("No eligible volunteers for pet {} on {}", query.catId(), dateStr);
            return AvailabilityResponse.builder()
                    .date(dateStr)
                    .totalEligibleVolunteers(0)
                    .volunteersResolved(0)
                    .note(eligibility.note())
                    .build();
        }

        AvailabilityGridBuilder gridBuilder = new AvailabilityGridBuilder(query.date(), query.zone());
        List<VolunteerDay> volunteerDays = new ArrayList<>();

        for (String volunteerId : eligibility.eligibleVolunteerIds()) {
            Optional<VolunteerSchedule> schedule = dataService.findVolunteerSchedule(orgId, volunteerId);
            if (schedule.isEmpty()) {
                log.warn("Volunteer {} not found in org {}, skipping", volunteerId, orgId);
                continue;
            }

            VolunteerDay day = VolunteerDay.resolve(schedule.get(), query.date());
            var conflicts = dataService.findVolunteerConflicts(orgId, volunteerId, query.date(), query.zone());
            log.debug("Volunteer {}: {} window(s), exception={}, {} active booking(s)",
                    volunteerId, day.getWindows().size(), day.getException(), conflicts.size());

            gridBuilder.addVolunteer(day, conflicts);
            volunteerDays.add(day);
        }

        if (pet != null) {
            gridBuilder.addPetBlackouts(pet.blackouts());
        }
        if (query.catId() != null) {
            gridBuilder.addPetAppointments(
                    dataService.findPetConflicts(orgId, query.catId(), query.date(), query.zone()));
        }

        AvailabilityGrid grid = gridBuilder.build();
        int[] freeMinutes = FreeMinuteSelector.select(grid, volunteerDays);
        List<AvailableTimeSlot> slots = SlotGrouper.group(freeMinutes, query.durationMinutes());

        log.info("Availability for org={} date={}: {} free minute(s), {} slot(s)",
                orgId, dateStr, freeMinutes.length, slots.size());

        return AvailabilityResponse.builder()
                .slots(slots.stream().map(TimeSlotDto::from).toList())
                .date(dateStr)
                .totalEligibleVolunteers(eligibility.size())
                .volunteersResolved(volunteerDays.size())
                .note(volunteerDays.isEmpty() ? NO_VOLUNTEERS_FOUND : null)
                .build();
    }

    AvailabilityQuery toQuery(AvailabilityRequest request) {
        if (request == null || request.getVolunteerIds() == null || request.getVolunteerIds().isEmpty()) {
            throw new InvalidArgumentException("volunteerIds is required and must be a non-empty array");
        }
        if (request.getVolunteerIds().stream().anyMatch(id -> id == null || id.isBlank())) {
            throw new InvalidArgumentException("volunteerIds must not contain blank ids");
        }
        List<String> ids = request.getVolunteerIds().stream().map(String::trim).toList();

        var date = TimeUtils.parseDate(request.getTargetDate());

        // absent or 0 both mean the configured default
        Integer requested = request.getDurationMinutes();
        int duration = requested == null || requested == 0 ? defaultDurationMinutes : requested;
        if (duration < 1 || duration > TimeUtils.MINUTES_PER_DAY) {
            throw new InvalidArgumentException("durationMinutes must be between 1 and 1440, got " + duration);
        }

        ZoneId zone = businessZoneId;
        if (request.getTimezone() != null && !request.getTimezone().isBlank()) {
            try {
                zone = ZoneId.of(request.getTimezone().trim());
            } catch (DateTimeException e) {
                throw new InvalidArgumentException("Unknown timezone '" + request.getTimezone() + "'", e);
            }
        }

        return new AvailabilityQuery(ids, request.getCatId(), date, duration, zone);
    }
}
