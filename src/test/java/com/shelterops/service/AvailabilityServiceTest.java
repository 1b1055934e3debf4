package com.shelterops.service;

import com.shelterops.availability.AppointmentConflict;
import com.shelterops.availability.DateException;
import com.shelterops.availability.EligibilityFilter;
import com.shelterops.availability.PetBlackout;
import com.shelterops.availability.PetProfile;
import com.shelterops.availability.ScheduleWindow;
import com.shelterops.availability.TimeUtils;
import com.shelterops.availability.VolunteerSchedule;
import com.shelterops.dto.AvailabilityRequest;
import com.shelterops.dto.AvailabilityResponse;
import com.shelterops.dto.TimeSlotDto;
import com.shelterops.exception.InvalidArgumentException;
import com.shelterops.exception.OrganizationNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AvailabilityServiceTest {

    private static final String ORG = "org-1";
    private static final ZoneId ZONE = ZoneId.of("America/New_York");
    private static final LocalDate MONDAY = LocalDate.of(2025, 10, 20);

    private AvailabilityDataService dataService;
    private OrganizationContextService organizationContextService;
    private AvailabilityService service;

    @BeforeEach
    void setUp() {
        dataService = Mockito.mock(AvailabilityDataService.class);
        organizationContextService = Mockito.mock(OrganizationContextService.class);
        service = new AvailabilityService(dataService, organizationContextService, ZONE, 60);

        // Defaults: nobody exists, nothing booked, no pet record
        when(dataService.findVolunteerSchedule(anyString(), anyString())).thenReturn(Optional.empty());
        when(dataService.findVolunteerConflicts(anyString(), anyString(), any(LocalDate.class), any(ZoneId.class)))
                .thenReturn(List.of());
        when(dataService.findPetConflicts(anyString(), anyLong(), any(LocalDate.class), any(ZoneId.class)))
                .thenReturn(List.of());
        when(dataService.findPetProfile(anyString(), anyLong())).thenReturn(Optional.empty());
        when(organizationContextService.resolveOrgId("volunteer@shelter.org")).thenReturn(ORG);
    }

    // ---------- helpers ----------

    private void volunteer(String id, List<ScheduleWindow> windows, Map<LocalDate, DateException> exceptions) {
        when(dataService.findVolunteerSchedule(ORG, id))
                .thenReturn(Optional.of(new VolunteerSchedule(id, windows, exceptions)));
    }

    private ScheduleWindow monday(int startHour, int endHour) {
        return new ScheduleWindow(DayOfWeek.MONDAY, startHour * 60, endHour * 60);
    }

    private Instant at(int hour) {
        return ZonedDateTime.of(2025, 10, 20, hour, 0, 0, 0, ZONE).toInstant();
    }

    private AvailabilityQuery query(List<String> ids, Long catId, int duration) {
        return new AvailabilityQuery(ids, catId, MONDAY, duration, ZONE);
    }

    private static List<String> starts(AvailabilityResponse r) {
        return r.getSlots().stream().map(TimeSlotDto::getStart).toList();
    }

    private static List<String> ends(AvailabilityResponse r) {
        return r.getSlots().stream().map(TimeSlotDto::getEnd).toList();
    }

    // ---------- scenarios ----------

    @Test
    void singleVolunteerWorkingMonday_getsOneFullSlot() {
        volunteer("a", List.of(monday(9, 17)), Map.of());

        AvailabilityResponse r = service.computeAvailability(ORG, query(List.of("a"), null, 60));

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.getSlots()).hasSize(1);
        assertThat(r.getSlots().get(0).getStart()).isEqualTo("09:00");
        assertThat(r.getSlots().get(0).getEnd()).isEqualTo("17:00");
        assertThat(r.getSlots().get(0).getDurationMinutes()).isEqualTo(480);
        assertThat(r.getDate()).isEqualTo("2025-10-20");
        assertThat(r.getTotalEligibleVolunteers()).isEqualTo(1);
        assertThat(r.getVolunteersResolved()).isEqualTo(1);
        assertThat(r.getNote()).isNull();
    }

    @Test
    void activeAppointment_splitsTheDay() {
        volunteer("a", List.of(monday(9, 17)), Map.of());
        when(dataService.findVolunteerConflicts(ORG, "a", MONDAY, ZONE))
                .thenReturn(List.of(new AppointmentConflict("a", null, at(12), at(13))));

        AvailabilityResponse r = service.computeAvailability(ORG, query(List.of("a"), null, 60));

        assertThat(starts(r)).containsExactly("09:00", "13:00");
        assertThat(ends(r)).containsExactly("12:00", "17:00");
    }

    @Test
    void twoVolunteers_giveTheUnionOfTheirHours() {
        volunteer("a", List.of(monday(9, 12)), Map.of());
        volunteer("b", List.of(monday(13, 17)), Map.of());

        AvailabilityResponse r = service.computeAvailability(ORG, query(List.of("a", "b"), null, 60));

        assertThat(starts(r)).containsExactly("09:00", "13:00");
        assertThat(ends(r)).containsExactly("12:00", "17:00");
        assertThat(r.getTotalEligibleVolunteers()).isEqualTo(2);
    }

    @Test
    void overlappingVolunteers_mergeIntoOneRun() {
        volunteer("a", List.of(monday(9, 13)), Map.of());
        volunteer("b", List.of(monday(12, 17)), Map.of());
        when(dataService.findVolunteerConflicts(ORG, "a", MONDAY, ZONE))
                .thenReturn(List.of(new AppointmentConflict("a", null, at(12), at(13))));

        AvailabilityResponse r = service.computeAvailability(ORG, query(List.of("a", "b"), null, 60));

        // b covers a's booked hour
        assertThat(starts(r)).containsExactly("09:00");
        assertThat(ends(r)).containsExactly("17:00");
    }

    @Test
    void durationLongerThanEveryRun_givesNoSlots() {
        volunteer("a", List.of(monday(9, 12)), Map.of());
        volunteer("b", List.of(monday(13, 17)), Map.of());

        AvailabilityResponse r = service.computeAvailability(ORG, query(List.of("a", "b"), null, 300));

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.getSlots()).isEmpty();
    }

    @Test
    void noScheduleAndNoException_meansUnavailable() {
        volunteer("a", List.of(new ScheduleWindow(DayOfWeek.TUESDAY, 540, 1020)), Map.of());

        AvailabilityResponse r = service.computeAvailability(ORG, query(List.of("a"), null, 60));

        assertThat(r.getSlots()).isEmpty();
        assertThat(r.getVolunteersResolved()).isEqualTo(1);
    }

    @Test
    void unavailableException_overridesRecurringSchedule() {
        volunteer("a", List.of(monday(9, 17)), Map.of(MONDAY, DateException.unavailable(MONDAY)));

        AvailabilityResponse r = service.computeAvailability(ORG, query(List.of("a"), null, 60));

        assertThat(r.getSlots()).isEmpty();
    }

    @Test
    void unavailableVolunteer_doesNotHideAnotherVolunteer() {
        volunteer("a", List.of(monday(9, 17)), Map.of(MONDAY, DateException.unavailable(MONDAY)));
        volunteer("b", List.of(monday(14, 16)), Map.of());

        AvailabilityResponse r = service.computeAvailability(ORG, query(List.of("a", "b"), null, 60));

        assertThat(starts(r)).containsExactly("14:00");
        assertThat(ends(r)).containsExactly("16:00");
    }

    @Test
    void modifiedException_restrictsToModifiedHours() {
        volunteer("a", List.of(monday(9, 17)), Map.of(MONDAY, DateException.modified(MONDAY, 600, 720)));
        volunteer("b", List.of(monday(13, 17)), Map.of());

        AvailabilityResponse r = service.computeAvailability(ORG, query(List.of("a", "b"), null, 60));

        assertThat(starts(r)).containsExactly("10:00", "13:00");
        assertThat(ends(r)).containsExactly("12:00", "17:00");
    }

    @Test
    void petBlackout_keepsSlotsOutsideTheBlackout() {
        volunteer("a", List.of(monday(9, 17)), Map.of());
        when(dataService.findPetProfile(ORG, 42L)).thenReturn(Optional.of(new PetProfile(42L, Set.of(),
                List.of(new PetBlackout(DayOfWeek.MONDAY, 600, 660, "feeding")))));

        AvailabilityResponse r = service.computeAvailability(ORG, query(List.of("a"), 42L, 30));

        assertThat(starts(r)).containsExactly("09:00", "11:00");
        assertThat(ends(r)).containsExactly("10:00", "17:00");
    }

    @Test
    void petAppointment_blocksEveryVolunteer() {
        volunteer("a", List.of(monday(9, 17)), Map.of());
        volunteer("b", List.of(monday(9, 17)), Map.of());
        when(dataService.findPetConflicts(ORG, 42L, MONDAY, ZONE))
                .thenReturn(List.of(new AppointmentConflict("c", 42L, at(14), at(15))));

        AvailabilityResponse r = service.computeAvailability(ORG, query(List.of("a", "b"), 42L, 60));

        assertThat(starts(r)).containsExactly("09:00", "15:00");
        assertThat(ends(r)).containsExactly("14:00", "17:00");
    }

    @Test
    void allowListExcludingEveryone_isAnEmptySuccessWithNote() {
        when(dataService.findPetProfile(ORG, 42L))
                .thenReturn(Optional.of(new PetProfile(42L, Set.of("z"), List.of())));

        AvailabilityResponse r = service.computeAvailability(ORG, query(List.of("a", "b"), 42L, 60));

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.getSlots()).isEmpty();
        assertThat(r.getTotalEligibleVolunteers()).isZero();
        assertThat(r.getNote()).isEqualTo(EligibilityFilter.NO_SUITABLE_VOLUNTEERS);
        verify(dataService, never()).findVolunteerSchedule(anyString(), anyString());
    }

    @Test
    void allowList_limitsWhoseHoursCount() {
        volunteer("a", List.of(monday(9, 12)), Map.of());
        volunteer("b", List.of(monday(13, 17)), Map.of());
        when(dataService.findPetProfile(ORG, 42L))
                .thenReturn(Optional.of(new PetProfile(42L, Set.of("b"), List.of())));

        AvailabilityResponse r = service.computeAvailability(ORG, query(List.of("a", "b"), 42L, 60));

        assertThat(starts(r)).containsExactly("13:00");
        assertThat(r.getTotalEligibleVolunteers()).isEqualTo(1);
        verify(dataService, never()).findVolunteerSchedule(ORG, "a");
    }

    @Test
    void missingVolunteer_isSkipped_andBookingsOfTheOthersStillCount() {
        volunteer("a", List.of(monday(9, 17)), Map.of());
        when(dataService.findVolunteerConflicts(ORG, "a", MONDAY, ZONE))
                .thenReturn(List.of(new AppointmentConflict("a", null, at(12), at(13))));

        AvailabilityResponse r = service.computeAvailability(ORG, query(List.of("a", "ghost"), null, 60));

        assertThat(r.getTotalEligibleVolunteers()).isEqualTo(2);
        assertThat(r.getVolunteersResolved()).isEqualTo(1);
        assertThat(starts(r)).containsExactly("09:00", "13:00");
    }

    @Test
    void noVolunteerFound_isAnEmptySuccessWithNote() {
        AvailabilityResponse r = service.computeAvailability(ORG, query(List.of("ghost"), null, 60));

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.getSlots()).isEmpty();
        assertThat(r.getVolunteersResolved()).isZero();
        assertThat(r.getNote()).isEqualTo(AvailabilityService.NO_VOLUNTEERS_FOUND);
    }

    @Test
    void everySlotIsLongEnough_sortedAndDisjoint() {
        volunteer("a", List.of(monday(8, 11), monday(10, 12), monday(15, 16)), Map.of());
        volunteer("b", List.of(monday(13, 14), monday(18, 22)), Map.of());
        when(dataService.findVolunteerConflicts(ORG, "b", MONDAY, ZONE))
                .thenReturn(List.of(new AppointmentConflict("b", null, at(19), at(20))));

        AvailabilityResponse r = service.computeAvailability(ORG, query(List.of("a", "b"), null, 45));

        int previousEnd = -1;
        for (TimeSlotDto slot : r.getSlots()) {
            int start = toMinutes(slot.getStart());
            int end = toMinutes(slot.getEnd());
            assertThat(end - start).isEqualTo(slot.getDurationMinutes());
            assertThat(slot.getDurationMinutes()).isGreaterThanOrEqualTo(45);
            assertThat(start).isGreaterThan(previousEnd);
            previousEnd = end;
        }
        assertThat(starts(r)).containsExactly("08:00", "13:00", "15:00", "18:00", "20:00");
    }

    private static int toMinutes(String hhmm) {
        return TimeUtils.timeToMinutes(hhmm);
    }

    // ---------- request handling ----------

    @Test
    void request_usesDefaultDurationAndZone() {
        volunteer("a", List.of(monday(9, 10)), Map.of());
        AvailabilityRequest request = new AvailabilityRequest(List.of("a"), null, "2025-10-20", null, null);

        AvailabilityResponse r = service.getAvailableTimeSlots("volunteer@shelter.org", request);

        assertThat(starts(r)).containsExactly("09:00");
        verify(dataService).findVolunteerConflicts(ORG, "a", MONDAY, ZONE);
    }

    @Test
    void request_zeroDuration_fallsBackToDefault() {
        volunteer("a", List.of(monday(9, 10)), Map.of());
        AvailabilityRequest request = new AvailabilityRequest(List.of("a"), null, "2025-10-20", 0, null);

        assertThat(service.toQuery(request).durationMinutes()).isEqualTo(60);
        AvailabilityResponse r = service.getAvailableTimeSlots("volunteer@shelter.org", request);
        assertThat(r.getSlots()).extracting(TimeSlotDto::getDurationMinutes).containsExactly(60);
    }

    @Test
    void request_timezoneIsUsedToReadAppointments() {
        volunteer("a", List.of(monday(9, 17)), Map.of());
        ZoneId utc = ZoneId.of("UTC");
        // 12:00 in New York is 16:00 UTC
        when(dataService.findVolunteerConflicts(ORG, "a", MONDAY, utc))
                .thenReturn(List.of(new AppointmentConflict("a", null, at(12), at(13))));
        AvailabilityRequest request = new AvailabilityRequest(List.of("a"), null, "2025-10-20", 60, "UTC");

        AvailabilityResponse r = service.getAvailableTimeSlots("volunteer@shelter.org", request);

        // read in UTC the booking covers 16:00-17:00, the end of the shift
        assertThat(starts(r)).containsExactly("09:00");
        assertThat(ends(r)).containsExactly("16:00");
    }

    @Test
    void request_withoutVolunteers_isInvalid() {
        AvailabilityRequest request = new AvailabilityRequest(List.of(), null, "2025-10-20", 60, null);

        assertThatThrownBy(() -> service.getAvailableTimeSlots("volunteer@shelter.org", request))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("volunteerIds");
        verifyNoInteractions(organizationContextService);
    }

    @Test
    void request_withoutOrUnparseableDate_isInvalid() {
        assertThatThrownBy(() -> service.getAvailableTimeSlots("volunteer@shelter.org",
                new AvailabilityRequest(List.of("a"), null, null, 60, null)))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("targetDate");
        assertThatThrownBy(() -> service.getAvailableTimeSlots("volunteer@shelter.org",
                new AvailabilityRequest(List.of("a"), null, "next monday", 60, null)))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void request_withBadDurationOrZone_isInvalid() {
        assertThatThrownBy(() -> service.getAvailableTimeSlots("volunteer@shelter.org",
                new AvailabilityRequest(List.of("a"), null, "2025-10-20", -30, null)))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> service.getAvailableTimeSlots("volunteer@shelter.org",
                new AvailabilityRequest(List.of("a"), null, "2025-10-20", 1441, null)))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> service.getAvailableTimeSlots("volunteer@shelter.org",
                new AvailabilityRequest(List.of("a"), null, "2025-10-20", 60, "Mars/Olympus")))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("timezone");
    }

    @Test
    void request_propagatesOrganizationFailures() {
        when(organizationContextService.resolveOrgId("stranger@nowhere.org"))
                .thenThrow(new OrganizationNotFoundException("User not found"));

        assertThatThrownBy(() -> service.getAvailableTimeSlots("stranger@nowhere.org",
                new AvailabilityRequest(List.of("a"), null, "2025-10-20", 60, null)))
                .isInstanceOf(OrganizationNotFoundException.class);
        verify(dataService, never()).findVolunteerSchedule(anyString(), eq("a"));
    }
}
