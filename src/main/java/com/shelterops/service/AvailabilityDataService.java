package com.shelterops.service;

import com.shelterops.availability.AppointmentConflict;
import com.shelterops.availability.DateException;
import com.shelterops.availability.ExceptionKind;
import com.shelterops.availability.PetBlackout;
import com.shelterops.availability.PetProfile;
import com.shelterops.availability.ScheduleWindow;
import com.shelterops.availability.TimeUtils;
import com.shelterops.availability.VolunteerSchedule;
import com.shelterops.exception.DependencyException;
import com.shelterops.model.Booking;
import com.shelterops.model.Pet;
import com.shelterops.model.PetException;
import com.shelterops.model.ScheduleException;
import com.shelterops.model.TeamMember;
import com.shelterops.model.WorkScheduleEntry;
import com.shelterops.repository.BookingRepository;
import com.shelterops.repository.PetRepository;
import com.shelterops.repository.TeamMemberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only access to volunteers, pets and bookings, returned as validated engine records.
 * Loosely shaped stored data is checked here so the engine never sees it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AvailabilityDataService {

    private final TeamMemberRepository teamMemberRepository;
    private final PetRepository petRepository;
    private final BookingRepository bookingRepository;

    /** Empty when the volunteer does not exist or belongs to another organization. */
    public Optional<VolunteerSchedule> findVolunteerSchedule(String orgId, String volunteerId) {
        Optional<TeamMember> member;
        try {
            member = teamMemberRepository.findByIdAndOrgId(volunteerId, orgId);
        } catch (DataAccessException e) {
            throw new DependencyException("Failed to load volunteer " + volunteerId, e);
        }
        return member.map(this::toSchedule);
    }

    /** Empty when there is no record for the pet, which means no restrictions. */
    public Optional<PetProfile> findPetProfile(String orgId, Long catId) {
        Optional<Pet> pet;
        try {
            pet = petRepository.findByCatIdAndOrgId(catId, orgId);
        } catch (DataAccessException e) {
            throw new DependencyException("Failed to load pet " + catId, e);
        }
        return pet.map(this::toProfile);
    }

    public List<AppointmentConflict> findVolunteerConflicts(String orgId, String volunteerId,
                                                            LocalDate date, ZoneId zone) {
        try {
            return toConflicts(bookingRepository
                    .findByOrgIdAndTeamMemberIdAndStartTsGreaterThanEqualAndStartTsLessThanAndStatusIn(
                            orgId, volunteerId,
                            TimeUtils.startOfDay(date, zone), TimeUtils.startOfDay(date.plusDays(1), zone),
                            Booking.ACTIVE_STATUSES));
        } catch (DataAccessException e) {
            throw new DependencyException("Failed to load bookings of volunteer " + volunteerId, e);
        }
    }

    public List<AppointmentConflict> findPetConflicts(String orgId, Long catId, LocalDate date, ZoneId zone) {
        try {
            return toConflicts(bookingRepository
                    .findByOrgIdAndCatIdAndStartTsGreaterThanEqualAndStartTsLessThanAndStatusIn(
                            orgId, catId,
                            TimeUtils.startOfDay(date, zone), TimeUtils.startOfDay(date.plusDays(1), zone),
                            Booking.ACTIVE_STATUSES));
        } catch (DataAccessException e) {
            throw new DependencyException("Failed to load bookings of pet " + catId, e);
        }
    }

    // ---------- entity -> engine records ----------

    VolunteerSchedule toSchedule(TeamMember member) {
        List<ScheduleWindow> windows = new ArrayList<>();
        for (WorkScheduleEntry entry : nullSafe(member.getWorkSchedule())) {
            Optional<DayOfWeek> day = parseDay(entry.getDay(), "volunteer " + member.getId());
            if (day.isEmpty()) continue;

            int start = TimeUtils.timeToMinutes(entry.getStartTime());
            int end = TimeUtils.timeToMinutes(entry.getEndTime());
            if (start >= end) {
                log.warn("Dropping empty work window {} {}-{} of volunteer {}",
                        entry.getDay(), entry.getStartTime(), entry.getEndTime(), member.getId());
                continue;
            }
            windows.add(new ScheduleWindow(day.get(), start, end));
        }

        Map<LocalDate, DateException> exceptions = new LinkedHashMap<>();
        for (ScheduleException stored : nullSafe(member.getScheduleExceptions())) {
            toDateException(stored, member.getId()).ifPresent(ex -> {
                if (exceptions.containsKey(ex.date())) {
                    log.warn("Volunteer {} has more than one exception on {}, keeping the first",
                            member.getId(), ex.date());
                } else {
                    exceptions.put(ex.date(), ex);
                }
            });
        }

        return new VolunteerSchedule(member.getId(), windows, exceptions);
    }

    private Optional<DateException> toDateException(ScheduleException stored, String volunteerId) {
        Optional<ExceptionKind> kind = ExceptionKind.fromValue(stored.getType());
        if (kind.isEmpty()) {
            log.warn("Dropping exception of volunteer {} with unknown type '{}'", volunteerId, stored.getType());
            return Optional.empty();
        }

        LocalDate date;
        try {
            date = LocalDate.parse(Objects.requireNonNullElse(stored.getDate(), "").trim());
        } catch (DateTimeParseException e) {
            log.warn("Dropping exception of volunteer {} with bad date '{}'", volunteerId, stored.getDate());
            return Optional.empty();
        }

        Integer start = isBlank(stored.getStartTime()) ? null : TimeUtils.timeToMinutes(stored.getStartTime());
        Integer end = isBlank(stored.getEndTime()) ? null : TimeUtils.timeToMinutes(stored.getEndTime());
        return Optional.of(new DateException(date, kind.get(), start, end));
    }

    PetProfile toProfile(Pet pet) {
        List<PetBlackout> blackouts = new ArrayList<>();
        for (PetException ex : nullSafe(pet.getExceptions())) {
            Optional<DayOfWeek> day = parseDay(ex.getDay(), "pet " + pet.getCatId());
            if (day.isEmpty()) continue;

            int start = TimeUtils.timeToMinutes(ex.getStartTime());
            int end = TimeUtils.timeToMinutes(ex.getEndTime());
            if (start >= end) {
                log.warn("Dropping empty blackout {} {}-{} of pet {}",
                        ex.getDay(), ex.getStartTime(), ex.getEndTime(), pet.getCatId());
                continue;
            }
            blackouts.add(new PetBlackout(day.get(), start, end, ex.getReason()));
        }

        var allowList = new LinkedHashSet<String>();
        for (String id : nullSafe(pet.getAssignedVolunteers())) {
            if (!isBlank(id)) allowList.add(id.trim());
        }
        return new PetProfile(pet.getCatId(), allowList, blackouts);
    }

    private List<AppointmentConflict> toConflicts(List<Booking> bookings) {
        return bookings.stream()
                .filter(b -> b.getStartTs() != null && b.getEndTs() != null)
                .map(b -> new AppointmentConflict(b.getTeamMemberId(), b.getCatId(), b.getStartTs(), b.getEndTs()))
                .toList();
    }

    // ---------- helpers ----------

    private Optional<DayOfWeek> parseDay(String day, String owner) {
        try {
            return Optional.of(TimeUtils.parseDay(day));
        } catch (IllegalArgumentException e) {
            log.warn("Dropping entry of {} with unknown day '{}'", owner, day);
            return Optional.empty();
        }
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
