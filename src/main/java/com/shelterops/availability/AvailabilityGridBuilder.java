package com.shelterops.availability;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Accumulates busy counts for one target date.
 * <p>
 * Every volunteer adds at most one to a minute, whatever the number of reasons it is blocked for.
 * Pet-wide blocks (weekly blackouts and appointments on the pet) add the full head count,
 * so they hold for everyone at once. They are applied in {@link #build()} once the head count is known.
 */
public class AvailabilityGridBuilder {

    private static final int DAY = TimeUtils.MINUTES_PER_DAY;

    private final LocalDate date;
    private final ZoneId zone;
    private final int[] busy = new int[DAY];
    private final List<int[]> petBlockedRanges = new ArrayList<>();
    private int headCount;

    public AvailabilityGridBuilder(LocalDate date, ZoneId zone) {
        this.date = date;
        this.zone = zone;
    }

    /**
     * @param conflicts active appointments assigned to this volunteer on the target date
     */
    public AvailabilityGridBuilder addVolunteer(VolunteerDay volunteer, List<AppointmentConflict> conflicts) {
        boolean[] blocked = blockedMinutes(volunteer, conflicts);
        for (int m = 0; m < DAY; m++) {
            if (blocked[m]) busy[m]++;
        }
        headCount++;
        return this;
    }

    public AvailabilityGridBuilder addPetBlackouts(List<PetBlackout> blackouts) {
        DayOfWeek day = TimeUtils.dayOfWeek(date);
        for (PetBlackout b : blackouts) {
            if (b.day() == day) {
                petBlockedRanges.add(new int[]{
                        TimeUtils.clamp(b.startMinute(), 0, DAY),
                        TimeUtils.clamp(b.endMinute(), 0, DAY)});
            }
        }
        return this;
    }

    /**
     * @param conflicts active appointments on the pet, with any volunteer
     */
    public AvailabilityGridBuilder addPetAppointments(List<AppointmentConflict> conflicts) {
        for (AppointmentConflict c : conflicts) {
            petBlockedRanges.add(minuteRange(c));
        }
        return this;
    }

    public AvailabilityGrid build() {
        int[] counts = Arrays.copyOf(busy, DAY);
        for (int[] range : petBlockedRanges) {
            for (int m = range[0]; m < range[1]; m++) {
                counts[m] += headCount;
            }
        }
        return new AvailabilityGrid(counts, headCount);
    }

    boolean[] blockedMinutes(VolunteerDay volunteer, List<AppointmentConflict> conflicts) {
        boolean[] blocked = new boolean[DAY];

        if (volunteer.isFullyBlocked()) {
            Arrays.fill(blocked, true);
            return blocked;
        }

        if (volunteer.usesModifiedHours()) {
            DateException ex = volunteer.getException();
            for (int m = 0; m < DAY; m++) {
                blocked[m] = m < ex.startMinute() || m >= ex.endMinute();
            }
        } else {
            for (int m = 0; m < DAY; m++) {
                blocked[m] = !volunteer.isWithinSchedule(m);
            }
        }

        for (AppointmentConflict c : conflicts) {
            int[] range = minuteRange(c);
            for (int m = range[0]; m < range[1]; m++) {
                blocked[m] = true;
            }
        }

        // second pass, only for minutes still open
        if (volunteer.getException() != null) {
            for (int m = 0; m < DAY; m++) {
                if (!blocked[m] && volunteer.isBlockedByException(m)) {
                    blocked[m] = true;
                }
            }
        }
        return blocked;
    }

    private int[] minuteRange(AppointmentConflict c) {
        int start = TimeUtils.clamp(TimeUtils.minuteOfDay(c.start(), zone, date), 0, DAY - 1);
        int end = TimeUtils.clamp(TimeUtils.minuteOfDay(c.end(), zone, date), 0, DAY);
        if (end < start) {
            // wall clock went back inside the booking (fall-back hour): block its elapsed length
            long elapsed = Duration.between(c.start(), c.end()).toMinutes();
            end = (int) Math.min(DAY, start + Math.max(0, elapsed));
        }
        return new int[]{start, end};
    }
}
