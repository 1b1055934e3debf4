package com.shelterops.availability;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Picks the minutes at which at least one volunteer can take a visit.
 * <p>
 * The busy count alone cannot tell "every volunteer blocked for a different reason" from
 * "somebody is free", so a minute that passes the count check is confirmed against the
 * volunteers' own schedules before it is accepted.
 */
public final class FreeMinuteSelector {

    private FreeMinuteSelector() {
    }

    // ascending
    public static int[] select(AvailabilityGrid grid, List<VolunteerDay> volunteers) {
        return IntStream.range(0, TimeUtils.MINUTES_PER_DAY)
                .filter(m -> !grid.isSaturatedAt(m))
                .filter(m -> volunteers.stream().anyMatch(v -> v.isAvailableAt(m)))
                .toArray();
    }
}
