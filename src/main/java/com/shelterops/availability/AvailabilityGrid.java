package com.shelterops.availability;

import java.util.Arrays;

/**
 * Per-minute busy counts for one day, plus the number of volunteers the counts are measured against.
 */
public final class AvailabilityGrid {

    private final int[] busyCounts;
    private final int headCount;

    AvailabilityGrid(int[] busyCounts, int headCount) {
        if (busyCounts.length != TimeUtils.MINUTES_PER_DAY) {
            throw new IllegalArgumentException("Grid must have one cell per minute of the day");
        }
        this.busyCounts = Arrays.copyOf(busyCounts, busyCounts.length);
        this.headCount = headCount;
    }

    public int busyAt(int minute) {
        return busyCounts[minute];
    }

    public int getHeadCount() {
        return headCount;
    }

    public boolean isSaturatedAt(int minute) {
        return busyCounts[minute] >= headCount;
    }
}
