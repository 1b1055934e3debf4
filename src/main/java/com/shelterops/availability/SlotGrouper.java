package com.shelterops.availability;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges ascending free minutes into maximal runs and keeps runs of at least the requested length.
 */
public final class SlotGrouper {

    private SlotGrouper() {
    }

    public static List<AvailableTimeSlot> group(int[] freeMinutes, int durationMinutes) {
        List<AvailableTimeSlot> slots = new ArrayList<>();
        if (freeMinutes.length == 0) return slots;

        int runStart = freeMinutes[0];
        int runEnd = runStart + 1;

        for (int i = 1; i < freeMinutes.length; i++) {
            if (freeMinutes[i] == runEnd) {
                runEnd++;
            } else {
                addIfLongEnough(slots, runStart, runEnd, durationMinutes);
                runStart = freeMinutes[i];
                runEnd = runStart + 1;
            }
        }
        addIfLongEnough(slots, runStart, runEnd, durationMinutes);
        return slots;
    }

    private static void addIfLongEnough(List<AvailableTimeSlot> slots, int start, int end, int duration) {
        if (end - start >= duration) {
            slots.add(AvailableTimeSlot.of(start, end));
        }
    }
}
