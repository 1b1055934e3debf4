package com.shelterops.dto;

import com.shelterops.availability.AvailableTimeSlot;

public class TimeSlotDto {

    private final String start; // HH:MM
    private final String end;   // HH:MM, "24:00" when the slot runs to midnight
    private final int durationMinutes;

    public TimeSlotDto(String start, String end, int durationMinutes) {
        this.start = start;
        this.end = end;
        this.durationMinutes = durationMinutes;
    }

    public static TimeSlotDto from(AvailableTimeSlot slot) {
        return new TimeSlotDto(slot.start(), slot.end(), slot.durationMinutes());
    }

    public String getStart() { return start; }
    public String getEnd() { return end; }
    public int getDurationMinutes() { return durationMinutes; }
}
