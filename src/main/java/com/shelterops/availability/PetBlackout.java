package com.shelterops.availability;

import java.time.DayOfWeek;

public record PetBlackout(DayOfWeek day, int startMinute, int endMinute, String reason) {
}
