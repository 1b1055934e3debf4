package com.shelterops.availability;

import java.time.Instant;

// either reference may be null
public record AppointmentConflict(String volunteerId, Long catId, Instant start, Instant end) {
}
