package com.shelterops.availability;

import java.util.List;
import java.util.Set;

/**
 * Scheduling restrictions attached to one pet. An empty allow-list means no restriction.
 */
public record PetProfile(Long catId, Set<String> assignedVolunteers, List<PetBlackout> blackouts) {

    public PetProfile {
        assignedVolunteers = Set.copyOf(assignedVolunteers);
        blackouts = List.copyOf(blackouts);
    }

    public boolean restrictsVolunteers() {
        return !assignedVolunteers.isEmpty();
    }
}
