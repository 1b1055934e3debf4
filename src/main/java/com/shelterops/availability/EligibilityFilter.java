package com.shelterops.availability;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Narrows the requested volunteers to those allowed to show a pet.
 */
public final class EligibilityFilter {

    public static final String NO_SUITABLE_VOLUNTEERS = "No suitable volunteers available for this pet";

    private EligibilityFilter() {
    }

    /**
     * @param requested volunteer ids in caller order; duplicates collapse to the first occurrence
     * @param pet       pet restrictions, or null when no pet was given or it has no record
     */
    public static EligibilityResult filter(List<String> requested, PetProfile pet) {
        List<String> distinct = List.copyOf(new LinkedHashSet<>(requested));

        if (pet == null || !pet.restrictsVolunteers()) {
            return new EligibilityResult(distinct, null);
        }

        List<String> allowed = distinct.stream()
                .filter(pet.assignedVolunteers()::contains)
                .toList();

        return allowed.isEmpty()
                ? new EligibilityResult(allowed, NO_SUITABLE_VOLUNTEERS)
                : new EligibilityResult(allowed, null);
    }
}
