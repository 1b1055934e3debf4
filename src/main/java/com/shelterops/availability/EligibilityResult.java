package com.shelterops.availability;

import java.util.List;

public record EligibilityResult(List<String> eligibleVolunteerIds, String note) {

    public EligibilityResult {
        eligibleVolunteerIds = List.copyOf(eligibleVolunteerIds);
    }

    public boolean isEmpty() {
        return eligibleVolunteerIds.isEmpty();
    }

    public int size() {
        return eligibleVolunteerIds.size();
    }
}
