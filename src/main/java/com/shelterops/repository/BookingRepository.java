package com.shelterops.repository;

import com.shelterops.model.Booking;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    // Day windows are [startOfDay, nextStartOfDay) in the target zone

    List<Booking> findByOrgIdAndTeamMemberIdAndStartTsGreaterThanEqualAndStartTsLessThanAndStatusIn(
            String orgId,
            String teamMemberId,
            Instant fromInclusive,
            Instant toExclusive,
            Collection<String> statuses);

    List<Booking> findByOrgIdAndCatIdAndStartTsGreaterThanEqualAndStartTsLessThanAndStatusIn(
            String orgId,
            Long catId,
            Instant fromInclusive,
            Instant toExclusive,
            Collection<String> statuses);
}
