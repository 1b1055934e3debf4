package com.shelterops.repository;

import com.shelterops.model.TeamMember;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface TeamMemberRepository extends JpaRepository<TeamMember, String> {
    Optional<TeamMember> findByUsername(String username);

    // Volunteers are only visible inside their own organization
    Optional<TeamMember> findByIdAndOrgId(String id, String orgId);
}
