package com.shelterops.service;

import com.shelterops.exception.DependencyException;
import com.shelterops.exception.OrganizationNotFoundException;
import com.shelterops.exception.OrganizationPreconditionException;
import com.shelterops.model.TeamMember;
import com.shelterops.repository.TeamMemberRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Resolves which organization an authenticated caller acts for.
 */
@Service
@RequiredArgsConstructor
public class OrganizationContextService {

    private final TeamMemberRepository teamMemberRepository;

    public String resolveOrgId(String username) {
        TeamMember member;
        try {
            member = teamMemberRepository.findByUsername(username)
                    .orElseThrow(() -> new OrganizationNotFoundException("User not found"));
        } catch (DataAccessException e) {
            throw new DependencyException("Failed to load team member " + username, e);
        }

        if (member.getOrgId() == null || member.getOrgId().isBlank()) {
            throw new OrganizationPreconditionException("User is not associated with an organization");
        }
        return member.getOrgId();
    }
}
