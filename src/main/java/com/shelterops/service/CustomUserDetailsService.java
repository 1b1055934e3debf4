package com.shelterops.service;

import com.shelterops.model.TeamMember;
import com.shelterops.repository.TeamMemberRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CustomUserDetailsService implements UserDetailsService {

    private final TeamMemberRepository teamMemberRepository;

    @Override
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        TeamMember member = teamMemberRepository.findByUsername(username)
                .orElseThrow(() -> new UsernameNotFoundException("Unknown team member: " + username));

        String role = member.getRole() == null ? "VOLUNTEER" : member.getRole().toUpperCase();
        return User.withUsername(member.getUsername())
                .password(member.getPassword() == null ? "" : member.getPassword())
                .roles(role)
                .build();
    }
}
