package com.shelterops.repository;

import com.shelterops.model.Pet;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PetRepository extends JpaRepository<Pet, Long> {
    Optional<Pet> findByCatIdAndOrgId(Long catId, String orgId);
}
