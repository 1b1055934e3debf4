package com.shelterops.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Shelter-side scheduling record for an animal listed on the adoption site.
 */
@Entity
@Table(name = "pet")
@Getter
@Setter
public class Pet {

    private static final ObjectMapper JSON = new ObjectMapper();

    // animal id from the adoption listing
    @Id
    @Column(name = "cat_id")
    private Long catId;

    @Column(name = "org_id", nullable = false)
    private String orgId;

    @Column(name = "assigned_volunteers_json", length = 8000)
    private String assignedVolunteersJson;

    @Column(name = "exceptions_json", length = 8000)
    private String exceptionsJson;

    // team member ids allowed to show this pet; empty = anyone
    @Transient
    private List<String> assignedVolunteers = new ArrayList<>();

    @Transient
    private List<PetException> exceptions = new ArrayList<>();

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = LocalDateTime.now();
        writeToJson();
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now();
        writeToJson();
    }

    private void writeToJson() {
        try {
            this.assignedVolunteersJson = (assignedVolunteers == null || assignedVolunteers.isEmpty())
                    ? null : JSON.writeValueAsString(assignedVolunteers);
            this.exceptionsJson = (exceptions == null || exceptions.isEmpty())
                    ? null : JSON.writeValueAsString(exceptions);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize pet " + catId, e);
        }
    }

    @PostLoad
    private void readFromJson() {
        try {
            this.assignedVolunteers = (assignedVolunteersJson == null || assignedVolunteersJson.isBlank())
                    ? new ArrayList<>()
                    : JSON.readValue(assignedVolunteersJson, new TypeReference<List<String>>() {});
            this.exceptions = (exceptionsJson == null || exceptionsJson.isBlank())
                    ? new ArrayList<>()
                    : JSON.readValue(exceptionsJson, new TypeReference<List<PetException>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored data of pet " + catId + " is not valid JSON", e);
        }
    }
}
