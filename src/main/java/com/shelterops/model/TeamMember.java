package com.shelterops.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "team_member",
        indexes = {
                @Index(name = "idx_team_member_org", columnList = "org_id")
        })
@Getter
@Setter
public class TeamMember {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Id
    private String id;

    @Column(unique = true, nullable = false)
    private String username; // login e-mail

    private String password;

    // ADMIN, VOLUNTEER
    private String role = "VOLUNTEER";

    private String name;

    // null until the member joins an organization
    @Column(name = "org_id")
    private String orgId;

    // ---- Document-shaped schedule data: JSON columns + transient lists ----
    @Column(name = "work_schedule_json", length = 8000)
    private String workScheduleJson;

    @Column(name = "schedule_exceptions_json", length = 8000)
    private String scheduleExceptionsJson;

    @Transient
    private List<WorkScheduleEntry> workSchedule = new ArrayList<>();

    @Transient
    private List<ScheduleException> scheduleExceptions = new ArrayList<>();

    @PrePersist
    @PreUpdate
    private void writeScheduleToJson() {
        try {
            this.workScheduleJson = (workSchedule == null || workSchedule.isEmpty())
                    ? null : JSON.writeValueAsString(workSchedule);
            this.scheduleExceptionsJson = (scheduleExceptions == null || scheduleExceptions.isEmpty())
                    ? null : JSON.writeValueAsString(scheduleExceptions);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize schedule of team member " + id, e);
        }
    }

    @PostLoad
    private void readScheduleFromJson() {
        try {
            this.workSchedule = (workScheduleJson == null || workScheduleJson.isBlank())
                    ? new ArrayList<>()
                    : JSON.readValue(workScheduleJson, new TypeReference<List<WorkScheduleEntry>>() {});
            this.scheduleExceptions = (scheduleExceptionsJson == null || scheduleExceptionsJson.isBlank())
                    ? new ArrayList<>()
                    : JSON.readValue(scheduleExceptionsJson, new TypeReference<List<ScheduleException>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored schedule of team member " + id + " is not valid JSON", e);
        }
    }
}
