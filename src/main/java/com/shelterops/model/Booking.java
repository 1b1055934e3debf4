package com.shelterops.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

@Entity
@Table(name = "booking",
        indexes = {
                @Index(name = "idx_booking_org_start", columnList = "org_id, start_ts")
        })
@Getter
@Setter
public class Booking {

    /** Statuses that still hold time on a volunteer's or a pet's calendar. */
    public static final List<String> ACTIVE_STATUSES =
            List.of("confirmed", "volunteer-assigned", "in-progress", "pending-confirmation");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "org_id", nullable = false)
    private String orgId;

    // assigned volunteer, may be empty while the booking awaits assignment
    @Column(name = "team_member_id")
    private String teamMemberId;

    @Column(name = "cat_id")
    private Long catId;

    @Column(name = "start_ts")
    private Instant startTs;

    @Column(name = "end_ts")
    private Instant endTs;

    // pending-shelter-setup, pending-confirmation, confirmed, volunteer-assigned,
    // in-progress, completed, adopted, cancelled
    private String status = "pending-shelter-setup";

    private String adopter;
    private String summary;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }
}
