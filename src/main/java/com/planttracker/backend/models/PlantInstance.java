package com.planttracker.backend.models;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * A plant owned by one user, linked to its catalog entry
 */
@Entity
@Table(name = "plant_instances", indexes = {
        @Index(name = "plant_instances_user_id_idx", columnList = "user_id"),
        @Index(name = "plant_instances_plant_id_idx", columnList = "plant_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlantInstance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "plant_id", nullable = false)
    private Long plantId;

    @Column(nullable = false)
    private String nickname;

    @Column(nullable = false)
    private String location;

    @Column(name = "last_fertilized")
    private LocalDate lastFertilized;

    @Column(name = "fertilizer_schedule")
    private String fertilizerSchedule;

    @Column(name = "fertilizer_due")
    private LocalDate fertilizerDue;

    @Column(name = "last_repot")
    private LocalDate lastRepot;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;
}
