package com.planttracker.backend.models;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

/**
 * Catalog entry shared by all users. Unique on family + genus + species + cultivar.
 */
@Entity
@Table(name = "plants", uniqueConstraints = @UniqueConstraint(
        name = "plants_taxonomy_unique", columnNames = {"family", "genus", "species", "cultivar"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Plant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String family;

    @Column(nullable = false)
    private String genus;

    @Column(nullable = false)
    private String species;

    @Column
    private String cultivar;

    @Column(name = "common_name", nullable = false)
    private String commonName;

    @Column(name = "care_instructions", columnDefinition = "TEXT")
    private String careInstructions;

    @Column(name = "created_by")
    private Long createdBy;

    @Builder.Default
    @Column(name = "is_verified", nullable = false)
    private Boolean isVerified = false;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;
}
