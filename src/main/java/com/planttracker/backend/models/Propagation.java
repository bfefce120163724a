package com.planttracker.backend.models;

import com.planttracker.backend.enums.ExternalSource;
import com.planttracker.backend.enums.SourceType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Entity
@Table(name = "propagations", indexes = {
        @Index(name = "propagations_user_id_idx", columnList = "user_id"),
        @Index(name = "propagations_parent_instance_id_idx", columnList = "parent_instance_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Propagation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "plant_id", nullable = false)
    private Long plantId;

    // Null for external sources
    @Column(name = "parent_instance_id")
    private Long parentInstanceId;

    @Column(nullable = false)
    private String nickname;

    @Column(nullable = false)
    private String location;

    @Column(name = "date_started", nullable = false)
    private LocalDate dateStarted;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Status status = Status.STARTED;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false)
    private SourceType sourceType;

    @Enumerated(EnumType.STRING)
    @Column(name = "external_source")
    private ExternalSource externalSource;

    @Column(name = "external_source_details")
    private String externalSourceDetails;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public enum Status {
        STARTED, ROOTING, PLANTED, ESTABLISHED
    }
}
