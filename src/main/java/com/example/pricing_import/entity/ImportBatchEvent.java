package com.example.pricing_import.entity;

import java.time.LocalDateTime;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "import_batch_events")
@Getter @Setter
@NoArgsConstructor
public class ImportBatchEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "event_id")
    private Long eventId;

    @Column(name = "batch_id", nullable = false, length = 36)
    private String batchId;

    @Column(name = "from_stage", length = 20)
    private String fromStage;

    @Column(name = "to_stage", nullable = false, length = 20)
    private String toStage; // LOADED/EXTRACTED/STANDARDIZED/CLASSIFIED/COMMITTED/...

    @Column(name = "detail")
    private String detail;

    @Column(name = "actor", nullable = false, length = 50)
    private String actor;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
        if (actor == null || actor.isBlank()) actor = "SYSTEM";
    }
}
