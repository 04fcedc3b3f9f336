package com.example.pricing_import.entity;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "import_batches")
@Getter
@Setter
@NoArgsConstructor
public class ImportBatchSummary {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "batch_id", nullable = false, unique = true, length = 36)
    private String batchId;

    @Column(name = "file_name")
    private String fileName;

    @Column(name = "supplier", length = 100)
    private String supplier;

    @Column(name = "duplicate_policy", nullable = false, length = 10)
    private String duplicatePolicy;

    @Column(name = "status", nullable = false, length = 20)
    private String status; // RUNNING/COMPLETED/COMMIT_FAILED/CANCELLED/FAILED

    @Column(name = "total_rows", nullable = false)
    private int totalRows;

    @Column(name = "accepted_count", nullable = false)
    private int acceptedCount;

    @Column(name = "duplicate_skipped_count", nullable = false)
    private int duplicateSkippedCount;

    @Column(name = "duplicate_updated_count", nullable = false)
    private int duplicateUpdatedCount;

    @Column(name = "rejected_count", nullable = false)
    private int rejectedCount;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }
}
