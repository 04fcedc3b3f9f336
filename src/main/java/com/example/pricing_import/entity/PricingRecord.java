package com.example.pricing_import.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Committed supplier price. Written only by the per-batch import commit.
 */
@Entity
@Table(name = "pricing_records", uniqueConstraints = @UniqueConstraint(name = "uk_pricing_supplier_name_unit", columnNames = {
        "supplier_id", "normalized_name", "unit" }), indexes = @Index(name = "idx_pricing_supplier", columnList = "supplier_id"))
@Getter
@Setter
@NoArgsConstructor
public class PricingRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "pricing_record_id")
    private Long pricingRecordId;

    @Column(name = "supplier_id", nullable = false)
    private Long supplierId;

    @Column(name = "product_name", nullable = false, length = 200)
    private String productName;

    @Column(name = "normalized_name", nullable = false, length = 200)
    private String normalizedName;

    @Column(name = "price", nullable = false, precision = 14, scale = 4)
    private BigDecimal price;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "unit", nullable = false, length = 50)
    private String unit;

    @Column(name = "category", nullable = false, length = 30)
    private String category;

    @Column(name = "sku", length = 100)
    private String sku;

    @Column(name = "free_sample", nullable = false)
    private boolean freeSample;

    @Column(name = "source_batch_id", nullable = false, length = 36)
    private String sourceBatchId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    void prePersist() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
