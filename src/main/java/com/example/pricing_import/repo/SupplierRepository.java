package com.example.pricing_import.repo;

import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.pricing_import.entity.Supplier;

import jakarta.persistence.LockModeType;

@Repository
public interface SupplierRepository extends JpaRepository<Supplier, Long> {

    List<Supplier> findByActiveTrue();

    /**
     * Row lock on the suppliers touched by an import commit.
     * Two batches for the same supplier serialize here until the first commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Supplier s WHERE s.supplierId IN :ids ORDER BY s.supplierId")
    List<Supplier> lockAllById(@Param("ids") Collection<Long> ids);
}
