package com.example.pricing_import.dto.imports;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Final, immutable result of one import batch. Rows are in file order, one per loaded row.
 */
@Value
@Builder
public class ImportReport {

    public enum Status {
        COMPLETED,
        COMMIT_FAILED,
        CANCELLED
    }

    String batchId;
    String fileName;
    Status status;
    int totalRows;
    int accepted;
    int duplicateSkipped;
    int duplicateUpdated;
    int rejected;
    /** rejection code -> count */
    Map<String, Integer> rejectedByReason;
    List<RowReport> rows;
}
