package com.example.pricing_import.imports;

import com.example.pricing_import.classify.ClassifiedRecord;

/**
 * Terminal outcome of one row.
 *
 * @param record          the classified record when the row got that far, else null
 * @param primaryPosition for in-batch duplicates, the row position of the group primary
 * @param pricingRecordId committed or updated record id, when known
 */
public record RowOutcome(
        int position,
        RowStatus status,
        RowReason reason,
        String detail,
        ClassifiedRecord record,
        Integer primaryPosition,
        Long pricingRecordId) {

    public static RowOutcome accepted(ClassifiedRecord record, Long pricingRecordId) {
        return new RowOutcome(record.position(), RowStatus.ACCEPTED, null, null, record, null, pricingRecordId);
    }

    public static RowOutcome updated(ClassifiedRecord record, Long pricingRecordId) {
        return new RowOutcome(record.position(), RowStatus.UPDATED, null, null, record, null, pricingRecordId);
    }

    public static RowOutcome duplicateInBatch(ClassifiedRecord record, int primaryPosition) {
        return new RowOutcome(record.position(), RowStatus.DUPLICATE, RowReason.IN_BATCH, null, record,
                primaryPosition, null);
    }

    public static RowOutcome duplicateOfExisting(ClassifiedRecord record, Long existingId) {
        return new RowOutcome(record.position(), RowStatus.DUPLICATE, RowReason.EXISTING_RECORD, null, record,
                null, existingId);
    }

    public static RowOutcome rejected(int position, RowReason reason, String detail) {
        return new RowOutcome(position, RowStatus.REJECTED, reason, detail, null, null, null);
    }

    public static RowOutcome rejected(ClassifiedRecord record, RowReason reason, String detail) {
        return new RowOutcome(record.position(), RowStatus.REJECTED, reason, detail, record, null, null);
    }

    /**
     * Same row, now rejected; the record (if any) is kept for the report.
     */
    public RowOutcome downgrade(RowReason newReason, String newDetail) {
        return new RowOutcome(position, RowStatus.REJECTED, newReason, newDetail, record, null, null);
    }
}
