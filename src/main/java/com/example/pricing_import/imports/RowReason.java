package com.example.pricing_import.imports;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reason attached to a rejected or duplicate row. Serialized as its snake_case code.
 */
public enum RowReason {
    // rejected
    EXTRACTION_FAILED("extraction_failed"),
    LOW_CONFIDENCE("low_confidence"),
    MISSING_PRODUCT_NAME("missing_product_name"),
    UNPARSEABLE_PRICE("unparseable_price"),
    UNRECOGNIZED_CURRENCY("unrecognized_currency"),
    INVALID_PRICE("invalid_price"),
    UNKNOWN_SUPPLIER("unknown_supplier"),
    COMMIT_FAILED("commit_failed"),
    CANCELLED("cancelled"),
    // duplicate
    IN_BATCH("in_batch"),
    EXISTING_RECORD("existing_record");

    private final String code;

    RowReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isDuplicateReason() {
        return this == IN_BATCH || this == EXISTING_RECORD;
    }
}
