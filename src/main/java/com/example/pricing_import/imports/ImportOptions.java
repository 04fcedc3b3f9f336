package com.example.pricing_import.imports;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ImportOptions {
    /** Caller-chosen batch id (lets the caller cancel a running import); generated when null. */
    String batchId;
    /** Declared supplier for rows that do not name one; may be null. */
    String supplier;
    @Builder.Default
    DuplicatePolicy duplicatePolicy = DuplicatePolicy.SKIP;
    @Builder.Default
    boolean useAiExtraction = true;
}
