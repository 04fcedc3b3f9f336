package com.example.pricing_import.commit;

/**
 * Storage failure while writing a batch; nothing from the batch was committed.
 */
public class CommitFailedException extends RuntimeException {

    private final transient CommitPlan plan;

    public CommitFailedException(String message, CommitPlan plan, Throwable cause) {
        super(message, cause);
        this.plan = plan;
    }

    /** Outcomes computed before the write failed; may be null when planning itself failed. */
    public CommitPlan getPlan() {
        return plan;
    }
}
