package com.example.pricing_import.extraction;

public class ExtractionClientException extends RuntimeException {
    private final boolean transientFailure;

    public ExtractionClientException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public ExtractionClientException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    /**
     * Timeouts and rate-limit/server signals; worth retrying.
     */
    public boolean isTransientFailure() {
        return transientFailure;
    }
}
