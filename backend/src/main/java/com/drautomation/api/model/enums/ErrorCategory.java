package com.drautomation.api.model.enums;

/**
 * Classification applied to every failure recorded on a job.
 */
public enum ErrorCategory {
    VALIDATION(false),
    NETWORK(true),
    TIMEOUT(true),
    SERVER(true),
    CLIENT(false),
    INTEGRITY(false),
    INTERNAL(false);

    private final boolean retryable;

    ErrorCategory(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
