package com.phillippitts.denoisebatch.domain;

/**
 * Lifecycle status of a {@link Job}.
 *
 * <pre>
 * QUEUED -&gt; RUNNING -&gt; SUCCEEDED | FAILED
 * QUEUED -&gt; CANCELLED
 * </pre>
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    /**
     * @return true if a job that ends in this status contributes to the mean job duration
     */
    public boolean isCompleted() {
        return this == SUCCEEDED || this == FAILED;
    }

    boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case QUEUED -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next == SUCCEEDED || next == FAILED;
            default -> false;
        };
    }
}
