package com.phillippitts.denoisebatch.domain;

import com.phillippitts.denoisebatch.exception.OutOfRangeException;

/**
 * Session-wide batch options. Parallelism is fixed for the lifetime of one run.
 *
 * @param parallelism number of concurrent workers, at least 1
 * @param continueOnError whether a failed job leaves the rest of the batch running
 * @param autoClearCompleted remove succeeded jobs from the visible job list once terminal
 */
public record SessionOptions(
        int parallelism,
        boolean continueOnError,
        boolean autoClearCompleted
) {

    public SessionOptions {
        if (parallelism < 1) {
            throw new OutOfRangeException("parallelism", "must be at least 1, got " + parallelism);
        }
    }

    public static SessionOptions defaults() {
        return new SessionOptions(defaultParallelism(), true, false);
    }

    public static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
