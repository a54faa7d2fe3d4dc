package com.phillippitts.denoisebatch.presentation.dto;

import com.phillippitts.denoisebatch.domain.SessionOptions;

/**
 * Body of {@code POST /api/batch/session}; missing fields fall back to {@code defaults}.
 */
public record SessionRequest(Integer parallelism, Boolean continueOnError, Boolean autoClearCompleted) {

    public SessionOptions toOptions(SessionOptions defaults) {
        return new SessionOptions(
                parallelism != null ? parallelism : defaults.parallelism(),
                continueOnError != null ? continueOnError : defaults.continueOnError(),
                autoClearCompleted != null ? autoClearCompleted : defaults.autoClearCompleted());
    }
}
