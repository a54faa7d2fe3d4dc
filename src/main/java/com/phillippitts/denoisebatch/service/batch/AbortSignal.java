package com.phillippitts.denoisebatch.service.batch;

import com.phillippitts.denoisebatch.exception.ProcessingAbortedException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative abort flag checked by workers at chunk boundaries.
 */
public final class AbortSignal {

    private final AtomicBoolean aborted = new AtomicBoolean();

    /**
     * @return true if this call set the flag
     */
    public boolean abort() {
        return aborted.compareAndSet(false, true);
    }

    public boolean isAborted() {
        return aborted.get();
    }

    /**
     * @throws ProcessingAbortedException if the run has been aborted
     */
    public void checkpoint() {
        if (aborted.get()) {
            throw new ProcessingAbortedException("Processing aborted by stop request");
        }
    }
}
