package com.shoplens.backend.job;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one job. The runner checks it between
 * stages; a stage that has started always runs to its end.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
