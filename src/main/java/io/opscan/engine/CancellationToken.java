package io.opscan.engine;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag shared between the host and a running analysis.
 * The engine polls it before every node evaluation.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    /**
     * @throws CancellationException if {@link #cancel()} has been called
     */
    public void throwIfCancellationRequested() {
        if (cancelled) {
            throw new CancellationException("Analysis cancelled");
        }
    }
}
