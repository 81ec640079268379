package com.openforge.clusterlens.investigation;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one investigation turn.
 * Checked by the orchestrator before every model call and every tool call.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancelledException();
        }
    }

    /** Unwinds the loop from wherever the token was checked. */
    public static final class CancelledException extends RuntimeException {
        CancelledException() {
            super("Investigation cancelled", null, false, false);
        }
    }
}
