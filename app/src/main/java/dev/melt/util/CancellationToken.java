package dev.melt.util;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative, process-shareable cancellation flag.
 *
 * <p>Work checks {@link #isCancelled()} at well-defined checkpoints (before acquiring a permit, before starting a
 * blocking VCS call). Setting the flag never interrupts a call that is already running.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /** Request cancellation. Idempotent. */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
