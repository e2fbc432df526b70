package io.fmengine.core.engine;

/**
 * Cooperative cancellation flag for enumeration. The search polls it after every instance
 * decision and stops at the next poll once {@link #cancel()} has been called.
 *
 * <p>Thread-safe: any thread may cancel, workers observe it on their next poll.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
