package deskmigrator.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one job. The orchestrator checks it before
 * each component; a component already running is not interrupted.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /** Returns a token that is never cancelled by anyone else. */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * Requests cancellation.
     *
     * @return true if this call cancelled the token, false if it already was
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
