package io.prompty.core.engine;

/**
 * Cooperative cancellation signal for an execution. The executor polls it before every resolver
 * call and every loop iteration. Resolvers that block can poll it through
 * {@link ExecutionContext#cancellationToken()}.
 *
 * <p>
 * Thread-safe: {@link #cancel()} may be called from any thread.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private volatile boolean cancelled;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /** A token that is never cancelled. */
    public static CancellationToken none() {
        return NONE;
    }

    /** A fresh token that can be cancelled. */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    public void cancel() {
        if (!cancellable) {
            throw new IllegalStateException("the shared none() token cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
