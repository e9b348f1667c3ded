package io.github.cyfko.querier.core.spi;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned cancellation flag for one execution.
 * <p>
 * The engine checks the token before counting and again before materializing; once cancelled,
 * the execution completes exceptionally with {@link CancellationException} and no partial
 * result is produced.
 * </p>
 *
 * <pre>{@code
 * CancellationToken token = new CancellationToken();
 * CompletableFuture<PagedResult<Company>> future = builder.withCancellationToken(token).executeAsync();
 * token.cancel();
 * }</pre>
 *
 * @author Frank KOSSI
 */
public final class CancellationToken {

    /** Token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final boolean cancellable;

    public CancellationToken() {
        this(true);
    }

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * @throws CancellationException if cancellation was requested
     */
    public void throwIfCancellationRequested() {
        if (cancelled.get()) {
            throw new CancellationException("Query execution was cancelled");
        }
    }
}
