package com.catalogiq.engine.service.batch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked at batch boundaries. In-flight batches finish;
 * batches not yet started are skipped.
 */
public class CancellationToken {

    /** Token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("NONE token cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
