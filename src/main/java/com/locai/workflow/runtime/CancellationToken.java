package com.locai.workflow.runtime;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal attached to a run at start. Observed at every suspension point.
 */
public final class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();

    /**
     * Requests cancellation. Returns {@code true} only for the first request.
     */
    public boolean cancel(String why) {
        return reason.compareAndSet(null, why == null ? "Cancelled" : why);
    }

    public boolean isCancellationRequested() {
        return reason.get() != null;
    }

    public String reason() {
        String value = reason.get();
        return value == null ? "" : value;
    }
}
