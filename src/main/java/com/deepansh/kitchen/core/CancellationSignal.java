package com.deepansh.kitchen.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for one workflow. Checked before every dispatch;
 * calls already running are left to finish.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
