package com.example.icc.concurrent;

import java.util.concurrent.CompletableFuture;

/**
 * One-shot cancellation flag that blocking calls can race against.
 * Firing it more than once has no further effect.
 */
public final class CancelSignal {

    private final CompletableFuture<Void> fired = new CompletableFuture<>();

    public static CancelSignal cancelled() {
        CancelSignal signal = new CancelSignal();
        signal.cancel();
        return signal;
    }

    public void cancel() {
        fired.complete(null);
    }

    public boolean isCancelled() {
        return fired.isDone();
    }

    /**
     * A future completing when the signal fires. Each call returns a fresh copy,
     * so completing or cancelling it does not affect the signal.
     */
    public CompletableFuture<Void> asFuture() {
        return fired.copy();
    }
}
