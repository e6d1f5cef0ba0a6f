package com.example.icc.concurrent;

import com.example.icc.error.CancelledException;
import com.example.icc.error.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Runs a blocking call on a background worker and races it against a {@link CancelSignal}.
 *
 * <p>The store's blocking reads offer no abort, so when the signal wins the worker is
 * left running. Whatever it eventually produces lands in a future nobody waits on and is
 * dropped.
 */
public class CancellableCall {

    private static final Logger logger = LoggerFactory.getLogger(CancellableCall.class);

    private final ExecutorService executor;

    public CancellableCall(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Runs {@code blocking} on a worker and returns its result, or throws
     * {@link CancelledException} as soon as {@code cancel} fires.
     */
    public <T> T call(Supplier<T> blocking, CancelSignal cancel) {
        if (cancel.isCancelled()) {
            throw new CancelledException();
        }
        CompletableFuture<T> work = CompletableFuture.supplyAsync(blocking, executor);
        work.whenComplete((result, error) -> {
            if (error != null && cancel.isCancelled()) {
                logger.debug("Abandoned call failed after cancellation: {}", error.getMessage());
            }
        });
        return await(work, cancel);
    }

    /**
     * Waits for {@code work} or {@code cancel}, whichever completes first.
     * Cancellation wins a tie.
     */
    public static <T> T await(CompletableFuture<T> work, CancelSignal cancel) {
        if (cancel.isCancelled()) {
            throw new CancelledException();
        }
        CompletableFuture<Void> cancelled = cancel.asFuture();
        try {
            // a failed call surfaces through work.join() below
            CompletableFuture.anyOf(work, cancelled).handle((result, error) -> null).join();
        } finally {
            cancelled.cancel(false);
        }

        if (cancel.isCancelled()) {
            throw new CancelledException();
        }
        try {
            return work.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new StoreException("blocking call failed", cause);
        }
    }
}
