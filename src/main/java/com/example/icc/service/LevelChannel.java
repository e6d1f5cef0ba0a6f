package com.example.icc.service;

import com.example.icc.concurrent.CancelSignal;
import com.example.icc.concurrent.CancellableCall;

import java.util.concurrent.CompletableFuture;

/**
 * Holds the last published applause level and lets callers wait for the next change.
 */
class LevelChannel {

    private ApplauseLevel current = new ApplauseLevel(0);
    private CompletableFuture<ApplauseLevel> next = new CompletableFuture<>();

    /**
     * Publishes {@code level} if it differs from the current one.
     *
     * @return true if waiters were woken
     */
    boolean publish(ApplauseLevel level) {
        CompletableFuture<ApplauseLevel> waiting;
        synchronized (this) {
            if (current.equals(level)) {
                return false;
            }
            current = level;
            waiting = next;
            next = new CompletableFuture<>();
        }
        waiting.complete(level);
        return true;
    }

    /**
     * Blocks until the level changes after this call or {@code cancel} fires.
     */
    ApplauseLevel awaitChange(CancelSignal cancel) {
        CompletableFuture<ApplauseLevel> waiting;
        synchronized (this) {
            waiting = next;
        }
        return CancellableCall.await(waiting, cancel);
    }

    synchronized ApplauseLevel current() {
        return current;
    }
}
