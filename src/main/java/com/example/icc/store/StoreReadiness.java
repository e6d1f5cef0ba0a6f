package com.example.icc.store;

import com.example.icc.concurrent.CancelSignal;
import com.example.icc.error.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Blocks process start until the store answers.
 */
public class StoreReadiness {

    private static final Logger logger = LoggerFactory.getLogger(StoreReadiness.class);

    private final IccStore store;
    private final Duration pollInterval;

    public StoreReadiness(IccStore store, Duration pollInterval) {
        this.store = store;
        this.pollInterval = pollInterval;
    }

    /**
     * Pings the store until it answers or {@code cancel} fires.
     *
     * @return true if the store is reachable
     */
    public boolean waitForReady(CancelSignal cancel) {
        while (!cancel.isCancelled()) {
            try {
                store.ping();
                return true;
            } catch (StoreException e) {
                logger.info("Waiting for store: {}", e.getMessage());
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }
}
