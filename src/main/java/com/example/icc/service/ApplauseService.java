package com.example.icc.service;

import com.example.icc.concurrent.CancelSignal;
import com.example.icc.controller.Receiver;
import com.example.icc.controller.Sender;
import com.example.icc.store.IccStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Counts applause per user inside a sliding time window.
 *
 * <p>Every user has at most one entry in the store, scored with the time of their last
 * applause in epoch seconds. The level is the number of users whose entry is younger than
 * the applause interval. Entries older than the retention window are pruned.
 */
public class ApplauseService implements Receiver, Sender {

    private static final Logger logger = LoggerFactory.getLogger(ApplauseService.class);

    private final IccStore store;
    private final ApplauseSettings settings;
    private final Duration retention;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final LevelChannel levels = new LevelChannel();

    public ApplauseService(IccStore store, ApplauseSettings settings, Duration retention,
                           Clock clock, ObjectMapper objectMapper) {
        this.store = store;
        this.settings = settings;
        this.retention = retention;
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    /**
     * Records an applause of {@code userId} at {@code timestamp}, replacing any earlier one.
     */
    public void send(long userId, long timestamp) {
        store.addScored(Long.toString(userId), timestamp);
    }

    /**
     * Records an applause of {@code userId} now. The request body is ignored.
     */
    @Override
    public void send(long userId, byte[] payload) {
        send(userId, now());
        logger.debug("Applause from user {}", userId);
    }

    /**
     * Number of distinct users that applauded at or after {@code since}.
     */
    public long receive(long since) {
        return store.countInRange(since);
    }

    /**
     * Waits for the next published level and returns it as json.
     */
    @Override
    public byte[] receive(CancelSignal cancel) {
        ApplauseLevel level = levels.awaitChange(cancel);
        try {
            return objectMapper.writeValueAsBytes(level);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("encoding applause level", e);
        }
    }

    /**
     * Recounts the current window and wakes waiting receivers if the level changed.
     */
    public ApplauseLevel publishLevel() {
        long since = now() - settings.applauseInterval().toSeconds();
        ApplauseLevel level = new ApplauseLevel(receive(since));
        if (levels.publish(level)) {
            logger.debug("Applause level changed to {}", level.getLevel());
        }
        return level;
    }

    /**
     * Deletes applause older than the retention window.
     *
     * @return the boundary used; entries below it are gone
     */
    public long pruneOldData() {
        long boundary = pruneBoundary(now());
        store.deleteBelow(boundary);
        return boundary;
    }

    long pruneBoundary(long now) {
        Duration window = retention;
        Duration interval = settings.applauseInterval();
        if (window.compareTo(interval) < 0) {
            // pruning must never remove applause the level still counts
            window = interval;
        }
        return now - window.toSeconds();
    }

    public ApplauseLevel currentLevel() {
        return levels.current();
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
