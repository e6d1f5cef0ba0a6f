package com.example.icc.service;

import com.example.icc.concurrent.CancelSignal;
import com.example.icc.error.CancelledException;
import com.example.icc.store.InMemoryIccStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ApplauseServiceTest {

    private static final long START = 1_700_000_000L;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private InMemoryIccStore store;
    private MutableClock clock;
    private ApplauseService applauseService;

    @BeforeEach
    void setUp() {
        store = new InMemoryIccStore();
        clock = new MutableClock(START);
        applauseService = new ApplauseService(store, () -> Duration.ofSeconds(5), Duration.ofMinutes(5), clock, objectMapper);
    }

    @Test
    void testSend_SameUserCountedOnce() {
        applauseService.send(1, START);
        applauseService.send(1, START + 2);

        assertEquals(1, applauseService.receive(START));
        assertEquals(1, applauseService.receive(START - 100));
    }

    @Test
    void testReceive_CountsDistinctUsersSince() {
        applauseService.send(1, START);
        applauseService.send(2, START + 1);
        applauseService.send(3, START + 2);
        applauseService.send(1, START + 3);

        assertEquals(3, applauseService.receive(START));
        assertEquals(3, applauseService.receive(START + 1));
        assertEquals(2, applauseService.receive(START + 2));
        assertEquals(1, applauseService.receive(START + 3));
        assertEquals(0, applauseService.receive(START + 4));
    }

    @Test
    void testSendFromGateway_UsesClock() {
        applauseService.send(9, new byte[0]);

        assertEquals(1, applauseService.receive(START));
        assertEquals(0, applauseService.receive(START + 1));
    }

    @Test
    void testPruneOldData_RemovesOnlyBelowBoundary() {
        applauseService.send(1, START - 301);
        applauseService.send(2, START - 300);
        applauseService.send(3, START - 10);

        long boundary = applauseService.pruneOldData();

        assertEquals(START - 300, boundary);
        assertEquals(2, applauseService.receive(0));
        assertEquals(2, applauseService.receive(boundary));
    }

    @Test
    void testPruneBoundary_NeverInsideInterval() {
        ApplauseService shortRetention = new ApplauseService(
                store, () -> Duration.ofSeconds(30), Duration.ofSeconds(10), clock, objectMapper);

        assertEquals(START - 30, shortRetention.pruneBoundary(START));
    }

    @Test
    void testPublishLevel_UsesInterval() {
        applauseService.send(1, START - 6);
        applauseService.send(2, START - 5);
        applauseService.send(3, START);

        assertEquals(2, applauseService.publishLevel().getLevel());

        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, applauseService.publishLevel().getLevel());
        assertEquals(1, applauseService.currentLevel().getLevel());
    }

    @Test
    void testReceive_WaitsForLevelChange() throws Exception {
        CompletableFuture<byte[]> waiting = CompletableFuture.supplyAsync(() -> applauseService.receive(new CancelSignal()));

        Thread.sleep(50);
        applauseService.publishLevel();
        assertFalse(waiting.isDone());

        applauseService.send(4, START);
        applauseService.publishLevel();

        assertEquals(1, objectMapper.readTree(waiting.get(5, TimeUnit.SECONDS)).get("level").asLong());
    }

    @Test
    void testReceive_Cancelled() {
        assertThrows(CancelledException.class, () -> applauseService.receive(CancelSignal.cancelled()));
    }

    static class MutableClock extends Clock {

        private Instant now;

        MutableClock(long epochSecond) {
            this.now = Instant.ofEpochSecond(epochSecond);
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
