package com.example.icc.store;

import com.example.icc.concurrent.CancelSignal;
import com.example.icc.error.CancelledException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Store held in process memory. Used for local development and tests, where it behaves
 * like the Redis store with the same ordering and blocking guarantees.
 */
@Component
@ConditionalOnProperty(name = "icc.store", havingValue = "memory")
public class InMemoryIccStore implements IccStore {

    private final List<StreamEntry> stream = new ArrayList<>();
    private final Map<String, Long> scores = new HashMap<>();
    private long lastSequence;

    @Override
    public synchronized void appendStream(byte[] payload) {
        lastSequence++;
        stream.add(new StreamEntry(lastSequence + "-0", payload.clone()));
        notifyAll();
    }

    @Override
    public StreamEntry readNextStream(String lastId, CancelSignal cancel) {
        long after = sequenceOf(lastId);
        cancel.asFuture().thenRun(this::wakeReaders);
        synchronized (this) {
            while (!cancel.isCancelled()) {
                // sequences start at 1, so the entry after n sits at index n
                if (after < stream.size()) {
                    StreamEntry entry = stream.get((int) after);
                    return new StreamEntry(entry.getId(), entry.getPayload().clone());
                }
                try {
                    wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted while waiting for stream entry", e);
                }
            }
        }
        throw new CancelledException();
    }

    @Override
    public synchronized String latestStreamId() {
        return stream.isEmpty() ? STREAM_START : stream.get(stream.size() - 1).getId();
    }

    @Override
    public synchronized void addScored(String member, long score) {
        scores.put(member, score);
    }

    @Override
    public synchronized long countInRange(long minScore) {
        return scores.values().stream().filter(score -> score >= minScore).count();
    }

    @Override
    public synchronized void deleteBelow(long boundary) {
        scores.values().removeIf(score -> score < boundary);
    }

    @Override
    public void ping() {
    }

    private synchronized void wakeReaders() {
        notifyAll();
    }

    private static long sequenceOf(String id) {
        int dash = id.indexOf('-');
        return Long.parseLong(dash < 0 ? id : id.substring(0, dash));
    }
}
