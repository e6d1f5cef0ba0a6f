package com.example.icc.store;

import com.example.icc.concurrent.CancelSignal;

/**
 * Backing store of the service: an append-only stream for icc messages and a scored set
 * for applause. All methods throw {@link com.example.icc.error.StoreException} when the
 * store cannot be reached.
 */
public interface IccStore {

    /** Id that sorts before every real stream entry. */
    String STREAM_START = "0-0";

    /**
     * Appends {@code payload} as is. Readers get back the same bytes.
     */
    void appendStream(byte[] payload);

    /**
     * Blocks until an entry after {@code lastId} exists and returns the first one.
     * Gives up with {@link com.example.icc.error.CancelledException} once {@code cancel}
     * has fired; an implementation may take up to one blocking round trip to notice.
     */
    StreamEntry readNextStream(String lastId, CancelSignal cancel);

    /**
     * Id of the newest entry in the stream or {@link #STREAM_START} when it is empty.
     */
    String latestStreamId();

    /**
     * Sets the score of {@code member}, replacing any earlier score.
     */
    void addScored(String member, long score);

    /**
     * Number of members with a score of at least {@code minScore}.
     */
    long countInRange(long minScore);

    /**
     * Removes every member with a score below {@code boundary}.
     */
    void deleteBelow(long boundary);

    /**
     * Throws if the store is not reachable.
     */
    void ping();
}
