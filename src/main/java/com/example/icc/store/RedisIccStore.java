package com.example.icc.store;

import com.example.icc.concurrent.CancelSignal;
import com.example.icc.error.CancelledException;
import com.example.icc.error.StoreException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.Limit;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Redis backed store. Stream entries keep their payload as raw bytes in the
 * {@value #CONTENT_FIELD} field, applause lives in a sorted set scored by epoch seconds.
 */
@Component
@ConditionalOnProperty(name = "icc.store", havingValue = "redis", matchIfMissing = true)
public class RedisIccStore implements IccStore {

    static final String CONTENT_FIELD = "content";

    private final StringRedisTemplate redis;
    private final RedisTemplate<String, byte[]> streamTemplate;
    private final String streamKey;
    private final String applauseKey;
    private final Duration readBlock;

    @Autowired
    public RedisIccStore(StringRedisTemplate redis,
                         @Qualifier("iccStreamTemplate") RedisTemplate<String, byte[]> streamTemplate,
                         @Value("${icc.redis.stream-key:icc}") String streamKey,
                         @Value("${icc.redis.applause-key:applause}") String applauseKey,
                         @Value("${icc.redis.read-block:PT10S}") Duration readBlock) {
        this.redis = redis;
        this.streamTemplate = streamTemplate;
        this.streamKey = streamKey;
        this.applauseKey = applauseKey;
        this.readBlock = readBlock;
    }

    @Override
    public void appendStream(byte[] payload) {
        try {
            StreamOperations<String, String, byte[]> ops = streamTemplate.opsForStream();
            ops.add(streamKey, Map.of(CONTENT_FIELD, payload));
        } catch (DataAccessException e) {
            throw new StoreException("xadd to " + streamKey, e);
        }
    }

    @Override
    public StreamEntry readNextStream(String lastId, CancelSignal cancel) {
        StreamReadOptions options = StreamReadOptions.empty().count(1).block(readBlock);
        StreamOffset<String> offset = StreamOffset.create(streamKey, ReadOffset.from(lastId));
        // XREAD with BLOCK 0 would trip the client's command timeout, so block in slices
        while (!cancel.isCancelled()) {
            List<MapRecord<String, String, byte[]>> records;
            try {
                StreamOperations<String, String, byte[]> ops = streamTemplate.opsForStream();
                records = ops.read(options, offset);
            } catch (DataAccessException e) {
                throw new StoreException("xread from " + streamKey, e);
            }
            if (records != null && !records.isEmpty()) {
                MapRecord<String, String, byte[]> record = records.get(0);
                byte[] content = record.getValue().getOrDefault(CONTENT_FIELD, new byte[0]);
                return new StreamEntry(record.getId().getValue(), content);
            }
        }
        throw new CancelledException();
    }

    @Override
    public String latestStreamId() {
        try {
            StreamOperations<String, String, byte[]> ops = streamTemplate.opsForStream();
            List<MapRecord<String, String, byte[]>> newest =
                    ops.reverseRange(streamKey, Range.unbounded(), Limit.limit().count(1));
            if (newest == null || newest.isEmpty()) {
                return STREAM_START;
            }
            return newest.get(0).getId().getValue();
        } catch (DataAccessException e) {
            throw new StoreException("xrevrange on " + streamKey, e);
        }
    }

    @Override
    public void addScored(String member, long score) {
        try {
            redis.opsForZSet().add(applauseKey, member, score);
        } catch (DataAccessException e) {
            throw new StoreException("zadd to " + applauseKey, e);
        }
    }

    @Override
    public long countInRange(long minScore) {
        try {
            Long n = redis.opsForZSet().count(applauseKey, minScore, Double.MAX_VALUE);
            return n == null ? 0 : n;
        } catch (DataAccessException e) {
            throw new StoreException("zcount on " + applauseKey, e);
        }
    }

    @Override
    public void deleteBelow(long boundary) {
        try {
            // scores are whole seconds, so "below boundary" is "up to boundary - 1"
            redis.opsForZSet().removeRangeByScore(applauseKey, 0, boundary - 1);
        } catch (DataAccessException e) {
            throw new StoreException("zremrangebyscore on " + applauseKey, e);
        }
    }

    @Override
    public void ping() {
        try {
            redis.execute((RedisCallback<String>) RedisConnection::ping);
        } catch (DataAccessException e) {
            throw new StoreException("ping", e);
        }
    }
}
