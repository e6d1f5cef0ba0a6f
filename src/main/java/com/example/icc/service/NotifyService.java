package com.example.icc.service;

import com.example.icc.concurrent.CancelSignal;
import com.example.icc.concurrent.CancellableCall;
import com.example.icc.controller.Receiver;
import com.example.icc.controller.Sender;
import com.example.icc.error.IccException;
import com.example.icc.store.IccStore;
import com.example.icc.store.StreamEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Publishes icc messages to the store stream and hands them out again in order.
 *
 * <p>The read cursor lives in this instance. Only one logical reader may call
 * {@link #receive(CancelSignal)} at a time; concurrent readers race on the cursor.
 * A new instance starts at the stream's tail and never sees older messages.
 */
public class NotifyService implements Receiver, Sender {

    private static final Logger logger = LoggerFactory.getLogger(NotifyService.class);

    static final String NAME_FIELD = "name";
    static final String SENDER_FIELD = "sender_user_id";

    private final IccStore store;
    private final CancellableCall cancellableCall;
    private final ObjectMapper objectMapper;

    private volatile String cursor;

    public NotifyService(IccStore store, CancellableCall cancellableCall, ObjectMapper objectMapper) {
        this.store = store;
        this.cancellableCall = cancellableCall;
        this.objectMapper = objectMapper;
        this.cursor = store.latestStreamId();
        logger.info("Notify service reads icc stream after {}", cursor);
    }

    /**
     * Appends a raw payload to the stream.
     */
    public void publish(byte[] payload) {
        store.appendStream(payload);
    }

    /**
     * Validates a client message, stamps the sender and publishes it.
     */
    @Override
    public void send(long userId, byte[] payload) {
        JsonNode message;
        try {
            message = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw IccException.invalid("message is not valid json");
        }
        if (message == null || !message.isObject()) {
            throw IccException.invalid("message has to be a json object");
        }
        JsonNode name = message.get(NAME_FIELD);
        if (name == null || !name.isTextual() || name.asText().isEmpty()) {
            throw IccException.invalid("message needs a name");
        }

        ((ObjectNode) message).put(SENDER_FIELD, userId);
        try {
            publish(objectMapper.writeValueAsBytes(message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("encoding icc message", e);
        }
        logger.debug("User {} sent icc message {}", userId, name.asText());
    }

    /**
     * Returns the next message after the cursor. The cursor only moves when a message is
     * returned, so a cancelled caller resumes where it stopped.
     */
    @Override
    public byte[] receive(CancelSignal cancel) {
        String from = cursor;
        StreamEntry entry = cancellableCall.call(() -> store.readNextStream(from, cancel), cancel);
        cursor = entry.getId();
        return entry.getPayload();
    }

    String getCursor() {
        return cursor;
    }
}
