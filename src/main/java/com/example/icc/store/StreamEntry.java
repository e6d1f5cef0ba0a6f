package com.example.icc.store;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One entry of the icc stream. The id is assigned by the store and totally ordered within
 * the stream; the payload is the message exactly as it was appended.
 */
@Value
@AllArgsConstructor
public class StreamEntry {
    String id;
    byte[] payload;
}
