package com.example.icc.controller;

import com.example.icc.concurrent.CancelSignal;

/**
 * Something a long-poll GET can block on.
 */
public interface Receiver {

    /**
     * Blocks until there is something new to hand out and returns it as the response body.
     *
     * @throws com.example.icc.error.CancelledException if {@code cancel} fired first
     */
    byte[] receive(CancelSignal cancel);
}
