package com.example.icc.controller;

/**
 * Something a POST can hand its body to.
 */
public interface Sender {

    void send(long userId, byte[] payload);

    /**
     * Whether anonymous requests are turned away before {@link #send} is called.
     */
    default boolean requiresIdentity() {
        return true;
    }
}
