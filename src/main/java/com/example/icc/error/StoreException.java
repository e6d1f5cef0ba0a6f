package com.example.icc.error;

/**
 * Connectivity or protocol failure talking to the backing store.
 * Never shown to clients.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
