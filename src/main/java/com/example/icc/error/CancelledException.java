package com.example.icc.error;

/**
 * Thrown when a blocking call was abandoned because the caller's cancel signal fired.
 */
public class CancelledException extends RuntimeException {

    public CancelledException() {
        super("call was cancelled");
    }
}
