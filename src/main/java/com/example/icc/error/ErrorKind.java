package com.example.icc.error;

import org.springframework.http.HttpStatus;

/**
 * Closed set of error kinds that may be shown to a client.
 */
public enum ErrorKind {
    INVALID("invalid", HttpStatus.BAD_REQUEST),
    NOT_ALLOWED("not-allowed", HttpStatus.UNAUTHORIZED),
    NOT_FOUND("not-found", HttpStatus.NOT_FOUND);

    private final String type;
    private final HttpStatus status;

    ErrorKind(String type, HttpStatus status) {
        this.type = type;
        this.status = status;
    }

    /**
     * Stable machine readable tag written into error bodies.
     */
    public String type() {
        return type;
    }

    public HttpStatus status() {
        return status;
    }
}
