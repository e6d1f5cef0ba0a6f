package com.example.icc.error;

/**
 * An error whose message is safe to echo to the client.
 */
public class IccException extends RuntimeException {

    private final ErrorKind kind;

    public IccException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public IccException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static IccException invalid(String message) {
        return new IccException(ErrorKind.INVALID, message);
    }

    public static IccException notAllowed(String message) {
        return new IccException(ErrorKind.NOT_ALLOWED, message);
    }

    public ErrorKind getKind() {
        return kind;
    }
}
