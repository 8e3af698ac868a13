package com.harbor.server.infrastructure.web;

/**
 * Raised (and logged, never rethrown) when a request handler fails with an exception that
 * reaches the telemetry filter.
 */
public class HandlerPanicException extends RuntimeException {

    public HandlerPanicException(Throwable cause) {
        super("http: " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message != null ? message : cause.toString();
    }
}
