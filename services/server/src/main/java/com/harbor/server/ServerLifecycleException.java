package com.harbor.server;

/**
 * Thrown when the embedded server cannot be started or stopped cleanly.
 */
public class ServerLifecycleException extends RuntimeException {

    public ServerLifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
