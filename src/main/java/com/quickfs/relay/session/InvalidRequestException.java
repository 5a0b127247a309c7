package com.quickfs.relay.session;

/**
 * Thrown when an incoming request carries missing or malformed parameters.
 * Always raised before any session state is created.
 */
public class InvalidRequestException extends Exception {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
