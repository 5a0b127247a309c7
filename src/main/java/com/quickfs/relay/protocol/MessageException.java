package com.quickfs.relay.protocol;

/**
 * Thrown when a text frame cannot be decoded into a {@link Message}.
 */
public class MessageException extends Exception {

    public MessageException(String message) {
        super(message);
    }

    public MessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
