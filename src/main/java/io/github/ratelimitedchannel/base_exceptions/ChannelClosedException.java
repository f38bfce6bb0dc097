package io.github.ratelimitedchannel.base_exceptions;

/**
 * Thrown when a value is sent on a channel whose receiver has been closed.
 */
public class ChannelClosedException extends Exception {
    public ChannelClosedException(String message) {
        super(message);
    }

    public ChannelClosedException(Throwable cause) {
        super(cause);
    }

    public ChannelClosedException(String message, Throwable cause) {
        super(message, cause);
    }

    public ChannelClosedException(Throwable cause, String message) {
        super(message, cause);
    }
}
