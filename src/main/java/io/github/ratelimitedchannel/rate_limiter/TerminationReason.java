package io.github.ratelimitedchannel.rate_limiter;

/**
 * Why a rate limiter worker stopped.
 */
public enum TerminationReason {
    /**
     * All input senders were closed. A value still pending is not forwarded.
     */
    INPUT_CLOSED,
    /**
     * The output receiver was closed. A value still pending is abandoned.
     */
    OUTPUT_CLOSED,
    /**
     * The worker thread was interrupted.
     */
    INTERRUPTED,
    /**
     * The worker failed with an unexpected exception.
     */
    FAILED
}
