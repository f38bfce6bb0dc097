package io.github.ratelimitedchannel.rate_limiter;

import java.util.UUID;

/**
 * Listener of rate limiter worker events. Callbacks run on the worker thread.
 */
public interface RateLimiterEventListener<T> {
    default void onStart(UUID workerId) {
    }

    default void onForward(UUID workerId, T value) {
    }

    /**
     * A pending value that will never be forwarded: replaced by a newer one, or abandoned
     * when the worker stops.
     */
    default void onDiscard(UUID workerId, T discarded) {
    }

    default void onTerminate(UUID workerId, TerminationReason reason) {
    }

    default void onError(UUID workerId, Throwable error) {
    }
}
