package io.github.ratelimitedchannel.channel;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Objects;

/**
 * Consumer handle of a {@link Channel}. There is exactly one per channel.
 */
public final class ChannelReceiver<T> implements AutoCloseable {
    private final ChannelState<T> state;

    ChannelReceiver(ChannelState<T> state) {
        this.state = state;
    }

    /**
     * Waits for the next value.
     *
     * @return a {@link Receipt.Status#RECEIVED} receipt, or {@link Receipt.Status#CLOSED} once all
     * senders are closed and the buffer is drained, or this receiver is closed
     */
    public @NotNull Receipt<T> receive() throws InterruptedException {
        return state.receive();
    }

    /**
     * Waits at most {@code timeout} for the next value. A zero or negative timeout only polls.
     *
     * @return as {@link #receive()}, or a {@link Receipt.Status#TIMED_OUT} receipt
     */
    public @NotNull Receipt<T> receive(@NotNull Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        long nanos;
        try {
            nanos = timeout.toNanos();
        } catch (ArithmeticException e) {
            nanos = timeout.isNegative() ? 0L : Long.MAX_VALUE;
        }
        return state.receive(nanos);
    }

    /**
     * Polls without waiting. Works regardless of the caller's interrupt status.
     *
     * @return as {@link #receive()}, or a {@link Receipt.Status#TIMED_OUT} receipt when nothing is buffered
     */
    public @NotNull Receipt<T> tryReceive() {
        return state.poll();
    }

    /**
     * @return {@code true} if no further value will ever be received
     */
    public boolean isClosed() {
        return state.isDrainedAndClosed();
    }

    /**
     * Number of buffered values.
     */
    public int size() {
        return state.size();
    }

    public int capacity() {
        return state.capacity();
    }

    /**
     * Drops this receiver. Buffered values are discarded and senders fail from now on,
     * including senders currently waiting for buffer space.
     */
    @Override
    public void close() {
        state.closeReceiver();
    }
}
