package io.github.ratelimitedchannel.channel;

import io.github.ratelimitedchannel.base_exceptions.ChannelClosedException;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Producer handle of a {@link Channel}.
 * <p>
 * A channel may have many producer handles; {@link #duplicate()} creates another one.
 * The channel closes for its receiver once every handle has been closed and the
 * buffered values have been received.
 */
public final class ChannelSender<T> implements AutoCloseable {
    private final ChannelState<T> state;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ChannelSender(ChannelState<T> state) {
        this.state = state;
    }

    /**
     * Sends a value, waiting for buffer space when the channel is full.
     *
     * @throws ChannelClosedException if the receiver is closed, before or while waiting
     * @throws IllegalStateException  if this handle is closed
     */
    public void send(@NotNull T value) throws ChannelClosedException, InterruptedException {
        ensureOpen();
        state.send(value);
    }

    /**
     * Sends a value without waiting.
     *
     * @return {@code false} if the buffer is full
     * @throws ChannelClosedException if the receiver is closed
     */
    public boolean trySend(@NotNull T value) throws ChannelClosedException {
        ensureOpen();
        return state.trySend(value);
    }

    /**
     * Creates another producer handle on the same channel.
     */
    public @NotNull ChannelSender<T> duplicate() {
        ensureOpen();
        state.addSender();
        return new ChannelSender<>(state);
    }

    /**
     * @return {@code true} if this handle is closed or nobody receives anymore
     */
    public boolean isClosed() {
        return closed.get() || state.isReceiverClosed();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            state.releaseSender();
        }
    }

    private void ensureOpen() {
        if (closed.get()) throw new IllegalStateException("Sender is closed");
    }
}
