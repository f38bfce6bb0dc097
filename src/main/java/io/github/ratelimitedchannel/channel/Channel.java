package io.github.ratelimitedchannel.channel;

import org.jetbrains.annotations.NotNull;

/**
 * A multi-producer, single-consumer queue whose endpoints close explicitly.
 * <ul>
 *   <li>{@link ChannelSender} handles write; closing the last one ends the stream.</li>
 *   <li>The single {@link ChannelReceiver} reads; closing it makes every send fail.</li>
 * </ul>
 *
 * <pre>{@code
 * Channel<Integer> channel = Channel.bounded(16);
 * try (ChannelSender<Integer> tx = channel.sender()) {
 *     tx.send(42);
 * }
 * Receipt<Integer> r = channel.receiver().receive(); // RECEIVED 42, then CLOSED
 * }</pre>
 *
 * @param <T> value type, {@code null} values are not accepted
 */
public final class Channel<T> {
    private final ChannelSender<T> sender;
    private final ChannelReceiver<T> receiver;

    private Channel(int capacity) {
        ChannelState<T> state = new ChannelState<>(capacity);
        this.sender = new ChannelSender<>(state);
        this.receiver = new ChannelReceiver<>(state);
    }

    /**
     * @param capacity maximum number of buffered values, must be &gt; 0
     */
    public static @NotNull <T> Channel<T> bounded(int capacity) {
        return new Channel<>(capacity);
    }

    public static @NotNull <T> Channel<T> unbounded() {
        return new Channel<>(Integer.MAX_VALUE);
    }

    /**
     * The first producer handle. More can be made with {@link ChannelSender#duplicate()}.
     */
    public @NotNull ChannelSender<T> sender() {
        return sender;
    }

    public @NotNull ChannelReceiver<T> receiver() {
        return receiver;
    }
}
