package io.github.ratelimitedchannel.channel;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Outcome of a receive operation on a {@link ChannelReceiver}.
 * <p>
 * A receipt either carries a value ({@link Status#RECEIVED}), reports that the channel is
 * closed and drained ({@link Status#CLOSED}), or reports that a timed receive gave up
 * ({@link Status#TIMED_OUT}).
 *
 * @param <T> value type
 */
public final class Receipt<T> {

    public enum Status {
        RECEIVED, CLOSED, TIMED_OUT
    }

    private final Status status;
    private final T value;

    private Receipt(Status status, T value) {
        this.status = status;
        this.value = value;
    }

    public static <T> Receipt<T> received(@NotNull T value) {
        return new Receipt<>(Status.RECEIVED, Objects.requireNonNull(value, "value"));
    }

    public static <T> Receipt<T> closed() {
        return new Receipt<>(Status.CLOSED, null);
    }

    public static <T> Receipt<T> timedOut() {
        return new Receipt<>(Status.TIMED_OUT, null);
    }

    public @NotNull Status getStatus() {
        return status;
    }

    public boolean isReceived() {
        return status == Status.RECEIVED;
    }

    public boolean isClosed() {
        return status == Status.CLOSED;
    }

    public boolean isTimedOut() {
        return status == Status.TIMED_OUT;
    }

    /**
     * @return the received value
     * @throws IllegalStateException if this receipt does not carry a value
     */
    public @NotNull T value() {
        if (status != Status.RECEIVED) {
            throw new IllegalStateException("No value, receipt status is " + status);
        }
        return value;
    }

    @Override
    public String toString() {
        return "Receipt{" +
                "status=" + status +
                ", value=" + value +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Receipt)) return false;
        Receipt<?> that = (Receipt<?>) o;
        return status == that.status && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, value);
    }
}
