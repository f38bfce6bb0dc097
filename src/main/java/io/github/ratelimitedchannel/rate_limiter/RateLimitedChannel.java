package io.github.ratelimitedchannel.rate_limiter;

import com.google.common.annotations.Beta;
import io.github.ratelimitedchannel.UuidProvider;
import io.github.ratelimitedchannel.channel.Channel;
import io.github.ratelimitedchannel.channel.ChannelReceiver;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Rate-limited channels: throttle a fast stream down to its latest value, at most once per delay.
 * <p>
 * A worker reads the given input receiver and forwards to a new bounded output channel whose
 * receiver is returned. Values that arrive faster than {@code delay} are coalesced: only the
 * most recent one at the end of each window is forwarded, the others are dropped.
 *
 * <h3>Semantics</h3>
 * <ul>
 *   <li>The first value is forwarded immediately.</li>
 *   <li>Two forwards are at least {@code delay} apart, measured from forward to forward.</li>
 *   <li>Closing every input sender ends the output stream; a value still waiting for its
 *       window is not forwarded.</li>
 *   <li>Closing the output receiver stops the worker; later input sends fail.</li>
 *   <li>Forwarded values are shared with the consumer as-is, not copied.</li>
 * </ul>
 *
 * <h3>Example</h3>
 * <pre>{@code
 * Channel<Reading> samples = Channel.bounded(1000);
 * ChannelReceiver<Reading> latest = RateLimitedChannel.toRateLimitedChannel(
 *         samples.receiver(), Duration.ofSeconds(1));
 * // producer: samples.sender().send(reading) as often as it likes
 * // consumer: latest.receive() at most once a second
 * }</pre>
 */
public final class RateLimitedChannel {
    private final static Logger logger = LoggerFactory.getLogger(RateLimitedChannel.class);

    /**
     * Capacity of the output channel unless configured otherwise.
     */
    public static final int DEFAULT_OUTPUT_CAPACITY = 100;

    private RateLimitedChannel() {
    }

    /**
     * Starts a worker on its own daemon thread.
     *
     * @param input read exclusively by the worker from now on
     * @param delay minimum spacing between two forwarded values, zero or positive
     * @return the receiver of the throttled stream
     */
    public static @NotNull <T> ChannelReceiver<T> toRateLimitedChannel(@NotNull ChannelReceiver<T> input,
                                                                     @NotNull Duration delay) {
        return new Builder<T>()
                .input(input)
                .delay(delay)
                .build();
    }

    /**
     * As {@link #toRateLimitedChannel(ChannelReceiver, Duration)}, running the worker on {@code executor}.
     * The executor must be able to run the worker for as long as the channel lives.
     */
    public static @NotNull <T> ChannelReceiver<T> toRateLimitedChannel(@NotNull ChannelReceiver<T> input,
                                                                     @NotNull Duration delay,
                                                                     @NotNull Executor executor) {
        return new Builder<T>()
                .input(input)
                .delay(delay)
                .executor(executor)
                .build();
    }

    @Beta
    public static final class Builder<T> {
        private ChannelReceiver<T> input;
        private Duration delay;
        private int outputCapacity = DEFAULT_OUTPUT_CAPACITY;
        private Executor executor;
        private final List<RateLimiterEventListener<? super T>> listeners = new ArrayList<>();

        public Builder<T> input(@NotNull ChannelReceiver<T> input) {
            this.input = Objects.requireNonNull(input, "input");
            return this;
        }

        /**
         * Minimum spacing between two forwarded values. Zero forwards as fast as the consumer takes them.
         */
        public Builder<T> delay(@NotNull Duration delay) {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative()) throw new IllegalArgumentException("delay must be >= 0");
            try {
                delay.toNanos();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("delay is too long: " + delay, e);
            }
            this.delay = delay;
            return this;
        }

        /**
         * Capacity of the output channel. A full output makes the worker wait before forwarding.
         */
        public Builder<T> outputCapacity(int outputCapacity) {
            if (outputCapacity <= 0) throw new IllegalArgumentException("outputCapacity must be > 0");
            this.outputCapacity = outputCapacity;
            return this;
        }

        /**
         * Executor running the worker. Defaults to a new daemon thread per channel.
         */
        public Builder<T> executor(@NotNull Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        public Builder<T> addListener(@NotNull RateLimiterEventListener<? super T> l) {
            listeners.add(Objects.requireNonNull(l, "listener"));
            return this;
        }

        /**
         * Creates the output channel and starts the worker.
         *
         * @return the receiver of the throttled stream
         * @throws RejectedExecutionException if the executor refuses the worker; the output is closed then
         */
        public @NotNull ChannelReceiver<T> build() {
            Objects.requireNonNull(input, "input");
            Objects.requireNonNull(delay, "delay");

            Channel<T> output = Channel.bounded(outputCapacity);
            UUID id = UuidProvider.generateUuid();
            RateLimiterWorker<T> worker = new RateLimiterWorker<>(
                    id, input, output.sender(), delay.toNanos(), listeners);

            if (executor == null) {
                startWorkerThread(worker, id);
                return output.receiver();
            }
            try {
                executor.execute(worker);
            } catch (RejectedExecutionException e) {
                output.sender().close();
                throw e;
            }
            return output.receiver();
        }
    }

    private static void startWorkerThread(Runnable worker, UUID id) {
        Thread t = new Thread(worker, "rate-limiter-worker-" + UuidProvider.shortId(id));
        t.setDaemon(true);
        t.setUncaughtExceptionHandler((th, e) ->
                logger.error("Uncaught in {}", th.getName(), e));
        t.start();
    }
}
