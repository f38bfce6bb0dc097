package io.github.ratelimitedchannel.rate_limiter;

import io.github.ratelimitedchannel.base_exceptions.ChannelClosedException;
import io.github.ratelimitedchannel.channel.ChannelReceiver;
import io.github.ratelimitedchannel.channel.ChannelSender;
import io.github.ratelimitedchannel.channel.Receipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * The task behind a rate-limited channel.
 * <ul>
 *   <li>Idle: waits for the next input value.</li>
 *   <li>Holding: keeps the latest input value until {@code delay} has passed since the
 *       previous forward, replacing it with every newer arrival, then forwards it.</li>
 * </ul>
 * The first value is forwarded at once. The worker stops when the input is closed and
 * drained or when the output receiver is closed; either way both of its endpoints are
 * closed on exit.
 */
final class RateLimiterWorker<T> implements Runnable {
    private final static Logger logger = LoggerFactory.getLogger(RateLimiterWorker.class);

    private final UUID id;
    private final ChannelReceiver<T> input;
    private final ChannelSender<T> output;
    private final long delayNanos;
    private final List<RateLimiterEventListener<? super T>> listeners;

    RateLimiterWorker(UUID id, ChannelReceiver<T> input, ChannelSender<T> output, long delayNanos,
                      List<? extends RateLimiterEventListener<? super T>> listeners) {
        this.id = id;
        this.input = input;
        this.output = output;
        this.delayNanos = delayNanos;
        this.listeners = new CopyOnWriteArrayList<>(listeners);
    }

    @Override
    public void run() {
        logger.debug("Rate limiter worker {} started, delay {} ns", id, delayNanos);
        fire(l -> l.onStart(id));
        TerminationReason reason;
        try {
            reason = forwardLoop();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            reason = TerminationReason.INTERRUPTED;
        } catch (RuntimeException ex) {
            logger.error("Rate limiter worker {} failed", id, ex);
            fire(l -> l.onError(id, ex));
            reason = TerminationReason.FAILED;
        } finally {
            output.close();
            input.close();
        }
        logger.debug("Rate limiter worker {} stopped: {}", id, reason);
        final TerminationReason terminated = reason;
        fire(l -> l.onTerminate(id, terminated));
    }

    private TerminationReason forwardLoop() throws InterruptedException {
        // the first forward is not bound to any window
        boolean forwardedBefore = false;
        long lastForwardNanos = 0L;

        for (;;) {
            Receipt<T> first = input.receive();
            if (!first.isReceived()) {
                return TerminationReason.INPUT_CLOSED;
            }
            T pending = first.value();

            for (;;) {
                long now = System.nanoTime();
                // elapsed >= 0 and delay >= 0, so this cannot overflow
                long remainingNanos = forwardedBefore ? delayNanos - (now - lastForwardNanos) : 0L;

                if (remainingNanos <= 0) {
                    try {
                        output.send(pending);
                    } catch (ChannelClosedException e) {
                        discard(pending);
                        return TerminationReason.OUTPUT_CLOSED;
                    }
                    forwardedBefore = true;
                    lastForwardNanos = now;
                    forwarded(pending);
                    break;
                }

                Receipt<T> next = input.receive(Duration.ofNanos(remainingNanos));
                switch (next.getStatus()) {
                    case RECEIVED:
                        discard(pending);
                        pending = next.value();
                        break;
                    case CLOSED:
                        discard(pending);
                        return TerminationReason.INPUT_CLOSED;
                    case TIMED_OUT:
                        // window elapsed, forwarded on the next pass
                        break;
                }
            }
        }
    }

    private void forwarded(T value) {
        logger.debug("Worker {} forwarded {}", id, value);
        fire(l -> l.onForward(id, value));
    }

    private void discard(T value) {
        logger.trace("Worker {} discarded {}", id, value);
        fire(l -> l.onDiscard(id, value));
    }

    private void fire(Consumer<RateLimiterEventListener<? super T>> c) {
        for (RateLimiterEventListener<? super T> l : listeners) {
            try {
                c.accept(l);
            } catch (RuntimeException ex) {
                logger.warn("Listener {} of worker {} failed", l, id, ex);
            }
        }
    }
}
