package io.github.ratelimitedchannel.rate_limiter;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

class RecordingListener<T> implements RateLimiterEventListener<T> {
    final List<T> forwarded = new CopyOnWriteArrayList<>();
    final List<Long> forwardNanos = new CopyOnWriteArrayList<>();
    final List<T> discarded = new CopyOnWriteArrayList<>();
    final List<Throwable> errors = new CopyOnWriteArrayList<>();
    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch terminated = new CountDownLatch(1);
    volatile UUID workerId;
    volatile TerminationReason reason;
    private final boolean recordDiscards;

    RecordingListener() {
        this(true);
    }

    // bursts discard far too many values to keep them all
    RecordingListener(boolean recordDiscards) {
        this.recordDiscards = recordDiscards;
    }

    @Override
    public void onStart(UUID workerId) {
        this.workerId = workerId;
        started.countDown();
    }

    @Override
    public void onForward(UUID workerId, T value) {
        forwardNanos.add(System.nanoTime());
        forwarded.add(value);
    }

    @Override
    public void onDiscard(UUID workerId, T discarded) {
        if (recordDiscards) this.discarded.add(discarded);
    }

    @Override
    public void onError(UUID workerId, Throwable error) {
        errors.add(error);
    }

    @Override
    public void onTerminate(UUID workerId, TerminationReason reason) {
        this.reason = reason;
        terminated.countDown();
    }
}
