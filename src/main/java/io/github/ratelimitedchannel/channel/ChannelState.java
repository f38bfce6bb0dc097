package io.github.ratelimitedchannel.channel;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.ratelimitedchannel.base_exceptions.ChannelClosedException;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared state behind one channel: the buffer, the number of open senders and
 * whether the receiver is gone. Both endpoints delegate here.
 */
@ThreadSafe
final class ChannelState<T> {
    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    @GuardedBy("lock")
    private final ArrayDeque<T> buffer = new ArrayDeque<>();
    @GuardedBy("lock")
    private int openSenders = 1;
    @GuardedBy("lock")
    private boolean receiverClosed = false;

    ChannelState(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
    }

    int capacity() {
        return capacity;
    }

    void send(T value) throws ChannelClosedException, InterruptedException {
        Objects.requireNonNull(value, "value");
        lock.lockInterruptibly();
        try {
            while (!receiverClosed && buffer.size() >= capacity) {
                notFull.await();
            }
            if (receiverClosed) {
                throw new ChannelClosedException("Receiver is closed");
            }
            buffer.addLast(value);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    boolean trySend(T value) throws ChannelClosedException {
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            if (receiverClosed) {
                throw new ChannelClosedException("Receiver is closed");
            }
            if (buffer.size() >= capacity) return false;
            buffer.addLast(value);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    Receipt<T> receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            for (;;) {
                Receipt<T> r = pollLocked();
                if (r != null) return r;
                notEmpty.await();
            }
        } finally {
            lock.unlock();
        }
    }

    Receipt<T> receive(long timeoutNanos) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            long nanosRemaining = timeoutNanos;
            for (;;) {
                Receipt<T> r = pollLocked();
                if (r != null) return r;
                if (nanosRemaining <= 0) return Receipt.timedOut();
                nanosRemaining = notEmpty.awaitNanos(nanosRemaining);
            }
        } finally {
            lock.unlock();
        }
    }

    Receipt<T> poll() {
        lock.lock();
        try {
            Receipt<T> r = pollLocked();
            return r != null ? r : Receipt.timedOut();
        } finally {
            lock.unlock();
        }
    }

    // null when the caller has to wait
    @GuardedBy("lock")
    private Receipt<T> pollLocked() {
        if (receiverClosed) return Receipt.closed();
        T value = buffer.pollFirst();
        if (value != null) {
            notFull.signal();
            return Receipt.received(value);
        }
        return openSenders == 0 ? Receipt.closed() : null;
    }

    void addSender() {
        lock.lock();
        try {
            if (openSenders == 0) {
                throw new IllegalStateException("All senders are closed");
            }
            openSenders++;
        } finally {
            lock.unlock();
        }
    }

    void releaseSender() {
        lock.lock();
        try {
            if (--openSenders == 0) {
                notEmpty.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    void closeReceiver() {
        lock.lock();
        try {
            if (receiverClosed) return;
            receiverClosed = true;
            buffer.clear();
            notFull.signalAll();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    boolean isReceiverClosed() {
        lock.lock();
        try {
            return receiverClosed;
        } finally {
            lock.unlock();
        }
    }

    boolean isDrainedAndClosed() {
        lock.lock();
        try {
            return receiverClosed || (openSenders == 0 && buffer.isEmpty());
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }
}
