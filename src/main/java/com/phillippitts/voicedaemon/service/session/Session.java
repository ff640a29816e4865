package com.phillippitts.voicedaemon.service.session;

import com.phillippitts.voicedaemon.domain.DaemonResponse;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One connected client: identity, bounded outbound queue and liveness.
 *
 * <p>Queue policy:
 * <ul>
 *   <li>responses to the session's own requests are never dropped</li>
 *   <li>when the queue is full, the oldest queued <em>event</em> is dropped for the newest
 *       message; order of the remaining messages is preserved</li>
 *   <li>a session whose queue cannot make room, or that keeps dropping events without its
 *       writer making progress, reports that it must be evicted</li>
 * </ul>
 *
 * <p>Producers (control thread, broadcast) never block. The connection's writer thread
 * consumes with {@link #take()}.
 */
public final class Session {

    /** Outcome of offering an event. */
    public enum OfferResult {
        QUEUED,
        DROPPED,
        EVICT
    }

    private final UUID id;
    private final int capacity;
    private final int maxConsecutiveDrops;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition drained = lock.newCondition();
    private final Deque<DaemonResponse> queue = new ArrayDeque<>();

    private boolean alive = true;
    private boolean closing = false;
    private int consecutiveDrops = 0;

    public Session(UUID id, int capacity, int maxConsecutiveDrops) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.capacity = capacity;
        this.maxConsecutiveDrops = maxConsecutiveDrops;
    }

    public UUID id() {
        return id;
    }

    /**
     * Queues a response for this session.
     *
     * @return false if the session is dead or its queue holds only undelivered responses
     */
    public boolean offerResponse(DaemonResponse response) {
        lock.lock();
        try {
            if (!alive) {
                return false;
            }
            if (queue.size() >= capacity && !dropOldestEvent()) {
                return false;
            }
            queue.addLast(response);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queues a broadcast event without blocking.
     */
    public OfferResult offerEvent(DaemonResponse event) {
        lock.lock();
        try {
            if (!alive || closing) {
                return OfferResult.DROPPED;
            }
            if (queue.size() < capacity) {
                queue.addLast(event);
                notEmpty.signal();
                return OfferResult.QUEUED;
            }
            consecutiveDrops++;
            if (dropOldestEvent()) {
                queue.addLast(event);
                notEmpty.signal();
            }
            return consecutiveDrops > maxConsecutiveDrops ? OfferResult.EVICT : OfferResult.DROPPED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a message is available.
     *
     * @return next message, or null once the session is closed (or closing and drained)
     */
    public DaemonResponse take() throws InterruptedException {
        lock.lock();
        try {
            while (queue.isEmpty() && alive && !closing) {
                notEmpty.await();
            }
            DaemonResponse next = alive ? queue.pollFirst() : null;
            if (next != null) {
                consecutiveDrops = 0;
            }
            if (queue.isEmpty()) {
                drained.signalAll();
            }
            return next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until the writer has taken every queued message.
     *
     * @return true if drained within the timeout
     */
    public boolean awaitDrained(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (!queue.isEmpty() && alive) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = drained.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Lets the writer deliver what is queued, then end. Used after a fatal framing error so
     * the error response still reaches the client.
     */
    public void closeAfterFlush() {
        lock.lock();
        try {
            closing = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the session dead and discards its queue. Idempotent.
     *
     * @return true if this call closed a live session
     */
    public boolean close() {
        lock.lock();
        try {
            if (!alive) {
                return false;
            }
            alive = false;
            queue.clear();
            notEmpty.signalAll();
            drained.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isAlive() {
        lock.lock();
        try {
            return alive;
        } finally {
            lock.unlock();
        }
    }

    public int queuedCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    private boolean dropOldestEvent() {
        Iterator<DaemonResponse> it = queue.iterator();
        while (it.hasNext()) {
            if (it.next().isEvent()) {
                it.remove();
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "Session[" + id + "]";
    }
}
