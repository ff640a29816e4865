package com.phillippitts.voicedaemon.service.session;

import com.phillippitts.voicedaemon.domain.DaemonResponse;
import com.phillippitts.voicedaemon.service.metrics.DaemonMetrics;
import com.phillippitts.voicedaemon.service.state.StateEventListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Fans state events out to every live session and delivers responses to their requester.
 *
 * <p>Never blocks the caller: a full queue drops its oldest event, and a session that cannot
 * keep up is evicted from the registry.
 */
@Component
public class BroadcastHub implements StateEventListener {

    private static final Logger LOG = LogManager.getLogger(BroadcastHub.class);

    private final SessionRegistry registry;
    private final DaemonMetrics metrics;

    public BroadcastHub(SessionRegistry registry, DaemonMetrics metrics) {
        this.registry = registry;
        this.metrics = metrics;
    }

    @Override
    public void onStateEvent(DaemonResponse event) {
        publish(event);
    }

    public void publish(DaemonResponse event) {
        for (Session session : registry.sessions()) {
            switch (session.offerEvent(event)) {
                case QUEUED -> { }
                case DROPPED -> {
                    metrics.eventDropped();
                    LOG.warn("Session {} queue full, dropped oldest event", session.id());
                }
                case EVICT -> evict(session, "too many consecutive dropped events");
            }
        }
    }

    /**
     * Queues a response for its requesting session. A session that cannot accept it is evicted.
     */
    public void sendTo(Session session, DaemonResponse response) {
        if (!session.offerResponse(response) && session.isAlive()) {
            evict(session, "queue full of undelivered responses");
        }
    }

    /**
     * Waits until every session's queue has been written out.
     *
     * @return true if all queues drained within the timeout
     */
    public boolean flush(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean drained = true;
        for (Session session : registry.sessions()) {
            long remaining = deadline - System.nanoTime();
            try {
                drained &= session.awaitDrained(Duration.ofNanos(Math.max(0, remaining)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        if (!drained) {
            LOG.warn("Outbound queues not drained within {} ms", timeout.toMillis());
        }
        return drained;
    }

    private void evict(Session session, String reason) {
        if (registry.unregister(session.id())) {
            metrics.sessionEvicted();
            LOG.warn("Evicted session {}: {}", session.id(), reason);
        }
    }
}
