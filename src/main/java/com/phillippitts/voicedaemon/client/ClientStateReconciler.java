package com.phillippitts.voicedaemon.client;

import com.phillippitts.voicedaemon.domain.CommandKind;
import com.phillippitts.voicedaemon.domain.DaemonResponse;
import com.phillippitts.voicedaemon.domain.DaemonSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Keeps a client-side view of the daemon state that never moves backwards.
 *
 * <p>Pushed events are the primary source; a low-frequency {@code GET_STATUS} poll repairs the
 * view after dropped events. Whichever source carries the higher sequence number wins, and the
 * listener hears only about strictly newer snapshots, in sequence order.
 */
public final class ClientStateReconciler implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ClientStateReconciler.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);
    private static final Duration POLL_TIMEOUT = Duration.ofSeconds(2);

    private final DaemonClient client;
    private final Consumer<DaemonSnapshot> listener;
    private final Duration pollInterval;
    private final Consumer<DaemonResponse> eventHook = this::onEvent;

    private ScheduledExecutorService poller;
    private DaemonSnapshot latest;

    public ClientStateReconciler(DaemonClient client, Consumer<DaemonSnapshot> listener, Duration pollInterval) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
    }

    public ClientStateReconciler(DaemonClient client, Consumer<DaemonSnapshot> listener) {
        this(client, listener, DEFAULT_POLL_INTERVAL);
    }

    public synchronized void start() {
        if (poller != null) {
            return;
        }
        client.addEventListener(eventHook);
        poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "voicedaemon-status-poll");
            t.setDaemon(true);
            return t;
        });
        poller.scheduleWithFixedDelay(this::poll, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** The newest snapshot seen so far, or null before the first one. */
    public synchronized DaemonSnapshot latest() {
        return latest;
    }

    /**
     * Offers a snapshot from any source.
     *
     * @return true if it was newer and the listener was notified
     */
    public synchronized boolean offer(DaemonSnapshot candidate) {
        if (candidate == null || !candidate.isNewerThan(latest)) {
            return false;
        }
        latest = candidate;
        listener.accept(candidate);
        return true;
    }

    void poll() {
        if (!client.isConnected()) {
            return;
        }
        try {
            DaemonResponse status = client.request(CommandKind.GET_STATUS, POLL_TIMEOUT);
            offer(status.state());
        } catch (IOException | TimeoutException e) {
            LOG.debug("Status poll failed: {}", e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void onEvent(DaemonResponse event) {
        offer(event.state());
    }

    @Override
    public synchronized void close() {
        client.removeEventListener(eventHook);
        if (poller != null) {
            poller.shutdownNow();
            poller = null;
        }
    }
}
