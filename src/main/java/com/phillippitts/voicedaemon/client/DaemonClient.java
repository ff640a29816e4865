package com.phillippitts.voicedaemon.client;

import com.phillippitts.voicedaemon.domain.Command;
import com.phillippitts.voicedaemon.domain.CommandKind;
import com.phillippitts.voicedaemon.domain.CommandPayload;
import com.phillippitts.voicedaemon.domain.DaemonResponse;
import com.phillippitts.voicedaemon.exception.VoiceDaemonException;
import com.phillippitts.voicedaemon.ipc.FrameReader;
import com.phillippitts.voicedaemon.ipc.FrameWriter;
import com.phillippitts.voicedaemon.ipc.ProtocolCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Client side of the daemon socket.
 *
 * <p>One reader thread routes {@code response} frames to the single outstanding request and
 * {@code event} frames to the registered listeners. Requests are serialized: the daemon answers
 * a session's requests in order, so at most one is pending at a time.
 */
public final class DaemonClient implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(DaemonClient.class);

    /** Default frame limit, matching the daemon's. */
    public static final int DEFAULT_MAX_FRAME_BYTES = 10 * 1024 * 1024;

    private final SocketChannel channel;
    private final FrameWriter writer;
    private final FrameReader reader;
    private final List<Consumer<DaemonResponse>> eventListeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<CompletableFuture<DaemonResponse>> pending = new AtomicReference<>();
    private final Object routeLock = new Object();
    // Requests given up on before their response arrived; guarded by routeLock
    private int abandoned;
    private final Thread readerThread;
    private volatile boolean closed;

    DaemonClient(SocketChannel channel, int maxFrameBytes) {
        this.channel = channel;
        this.writer = new FrameWriter(channel, maxFrameBytes);
        this.reader = new FrameReader(channel, maxFrameBytes);
        this.readerThread = new Thread(this::readLoop, "voicedaemon-client-reader");
        this.readerThread.setDaemon(true);
        this.readerThread.start();
    }

    /**
     * Connects to a running daemon.
     *
     * @throws IOException if nothing listens on {@code socket}
     */
    public static DaemonClient connect(Path socket) throws IOException {
        SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            channel.connect(UnixDomainSocketAddress.of(socket));
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        return new DaemonClient(channel, DEFAULT_MAX_FRAME_BYTES);
    }

    public void addEventListener(Consumer<DaemonResponse> listener) {
        eventListeners.add(listener);
    }

    public void removeEventListener(Consumer<DaemonResponse> listener) {
        eventListeners.remove(listener);
    }

    public DaemonResponse request(CommandKind kind, Duration timeout)
            throws IOException, TimeoutException, InterruptedException {
        return request(kind, CommandPayload.NoPayload.INSTANCE, timeout);
    }

    /**
     * Sends one command and waits for its response. Events that arrive meanwhile go to the
     * listeners.
     *
     * @throws IOException if the connection is or becomes closed
     * @throws TimeoutException if no response arrives in time; the late response is dropped when
     *         it arrives, so it is never mistaken for the answer to a later request
     */
    public synchronized DaemonResponse request(CommandKind kind, CommandPayload payload, Duration timeout)
            throws IOException, TimeoutException, InterruptedException {
        if (closed) {
            throw new IOException("Connection to daemon is closed");
        }
        CompletableFuture<DaemonResponse> response = new CompletableFuture<>();
        pending.set(response);
        try {
            writer.writeFrame(ProtocolCodec.encodeRequest(Command.of(kind, payload)));
            return response.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            abandon(response);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("Request failed: " + cause.getMessage(), cause);
        } finally {
            pending.compareAndSet(response, null);
        }
    }

    private void abandon(CompletableFuture<DaemonResponse> response) {
        synchronized (routeLock) {
            if (pending.compareAndSet(response, null)) {
                abandoned++;
            }
        }
    }

    public boolean isConnected() {
        return !closed;
    }

    private void readLoop() {
        IOException failure = new IOException("Daemon closed the connection");
        try {
            String frame;
            while ((frame = reader.readFrame()) != null) {
                route(ProtocolCodec.decodeResponse(frame));
            }
        } catch (IOException e) {
            failure = e;
        } catch (VoiceDaemonException e) {
            failure = new IOException("Unreadable frame from daemon: " + e.getMessage(), e);
        }
        if (!closed) {
            LOG.debug("Client reader ended: {}", failure.getMessage());
        }
        closed = true;
        CompletableFuture<DaemonResponse> waiting = pending.getAndSet(null);
        if (waiting != null) {
            waiting.completeExceptionally(failure);
        }
    }

    private void route(DaemonResponse message) {
        if (message.isEvent()) {
            for (Consumer<DaemonResponse> listener : eventListeners) {
                try {
                    listener.accept(message);
                } catch (RuntimeException e) {
                    LOG.warn("Event listener failed on {}", message.event(), e);
                }
            }
            return;
        }
        CompletableFuture<DaemonResponse> waiting;
        synchronized (routeLock) {
            if (abandoned > 0) {
                abandoned--;
                LOG.debug("Late response to an abandoned request dropped");
                return;
            }
            waiting = pending.getAndSet(null);
        }
        if (waiting == null) {
            LOG.debug("Unsolicited response dropped");
            return;
        }
        waiting.complete(message);
    }

    @Override
    public void close() {
        closed = true;
        try {
            channel.close();
        } catch (IOException e) {
            LOG.debug("Error closing client channel: {}", e.toString());
        }
        try {
            readerThread.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
