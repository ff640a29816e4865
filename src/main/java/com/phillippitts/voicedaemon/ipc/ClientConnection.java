package com.phillippitts.voicedaemon.ipc;

import com.phillippitts.voicedaemon.domain.DaemonResponse;
import com.phillippitts.voicedaemon.exception.FramingException;
import com.phillippitts.voicedaemon.service.session.Session;
import com.phillippitts.voicedaemon.service.state.DaemonController;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.channels.SocketChannel;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One accepted client: a reader thread that hands frames to the controller and a writer thread
 * that drains the session's outbound queue.
 *
 * <p>A framing error stops the reader; the writer still delivers the queued error response and
 * then closes the connection. Any other end of either loop closes both.
 */
final class ClientConnection {

    private static final Logger LOG = LogManager.getLogger(ClientConnection.class);

    private final SocketChannel channel;
    private final Session session;
    private final DaemonController controller;
    private final int maxFrameBytes;
    private final Consumer<ClientConnection> onClosed;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private Thread reader;
    private Thread writer;

    ClientConnection(SocketChannel channel,
                     Session session,
                     DaemonController controller,
                     int maxFrameBytes,
                     Consumer<ClientConnection> onClosed) {
        this.channel = channel;
        this.session = session;
        this.controller = controller;
        this.maxFrameBytes = maxFrameBytes;
        this.onClosed = onClosed;
    }

    Session session() {
        return session;
    }

    void start() {
        String tag = session.id().toString().substring(0, 8);
        reader = new Thread(this::readLoop, "ipc-reader-" + tag);
        writer = new Thread(this::writeLoop, "ipc-writer-" + tag);
        reader.setDaemon(true);
        writer.setDaemon(true);
        writer.start();
        reader.start();
    }

    private void readLoop() {
        FrameReader frames = new FrameReader(channel, maxFrameBytes);
        try {
            String frame;
            while ((frame = frames.readFrame()) != null) {
                controller.submit(session, frame);
            }
            LOG.debug("Session {} closed its end", session.id());
        } catch (FramingException e) {
            controller.rejectFrame(session, e);
            return;
        } catch (IOException e) {
            if (!closed.get()) {
                LOG.debug("Read failed on session {}: {}", session.id(), e.toString());
            }
        }
        close();
    }

    private void writeLoop() {
        FrameWriter frames = new FrameWriter(channel, maxFrameBytes);
        try {
            DaemonResponse next;
            while ((next = session.take()) != null) {
                try {
                    frames.writeFrame(ProtocolCodec.encodeResponse(next));
                } catch (FramingException e) {
                    LOG.warn("Dropping outbound message for session {}: {}", session.id(), e.getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            if (!closed.get()) {
                LOG.debug("Write failed on session {}: {}", session.id(), e.toString());
            }
        }
        close();
    }

    /**
     * Unregisters the session and closes the socket. Idempotent.
     */
    void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        controller.disconnected(session);
        try {
            channel.close();
        } catch (IOException e) {
            LOG.debug("Error closing channel of session {}: {}", session.id(), e.toString());
        }
        onClosed.accept(this);
    }

    void join(long millis) throws InterruptedException {
        if (reader != null) {
            reader.join(millis);
        }
        if (writer != null) {
            writer.join(millis);
        }
    }
}
