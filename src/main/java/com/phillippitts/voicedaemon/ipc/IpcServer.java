package com.phillippitts.voicedaemon.ipc;

import com.phillippitts.voicedaemon.config.DaemonProperties;
import com.phillippitts.voicedaemon.exception.DaemonAlreadyRunningException;
import com.phillippitts.voicedaemon.service.session.Session;
import com.phillippitts.voicedaemon.service.session.SessionRegistry;
import com.phillippitts.voicedaemon.service.state.DaemonController;
import com.phillippitts.voicedaemon.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Accepts local clients on {@code <runtime-dir>/voicedaemon.sock}.
 *
 * <p>On start the runtime directory is secured, a stale socket from a crashed daemon is removed
 * (a socket that still accepts connections means another daemon owns it), the socket is bound
 * with mode {@code 0600} and the pid file is written. Stop removes both files.
 */
@Component
@ConditionalOnProperty(prefix = "daemon.server", name = "enabled", havingValue = "true", matchIfMissing = true)
public class IpcServer implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(IpcServer.class);

    private final DaemonProperties properties;
    private final SessionRegistry registry;
    private final DaemonController controller;
    private final Set<ClientConnection> connections = ConcurrentHashMap.newKeySet();

    private volatile boolean running;
    private ServerSocketChannel server;
    private Thread acceptThread;
    private Path socketPath;
    private Path pidPath;

    public IpcServer(DaemonProperties properties, SessionRegistry registry, DaemonController controller) {
        this.properties = properties;
        this.registry = registry;
        this.controller = controller;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        Path dir = SecureRuntimeDirectory.forCurrentUser(properties.getRuntimeDir()).prepare();
        socketPath = dir.resolve(properties.getSocketName());
        pidPath = dir.resolve(properties.getPidFileName());
        clearStaleSocket(socketPath);
        try {
            server = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
            server.bind(UnixDomainSocketAddress.of(socketPath));
            if (socketPath.getFileSystem().supportedFileAttributeViews().contains("posix")) {
                Files.setPosixFilePermissions(socketPath, PosixFilePermissions.fromString("rw-------"));
            }
            Files.writeString(pidPath, Long.toString(ProcessHandle.current().pid()));
        } catch (IOException e) {
            closeServerQuietly();
            throw new UncheckedIOException("Cannot bind daemon socket " + socketPath, e);
        }
        running = true;
        acceptThread = new Thread(this::acceptLoop, "ipc-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        LOG.info("Listening on {}", socketPath);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        closeServerQuietly();
        List<ClientConnection> open = List.copyOf(connections);
        open.forEach(ClientConnection::close);
        try {
            acceptThread.join(ProcessTimeouts.CONNECTION_THREAD_JOIN_TIMEOUT.toMillis());
            for (ClientConnection connection : open) {
                connection.join(ProcessTimeouts.CONNECTION_THREAD_JOIN_TIMEOUT.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        deleteQuietly(socketPath);
        deleteQuietly(pidPath);
        LOG.info("Socket server stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public Path socketPath() {
        return socketPath;
    }

    int connectionCount() {
        return connections.size();
    }

    private void acceptLoop() {
        while (running) {
            SocketChannel channel;
            try {
                channel = server.accept();
            } catch (ClosedChannelException e) {
                break;
            } catch (IOException e) {
                if (running) {
                    LOG.error("Accept failed on {}", socketPath, e);
                }
                continue;
            }
            Session session = registry.open();
            ClientConnection connection = new ClientConnection(channel, session, controller,
                    properties.getMaxFrameBytes(), connections::remove);
            connections.add(connection);
            connection.start();
        }
        LOG.debug("Accept loop ended");
    }

    static void clearStaleSocket(Path path) {
        if (Files.notExists(path)) {
            return;
        }
        try (SocketChannel probe = SocketChannel.open(UnixDomainSocketAddress.of(path))) {
            LOG.debug("Socket {} answered probe {}", path, probe.isConnected());
        } catch (IOException e) {
            LOG.info("Removing stale socket {}", path);
            deleteQuietly(path);
            return;
        }
        throw new DaemonAlreadyRunningException(path);
    }

    private void closeServerQuietly() {
        if (server == null) {
            return;
        }
        try {
            server.close();
        } catch (IOException e) {
            LOG.debug("Error closing server socket: {}", e.toString());
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not remove {}: {}", path, e.toString());
        }
    }
}
