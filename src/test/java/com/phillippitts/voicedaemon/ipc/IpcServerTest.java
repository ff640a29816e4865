package com.phillippitts.voicedaemon.ipc;

import com.phillippitts.voicedaemon.client.DaemonClient;
import com.phillippitts.voicedaemon.config.DaemonProperties;
import com.phillippitts.voicedaemon.domain.CommandKind;
import com.phillippitts.voicedaemon.domain.DaemonResponse;
import com.phillippitts.voicedaemon.domain.DaemonSnapshot;
import com.phillippitts.voicedaemon.exception.DaemonAlreadyRunningException;
import com.phillippitts.voicedaemon.service.dispatch.CommandDispatcher;
import com.phillippitts.voicedaemon.service.metrics.DaemonMetrics;
import com.phillippitts.voicedaemon.service.session.BroadcastHub;
import com.phillippitts.voicedaemon.service.session.SessionRegistry;
import com.phillippitts.voicedaemon.service.state.DaemonController;
import com.phillippitts.voicedaemon.service.state.DaemonStateMachine;
import com.phillippitts.voicedaemon.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class IpcServerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @TempDir
    Path tempDir;

    private DaemonProperties properties;
    private SessionRegistry registry;
    private BroadcastHub hub;
    private DaemonController controller;
    private IpcServer server;

    @BeforeEach
    void setUp() {
        properties = new DaemonProperties();
        properties.setRuntimeDir(tempDir.resolve("run").toString());
        registry = new SessionRegistry(properties);
        DaemonMetrics metrics = new DaemonMetrics(new SimpleMeterRegistry());
        hub = new BroadcastHub(registry, metrics);
        CommandDispatcher dispatcher = mock(CommandDispatcher.class);
        when(dispatcher.dispatch(anyString(), any())).thenReturn(
                DaemonResponse.success(DaemonSnapshot.initial(), Map.of("message", "PONG")));
        controller = new DaemonController(dispatcher, hub, registry,
                new DaemonStateMachine(event -> { }, metrics), new SyncExecutor());
        server = new IpcServer(properties, registry, controller);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void servesRequestsOverOwnerOnlySocket() throws Exception {
        server.start();

        assertThat(Files.getPosixFilePermissions(server.socketPath()))
                .isEqualTo(PosixFilePermissions.fromString("rw-------"));
        assertThat(Files.readString(tempDir.resolve("run").resolve(properties.getPidFileName())))
                .isEqualTo(Long.toString(ProcessHandle.current().pid()));

        try (DaemonClient client = DaemonClient.connect(server.socketPath())) {
            DaemonResponse response = client.request(CommandKind.PING, TIMEOUT);
            assertThat(response.dataString("message")).isEqualTo("PONG");
            assertThat(registry.size()).isEqualTo(1);
        }
        await().atMost(TIMEOUT).until(() -> registry.size() == 0 && server.connectionCount() == 0);
    }

    @Test
    void broadcastsReachConnectedClients() throws Exception {
        server.start();
        List<DaemonResponse> events = new CopyOnWriteArrayList<>();

        try (DaemonClient client = DaemonClient.connect(server.socketPath())) {
            client.addEventListener(events::add);
            client.request(CommandKind.PING, TIMEOUT);

            hub.publish(DaemonResponse.event("recording_started", DaemonSnapshot.initial(), null));

            await().atMost(TIMEOUT).until(() -> events.size() == 1);
            assertThat(events.get(0).event()).isEqualTo("recording_started");
        }
    }

    @Test
    void oversizedFrameIsAnsweredThenConnectionClosed() throws Exception {
        server.start();

        try (SocketChannel raw = SocketChannel.open(UnixDomainSocketAddress.of(server.socketPath()))) {
            raw.write(ByteBuffer.allocate(4).putInt(0, properties.getMaxFrameBytes() + 1));

            FrameReader reader = new FrameReader(raw, properties.getMaxFrameBytes());
            DaemonResponse error = ProtocolCodec.decodeResponse(reader.readFrame());
            assertThat(error.errorType()).isEqualTo("FramingError");
            assertThat(error.error()).contains("exceeds limit");
            assertThat(reader.readFrame()).isNull();
        }
    }

    @Test
    void staleSocketIsReplaced() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("run"));
        Path stale = dir.resolve(properties.getSocketName());
        try (ServerSocketChannel crashed = ServerSocketChannel.open(StandardProtocolFamily.UNIX)) {
            crashed.bind(UnixDomainSocketAddress.of(stale));
        }
        assertThat(stale).exists();

        server.start();

        assertThat(server.isRunning()).isTrue();
        try (DaemonClient client = DaemonClient.connect(server.socketPath())) {
            assertThat(client.request(CommandKind.PING, TIMEOUT).isSuccess()).isTrue();
        }
    }

    @Test
    void secondDaemonRefusesLiveSocket() {
        server.start();
        IpcServer second = new IpcServer(properties, registry, controller);

        assertThatThrownBy(second::start).isInstanceOf(DaemonAlreadyRunningException.class);
        assertThat(server.socketPath()).exists();
    }

    @Test
    void stopRemovesFilesAndDisconnectsClients() throws Exception {
        server.start();
        Path socket = server.socketPath();
        DaemonClient client = DaemonClient.connect(socket);
        client.request(CommandKind.PING, TIMEOUT);

        server.stop();

        assertThat(socket).doesNotExist();
        assertThat(tempDir.resolve("run").resolve(properties.getPidFileName())).doesNotExist();
        await().atMost(TIMEOUT).until(() -> !client.isConnected());
        client.close();
    }
}
