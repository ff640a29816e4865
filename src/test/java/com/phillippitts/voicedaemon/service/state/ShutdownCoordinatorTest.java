package com.phillippitts.voicedaemon.service.state;

import com.phillippitts.voicedaemon.config.DaemonProperties;
import com.phillippitts.voicedaemon.ipc.IpcServer;
import com.phillippitts.voicedaemon.service.session.BroadcastHub;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ConfigurableApplicationContext;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ShutdownCoordinatorTest {

    private BroadcastHub hub;
    private IpcServer server;
    private ConfigurableApplicationContext context;
    private IntConsumer exit;
    private ShutdownCoordinator coordinator;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        hub = mock(BroadcastHub.class);
        server = mock(IpcServer.class);
        context = mock(ConfigurableApplicationContext.class);
        exit = mock(IntConsumer.class);
        ObjectProvider<IpcServer> provider = mock(ObjectProvider.class);
        doAnswer(invocation -> {
            ((Consumer<IpcServer>) invocation.getArgument(0)).accept(server);
            return null;
        }).when(provider).ifAvailable(any());
        DaemonProperties properties = new DaemonProperties();
        properties.setShutdownFlushTimeoutMs(250);
        coordinator = new ShutdownCoordinator(hub, provider, context, properties, exit);
    }

    @Test
    void flushesThenStopsTransportThenExits() {
        coordinator.shutdownNow();

        InOrder order = inOrder(hub, server, context, exit);
        order.verify(hub).flush(Duration.ofMillis(250));
        order.verify(server).stop();
        order.verify(context).close();
        order.verify(exit).accept(0);
    }

    @Test
    void initiateRunsOnlyOnce() {
        coordinator.initiate();
        coordinator.initiate();

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> verify(exit).accept(0));
        verify(hub, times(1)).flush(any());
    }
}
