package com.phillippitts.voicedaemon.service.state;

import com.phillippitts.voicedaemon.config.DaemonProperties;
import com.phillippitts.voicedaemon.ipc.IpcServer;
import com.phillippitts.voicedaemon.service.session.BroadcastHub;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;

/**
 * Sequences process exit after {@code SHUTDOWN}: flush outbound queues, close the transport,
 * close the Spring context and exit the JVM.
 *
 * <p>Runs on its own {@code daemon-shutdown} thread because closing the context stops every
 * executor, including the one that would otherwise be running this sequence.
 */
@Component
public class ShutdownCoordinator {

    private static final Logger LOG = LogManager.getLogger(ShutdownCoordinator.class);

    private final BroadcastHub hub;
    private final ObjectProvider<IpcServer> server;
    private final ConfigurableApplicationContext context;
    private final DaemonProperties properties;
    private final IntConsumer exit;
    private final AtomicBoolean initiated = new AtomicBoolean(false);

    @Autowired
    public ShutdownCoordinator(BroadcastHub hub,
                               ObjectProvider<IpcServer> server,
                               ConfigurableApplicationContext context,
                               DaemonProperties properties) {
        this(hub, server, context, properties, System::exit);
    }

    ShutdownCoordinator(BroadcastHub hub,
                        ObjectProvider<IpcServer> server,
                        ConfigurableApplicationContext context,
                        DaemonProperties properties,
                        IntConsumer exit) {
        this.hub = hub;
        this.server = server;
        this.context = context;
        this.properties = properties;
        this.exit = exit;
    }

    /**
     * Starts the shutdown sequence once; later calls are ignored.
     */
    public void initiate() {
        if (!initiated.compareAndSet(false, true)) {
            return;
        }
        Thread thread = new Thread(this::shutdownNow, "daemon-shutdown");
        thread.start();
    }

    void shutdownNow() {
        LOG.info("Shutting down: flushing outbound queues");
        hub.flush(Duration.ofMillis(properties.getShutdownFlushTimeoutMs()));
        server.ifAvailable(IpcServer::stop);
        int code = SpringApplication.exit(context, () -> 0);
        LOG.info("Daemon stopped (exit code {})", code);
        exit.accept(code);
    }
}
