package com.phillippitts.voicedaemon.client;

import com.phillippitts.voicedaemon.domain.CommandKind;
import com.phillippitts.voicedaemon.domain.CommandPayload;
import com.phillippitts.voicedaemon.domain.DaemonPhase;
import com.phillippitts.voicedaemon.domain.DaemonResponse;
import com.phillippitts.voicedaemon.domain.DaemonSnapshot;
import com.phillippitts.voicedaemon.ipc.ProtocolCodec;
import com.phillippitts.voicedaemon.ipc.SecureRuntimeDirectory;
import org.json.JSONObject;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Command-line client of a running daemon.
 *
 * <p>Exit codes: 0 on success, 1 when the daemon answers with an error, 2 when the daemon
 * cannot be reached.
 */
@Command(
        name = "voicedaemon",
        mixinStandardHelpOptions = true,
        description = "Control a running voice daemon",
        subcommands = {
                VoiceDaemonCli.ToggleCommand.class,
                VoiceDaemonCli.StartCommand.class,
                VoiceDaemonCli.StopCommand.class,
                VoiceDaemonCli.StatusCommand.class,
                VoiceDaemonCli.PingCommand.class,
                VoiceDaemonCli.ProcessCommand.class,
                VoiceDaemonCli.TranslateCommand.class,
                VoiceDaemonCli.TranscribeCommand.class,
                VoiceDaemonCli.PauseCommand.class,
                VoiceDaemonCli.ResumeCommand.class,
                VoiceDaemonCli.RestartCommand.class,
                VoiceDaemonCli.ShutdownCommand.class,
                VoiceDaemonCli.ConfigCommand.class,
                VoiceDaemonCli.WatchCommand.class
        }
)
public final class VoiceDaemonCli implements Runnable {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR_RESPONSE = 1;
    static final int EXIT_UNREACHABLE = 2;

    private static final Set<String> TRANSCRIPTION_DONE = Set.of("transcription_completed", "transcription_failed");
    private static final Set<String> PROCESSING_DONE = Set.of("processing_completed", "processing_failed");

    @Option(names = {"--socket"}, description = "Daemon socket path (default: <runtime-dir>/voicedaemon.sock)")
    Path socket;

    @Option(names = {"--timeout"}, defaultValue = "5", description = "Seconds to wait for a response")
    long timeoutSeconds;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int code = new CommandLine(new VoiceDaemonCli()).execute(args);
        System.exit(code);
    }

    @Override
    public void run() {
        spec.commandLine().usage(out());
    }

    Path socketPath() {
        if (socket != null) {
            return socket;
        }
        return SecureRuntimeDirectory.forCurrentUser(null).directory().resolve("voicedaemon.sock");
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    int send(CommandKind kind, CommandPayload payload) {
        return send(kind, payload, Set.of(), Duration.ZERO);
    }

    /**
     * Sends one command and prints the answer. With {@code awaitEvents} non-empty, also waits for
     * the first event with one of those names and prints its data.
     */
    int send(CommandKind kind, CommandPayload payload, Set<String> awaitEvents, Duration eventTimeout) {
        DaemonClient client;
        try {
            client = DaemonClient.connect(socketPath());
        } catch (IOException e) {
            err().println("Daemon not reachable at " + socketPath() + ": " + e.getMessage());
            return EXIT_UNREACHABLE;
        }
        try (client) {
            CompletableFuture<DaemonResponse> outcome = new CompletableFuture<>();
            Consumer<DaemonResponse> watcher = event -> {
                if (awaitEvents.contains(event.event())) {
                    outcome.complete(event);
                }
            };
            client.addEventListener(watcher);
            DaemonResponse response = client.request(kind, payload, Duration.ofSeconds(timeoutSeconds));
            if (!response.isSuccess()) {
                err().println(response.errorType() + ": " + response.error());
                return EXIT_ERROR_RESPONSE;
            }
            print(response);
            if (awaitEvents.isEmpty()) {
                return EXIT_OK;
            }
            DaemonResponse event = outcome.get(eventTimeout.toMillis(), TimeUnit.MILLISECONDS);
            print(event);
            return event.isSuccess() ? EXIT_OK : EXIT_ERROR_RESPONSE;
        } catch (TimeoutException e) {
            err().println("Timed out waiting for the daemon");
            return EXIT_ERROR_RESPONSE;
        } catch (IOException | ExecutionException e) {
            err().println("Connection lost: " + e.getMessage());
            return EXIT_UNREACHABLE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EXIT_ERROR_RESPONSE;
        }
    }

    void print(DaemonResponse response) {
        if (response.isEvent() && !response.isSuccess()) {
            err().println(response.event() + ": " + response.error());
        }
        if (response.data() != null && !response.data().isEmpty()) {
            out().println(new JSONObject(response.data()).toString(2));
        } else {
            out().println(describe(response.state()));
        }
        out().flush();
    }

    static String describe(DaemonSnapshot state) {
        StringBuilder line = new StringBuilder()
                .append(state.phase().wireName())
                .append(" (seq ").append(state.sequence()).append(')');
        if (state.lastError() != null) {
            line.append(" last error: ").append(state.lastError());
        }
        return line.toString();
    }

    @Command(name = "toggle", description = "Start recording when idle, stop it when recording")
    static final class ToggleCommand implements Callable<Integer> {
        @ParentCommand
        VoiceDaemonCli parent;

        @Override
        public Integer call() {
            return parent.send(CommandKind.TOGGLE_RECORDING, CommandPayload.NoPayload.INSTANCE);
        }
    }

    @Command(name = "start", description = "Start recording")
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        VoiceDaemonCli parent;

        @Override
        public Integer call() {
            return parent.send(CommandKind.START_RECORDING, CommandPayload.NoPayload.INSTANCE);
        }
    }

    @Command(name = "stop", description = "Stop recording and print the transcript")
    static final class StopCommand implements Callable<Integer> {
        @ParentCommand
        VoiceDaemonCli parent;

        @Option(names = {"--wait"}, defaultValue = "120", description = "Seconds to wait for the transcript")
        long waitSeconds;

        @Override
        public Integer call() {
            return parent.send(CommandKind.STOP_RECORDING, CommandPayload.NoPayload.INSTANCE,
                    TRANSCRIPTION_DONE, Duration.ofSeconds(waitSeconds));
        }
    }

    @Command(name = "status", description = "Show daemon state, sessions and telemetry")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        VoiceDaemonCli parent;

        @Override
        public Integer call() {
            return parent.send(CommandKind.GET_STATUS, CommandPayload.NoPayload.INSTANCE);
        }
    }

    @Command(name = "ping", description = "Check that the daemon answers")
    static final class PingCommand implements Callable<Integer> {
        @ParentCommand
        VoiceDaemonCli parent;

        @Override
        public Integer call() {
            return parent.send(CommandKind.PING, CommandPayload.NoPayload.INSTANCE);
        }
    }

    @Command(name = "process", description = "Refine text through the configured language model")
    static final class ProcessCommand implements Callable<Integer> {
        @ParentCommand
        VoiceDaemonCli parent;

        @Parameters(arity = "1..*", description = "Text to refine")
        List<String> words;

        @Option(names = {"--wait"}, defaultValue = "120", description = "Seconds to wait for the result")
        long waitSeconds;

        @Override
        public Integer call() {
            return parent.send(CommandKind.PROCESS_TEXT, new CommandPayload.TextPayload(String.join(" ", words)),
                    PROCESSING_DONE, Duration.ofSeconds(waitSeconds));
        }
    }

    @Command(name = "translate", description = "Translate text through the configured language model")
    static final class TranslateCommand implements Callable<Integer> {
        @ParentCommand
        VoiceDaemonCli parent;

        @Parameters(arity = "1..*", description = "Text to translate")
        List<String> words;

        @Option(names = {"--to"}, defaultValue = ProtocolCodec.DEFAULT_TARGET_LANGUAGE, description = "Target language")
        String targetLanguage;

        @Option(names = {"--wait"}, defaultValue = "120", description = "Seconds to wait for the result")
        long waitSeconds;

        @Override
        public Integer call() {
            CommandPayload payload = new CommandPayload.TranslationPayload(String.join(" ", words), targetLanguage);
            return parent.send(CommandKind.TRANSLATE_TEXT, payload, PROCESSING_DONE, Duration.ofSeconds(waitSeconds));
        }
    }

    @Command(name = "transcribe", description = "Transcribe a 16 kHz 16-bit mono WAV file")
    static final class TranscribeCommand implements Callable<Integer> {
        @ParentCommand
        VoiceDaemonCli parent;

        @Parameters(index = "0", description = "WAV file to transcribe")
        Path file;

        @Option(names = {"--wait"}, defaultValue = "300", description = "Seconds to wait for the transcript")
        long waitSeconds;

        @Override
        public Integer call() {
            CommandPayload payload = new CommandPayload.FilePayload(file.toAbsolutePath().toString());
            return parent.send(CommandKind.TRANSCRIBE_FILE, payload, TRANSCRIPTION_DONE, Duration.ofSeconds(waitSeconds));
        }
    }

    @Command(name = "pause", description = "Pause the daemon, discarding in-flight work")
    static final class PauseCommand implements Callable<Integer> {
        @ParentCommand
        VoiceDaemonCli parent;

        @Override
        public Integer call() {
            return parent.send(CommandKind.PAUSE, CommandPayload.NoPayload.INSTANCE);
        }
    }

    @Command(name = "resume", description = "Resume from paused or error")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        VoiceDaemonCli parent;

        @Override
        public Integer call() {
            return parent.send(CommandKind.RESUME, CommandPayload.NoPayload.INSTANCE);
        }
    }

    @Command(name = "restart", description = "Restart the speech engine")
    static final class RestartCommand implements Callable<Integer> {
        @ParentCommand
        VoiceDaemonCli parent;

        @Override
        public Integer call() {
            return parent.send(CommandKind.RESTART, CommandPayload.NoPayload.INSTANCE);
        }
    }

    @Command(name = "shutdown", description = "Stop the daemon")
    static final class ShutdownCommand implements Callable<Integer> {
        @ParentCommand
        VoiceDaemonCli parent;

        @Override
        public Integer call() {
            return parent.send(CommandKind.SHUTDOWN, CommandPayload.NoPayload.INSTANCE);
        }
    }

    @Command(name = "config", description = "Show the runtime configuration, or change it with --set key=value")
    static final class ConfigCommand implements Callable<Integer> {
        @ParentCommand
        VoiceDaemonCli parent;

        @Option(names = {"--set"}, description = "Setting to change, e.g. transcription.language=de")
        Map<String, String> settings = new LinkedHashMap<>();

        @Override
        public Integer call() {
            if (settings.isEmpty()) {
                return parent.send(CommandKind.GET_CONFIG, CommandPayload.NoPayload.INSTANCE);
            }
            return parent.send(CommandKind.UPDATE_CONFIG, new CommandPayload.ConfigPayload(settings));
        }
    }

    @Command(name = "watch", description = "Print every state change until the daemon exits")
    static final class WatchCommand implements Callable<Integer> {
        @ParentCommand
        VoiceDaemonCli parent;

        @Option(names = {"--poll"}, defaultValue = "5", description = "Seconds between status polls")
        long pollSeconds;

        @Override
        public Integer call() throws InterruptedException {
            DaemonClient client;
            try {
                client = DaemonClient.connect(parent.socketPath());
            } catch (IOException e) {
                parent.err().println("Daemon not reachable at " + parent.socketPath() + ": " + e.getMessage());
                return EXIT_UNREACHABLE;
            }
            CountDownLatch gone = new CountDownLatch(1);
            PrintWriter out = parent.out();
            try (client;
                 ClientStateReconciler reconciler = new ClientStateReconciler(client, state -> {
                     out.println(describe(state));
                     out.flush();
                     if (state.phase() == DaemonPhase.SHUTTING_DOWN) {
                         gone.countDown();
                     }
                 }, Duration.ofSeconds(pollSeconds))) {
                reconciler.start();
                while (client.isConnected()) {
                    if (gone.await(1, TimeUnit.SECONDS)) {
                        break;
                    }
                }
            }
            return EXIT_OK;
        }
    }
}
