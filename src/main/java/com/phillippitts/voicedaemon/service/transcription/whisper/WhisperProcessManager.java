package com.phillippitts.voicedaemon.service.transcription.whisper;

import com.phillippitts.voicedaemon.config.WhisperConfig;
import com.phillippitts.voicedaemon.exception.TranscriptionException;
import com.phillippitts.voicedaemon.exception.TranscriptionExceptionBuilder;
import com.phillippitts.voicedaemon.util.ProcessTimeouts;
import com.phillippitts.voicedaemon.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one whisper.cpp process per speech segment.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>build the CLI from {@link WhisperConfig}</li>
 *   <li>capture stdout (transcript) and stderr (diagnostics) concurrently, each capped</li>
 *   <li>enforce the timeout and destroy runaway processes</li>
 *   <li>destroy the process when the calling thread is interrupted</li>
 * </ul>
 *
 * <p>Temp-file WAV handling is performed by the caller (engine).
 */
final class WhisperProcessManager implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(WhisperProcessManager.class);

    private static final int STDERR_MAX_BYTES = 64 * 1024;
    private static final int ERROR_SNIPPET_MAX_CHARS = 500;

    private final ProcessFactory processFactory;

    private volatile Process current;

    WhisperProcessManager() {
        this(new DefaultProcessFactory());
    }

    WhisperProcessManager(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Executes whisper.cpp for the given WAV file.
     *
     * <pre>
     * ${binary} -m ${model} -f ${wav} -l ${language} -nt -otxt -of stdout -t ${threads}
     * </pre>
     *
     * @return stdout content produced by whisper (may be empty)
     * @throws TranscriptionException on timeout, non-zero exit, I/O error or interruption
     */
    String transcribe(Path wavPath, WhisperConfig cfg) {
        Objects.requireNonNull(wavPath, "wavPath");
        Objects.requireNonNull(cfg, "cfg");

        long startTime = System.nanoTime();
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = null;
        Thread outGobbler = null;
        Thread errGobbler = null;
        try {
            process = processFactory.start(buildCommand(cfg, wavPath), wavPath.getParent());
            current = process;
            // Start gobblers before waiting to avoid a full-pipe deadlock
            outGobbler = startGobbler(process.getInputStream(), stdout, "whisper-out", cfg.maxStdoutBytes());
            errGobbler = startGobbler(process.getErrorStream(), stderr, "whisper-err", STDERR_MAX_BYTES);

            if (!process.waitFor(cfg.timeoutSeconds(), TimeUnit.SECONDS)) {
                destroyProcess(process);
                throw whisperError("Timeout after " + cfg.timeoutSeconds() + "s", cfg, -1, stderr, startTime, null);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw whisperError("Non-zero exit: " + exitCode, cfg, exitCode, stderr, startTime, null);
            }
            LOG.debug("Whisper stdout size={} chars in {} ms", stdout.length(), TimeUtils.elapsedMillis(startTime));
            return stdout.toString();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw whisperError("Interrupted", cfg, -1, stderr, startTime, e);
        } catch (IOException e) {
            throw whisperError("I/O failure: " + e.getMessage(), cfg, -1, stderr, startTime, e);
        } finally {
            current = null;
            if (process != null && process.isAlive()) {
                destroyProcess(process);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        }
    }

    List<String> buildCommand(WhisperConfig cfg, Path wavPath) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(cfg.binaryPath()).toString());
        cmd.add("-m");
        cmd.add(resolvePath(cfg.modelPath()).toString());
        cmd.add("-f");
        cmd.add(wavPath.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(cfg.language());
        cmd.add("-nt");
        cmd.add("-otxt");
        cmd.add("-of");
        cmd.add("stdout");
        cmd.add("-t");
        cmd.add(String.valueOf(cfg.threads()));
        return cmd;
    }

    static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(() -> gobble(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into the sink until the cap, then keeps draining so the process never blocks
     * on a full pipe.
     */
    private static void gobble(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            boolean capReached = false;
            while ((line = br.readLine()) != null) {
                synchronized (sink) {
                    if (sink.length() >= maxBytes) {
                        if (!capReached) {
                            LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                            capReached = true;
                        }
                        continue;
                    }
                    if (sink.length() > 0) {
                        sink.append('\n');
                    }
                    int available = maxBytes - sink.length();
                    sink.append(line, 0, Math.min(line.length(), Math.max(0, available)));
                }
            }
        } catch (IOException e) {
            LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        process.destroy();
        try {
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    private static TranscriptionException whisperError(String msg, WhisperConfig cfg, int exitCode,
                                                       StringBuilder stderr, long startNano, Throwable cause) {
        String stderrSnippet;
        synchronized (stderr) {
            stderrSnippet = stderr.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderr.length()));
        }
        TranscriptionExceptionBuilder builder = TranscriptionExceptionBuilder.create(msg)
                .engine(WhisperCliSpeechEngine.ENGINE)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNano))
                .metadata("modelPath", cfg.modelPath())
                .metadata("stderr", stderrSnippet);
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }

    /**
     * Destroys a process still running from another thread. Idempotent.
     */
    @Override
    public void close() {
        Process process = current;
        current = null;
        if (process != null && process.isAlive()) {
            destroyProcess(process);
        }
    }
}
