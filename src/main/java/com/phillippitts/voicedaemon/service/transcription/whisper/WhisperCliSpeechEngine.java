package com.phillippitts.voicedaemon.service.transcription.whisper;

import com.phillippitts.voicedaemon.config.RuntimeSettings;
import com.phillippitts.voicedaemon.config.WhisperConfig;
import com.phillippitts.voicedaemon.domain.TranscriptionResult;
import com.phillippitts.voicedaemon.exception.TranscriptionException;
import com.phillippitts.voicedaemon.exception.TranscriptionExceptionBuilder;
import com.phillippitts.voicedaemon.service.transcription.SpeechEngine;
import com.phillippitts.voicedaemon.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * {@link SpeechEngine} invoking the whisper.cpp command-line binary as a subprocess.
 *
 * <p>Each segment is written to a temporary WAV file, transcribed by
 * {@link WhisperProcessManager} and the file deleted again. The language comes from
 * {@link RuntimeSettings} so {@code UPDATE_CONFIG} takes effect on the next recording.
 *
 * <p><b>Privacy:</b> never logs transcription text; only duration and character count.
 */
@Component
public class WhisperCliSpeechEngine implements SpeechEngine {

    private static final Logger LOG = LogManager.getLogger(WhisperCliSpeechEngine.class);
    static final String ENGINE = "whisper";

    /** Segment timestamps such as "[00:00:00.000 --> 00:00:02.000]". */
    private static final Pattern TIMESTAMP = Pattern.compile("\\[\\d{2}:\\d{2}:\\d{2}\\.\\d{3} --> [^\\]]*\\]");

    private final WhisperConfig cfg;
    private final RuntimeSettings settings;
    private final WhisperProcessManager manager;

    private final Object lock = new Object();
    private boolean initialized;

    @Autowired
    public WhisperCliSpeechEngine(WhisperConfig cfg, RuntimeSettings settings) {
        this(cfg, settings, new WhisperProcessManager());
    }

    WhisperCliSpeechEngine(WhisperConfig cfg, RuntimeSettings settings, WhisperProcessManager manager) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.manager = Objects.requireNonNull(manager, "manager");
    }

    @Override
    public void initialize() {
        synchronized (lock) {
            Path binary = WhisperProcessManager.resolvePath(cfg.binaryPath());
            Path model = WhisperProcessManager.resolvePath(cfg.modelPath());
            if (!Files.isExecutable(binary)) {
                throw TranscriptionExceptionBuilder.create("Whisper binary not found or not executable")
                        .engine(ENGINE)
                        .metadata("binaryPath", binary)
                        .build();
            }
            if (!Files.isRegularFile(model)) {
                throw TranscriptionExceptionBuilder.create("Whisper model not found")
                        .engine(ENGINE)
                        .metadata("modelPath", model)
                        .build();
            }
            initialized = true;
            LOG.info("Whisper engine initialized: model={}, timeout={}s, lang={}, threads={}",
                    cfg.modelPath(), cfg.timeoutSeconds(), settings.language(), cfg.threads());
        }
    }

    @Override
    public TranscriptionResult transcribe(byte[] audioData) {
        if (audioData == null || audioData.length == 0) {
            throw new IllegalArgumentException("audioData must not be null or empty");
        }
        ensureInitialized();
        Path wav = null;
        long startTime = System.nanoTime();
        try {
            wav = Files.createTempFile("whisper-", ".wav");
            WavWriter.write(audioData, wav);
            String stdout = manager.transcribe(wav, cfg.withLanguage(settings.language()));
            String text = extractText(stdout);
            LOG.debug("Whisper transcribed segment in {} ms (chars={})", TimeUtils.elapsedMillis(startTime), text.length());
            return text.isEmpty() ? TranscriptionResult.noSpeech(ENGINE) : TranscriptionResult.of(text, 1.0, ENGINE);
        } catch (IOException e) {
            throw new TranscriptionException("Whisper temp file failure: " + e.getMessage(), ENGINE, e);
        } finally {
            deleteQuietly(wav);
        }
    }

    static String extractText(String stdout) {
        if (stdout == null) {
            return "";
        }
        return TIMESTAMP.matcher(stdout).replaceAll(" ").replaceAll("\\s+", " ").trim();
    }

    private void ensureInitialized() {
        synchronized (lock) {
            if (!initialized) {
                throw new TranscriptionException("whisper engine not initialized or closed", ENGINE);
            }
        }
    }

    private static void deleteQuietly(Path wav) {
        if (wav == null) {
            return;
        }
        try {
            Files.deleteIfExists(wav);
        } catch (IOException e) {
            LOG.debug("Could not delete temp file {}: {}", wav, e.toString());
        }
    }

    @Override
    public String getEngineName() {
        return ENGINE;
    }

    @Override
    public boolean isHealthy() {
        synchronized (lock) {
            return initialized;
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (!initialized) {
                return;
            }
            initialized = false;
        }
        manager.close();
        LOG.info("Whisper engine closed");
    }
}
