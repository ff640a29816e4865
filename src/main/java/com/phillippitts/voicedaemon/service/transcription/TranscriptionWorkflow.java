package com.phillippitts.voicedaemon.service.transcription;

import com.phillippitts.voicedaemon.config.TranscriptionProperties;
import com.phillippitts.voicedaemon.domain.AudioBuffer;
import com.phillippitts.voicedaemon.domain.SpeechSpan;
import com.phillippitts.voicedaemon.domain.TranscriptionResult;
import com.phillippitts.voicedaemon.exception.TranscriptionException;
import com.phillippitts.voicedaemon.service.metrics.DaemonMetrics;
import com.phillippitts.voicedaemon.service.recording.PendingCapture;
import com.phillippitts.voicedaemon.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

/**
 * Turns a stopped recording or a WAV file into text on the {@code stt-worker} thread.
 *
 * <p>Pipeline: await the audio, segment it into speech spans, transcribe each span in
 * temporal order under the {@link EngineGuard}, filter the engine output and join the non-empty
 * pieces with single spaces. Silence yields an empty transcript, not a failure. A failed pass is
 * retried once when {@code transcription.retry-on-failure} is set.
 */
@Component
public class TranscriptionWorkflow {

    private static final Logger LOG = LogManager.getLogger(TranscriptionWorkflow.class);

    private final AsyncTaskExecutor executor;
    private final SpeechEngine engine;
    private final EngineGuard guard;
    private final VoiceActivityDetector vad;
    private final TranscriptFilter filter;
    private final TranscriptionProperties properties;
    private final DaemonMetrics metrics;

    public TranscriptionWorkflow(@Qualifier("sttExecutor") AsyncTaskExecutor executor,
                                 SpeechEngine engine,
                                 EngineGuard guard,
                                 VoiceActivityDetector vad,
                                 TranscriptFilter filter,
                                 TranscriptionProperties properties,
                                 DaemonMetrics metrics) {
        this.executor = executor;
        this.engine = engine;
        this.guard = guard;
        this.vad = vad;
        this.filter = filter;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Queues transcription of a stopped recording. Never blocks the caller.
     */
    public TranscriptionTask submit(PendingCapture capture) {
        return submitInput(capture);
    }

    /**
     * Queues transcription of a 16 kHz 16-bit mono WAV file. The file is read on the worker;
     * an unreadable or malformed file fails the task.
     */
    public TranscriptionTask submitFile(Path wavFile) {
        return submitInput(new WavFileInput(wavFile, properties.getMaxFileBytes()));
    }

    private TranscriptionTask submitInput(AudioInput input) {
        TranscriptionTask task = new TranscriptionTask(input);
        try {
            task.attach(executor.submit(() -> run(task)));
        } catch (TaskRejectedException e) {
            input.discard();
            task.fail(new TranscriptionException("Transcription worker queue is full", e));
        }
        return task;
    }

    private void run(TranscriptionTask task) {
        long start = System.nanoTime();
        AudioBuffer buffer = null;
        byte[] pcm = null;
        try {
            buffer = task.input().awaitBuffer();
            pcm = buffer.take();
            LOG.debug("Transcribing {} bytes of audio", pcm.length);
            String text = transcribeWithRetry(pcm, task);
            if (!task.isCancelled()) {
                metrics.recordTranscription(System.nanoTime() - start, true);
                LOG.info("Transcription completed in {} ms ({} chars)", TimeUtils.elapsedMillis(start), text.length());
            }
            task.complete(text);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Transcription interrupted");
            task.fail(new TranscriptionException("Transcription interrupted", engine.getEngineName(), e));
        } catch (TranscriptionException e) {
            finishWithFailure(task, e, start);
        } catch (RuntimeException e) {
            LOG.error("Unexpected transcription failure", e);
            finishWithFailure(task, new TranscriptionException("Unexpected transcription failure: " + e.getMessage(),
                    engine.getEngineName(), e), start);
        } finally {
            if (pcm != null) {
                Arrays.fill(pcm, (byte) 0);
            }
            if (buffer != null) {
                buffer.release();
            }
            task.input().discard();
        }
    }

    private void finishWithFailure(TranscriptionTask task, TranscriptionException failure, long start) {
        if (task.isCancelled()) {
            LOG.info("Transcription cancelled");
            return;
        }
        metrics.recordTranscription(System.nanoTime() - start, false);
        LOG.warn("Transcription failed: {}", failure.getMessage());
        task.fail(failure);
    }

    private String transcribeWithRetry(byte[] pcm, TranscriptionTask task) {
        try {
            return transcribePass(pcm, task);
        } catch (TranscriptionException first) {
            if (task.isCancelled() || !properties.isRetryOnFailure()) {
                throw first;
            }
            LOG.warn("Transcription attempt failed, retrying once: {}", first.getMessage());
            return transcribePass(pcm, task);
        }
    }

    private String transcribePass(byte[] pcm, TranscriptionTask task) {
        List<SpeechSpan> spans = vad.segment(pcm);
        if (spans.isEmpty()) {
            LOG.info("No speech detected in {} bytes of audio", pcm.length);
            return "";
        }
        StringJoiner joined = new StringJoiner(" ");
        for (SpeechSpan span : spans) {
            if (task.isCancelled() || Thread.currentThread().isInterrupted()) {
                throw new TranscriptionException("Transcription cancelled", engine.getEngineName());
            }
            byte[] segment = Arrays.copyOfRange(pcm, span.startByte(), span.endByte());
            try {
                String text = filter.clean(transcribeSegment(segment));
                if (!text.isEmpty()) {
                    joined.add(text);
                }
            } finally {
                Arrays.fill(segment, (byte) 0);
            }
        }
        return joined.toString();
    }

    private TranscriptionResult transcribeSegment(byte[] segment) {
        guard.acquire();
        try {
            return engine.transcribe(segment);
        } finally {
            guard.release();
        }
    }
}
