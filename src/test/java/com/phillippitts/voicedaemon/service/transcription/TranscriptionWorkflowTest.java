package com.phillippitts.voicedaemon.service.transcription;

import com.phillippitts.voicedaemon.config.TranscriptionProperties;
import com.phillippitts.voicedaemon.domain.AudioBuffer;
import com.phillippitts.voicedaemon.exception.TranscriptionException;
import com.phillippitts.voicedaemon.service.metrics.DaemonMetrics;
import com.phillippitts.voicedaemon.service.recording.PendingCapture;
import com.phillippitts.voicedaemon.testutil.FakeSpeechEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.voicedaemon.testutil.PcmFixtures.concat;
import static com.phillippitts.voicedaemon.testutil.PcmFixtures.silence;
import static com.phillippitts.voicedaemon.testutil.PcmFixtures.tone;
import static com.phillippitts.voicedaemon.testutil.PcmFixtures.wav;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TranscriptionWorkflowTest {

    private static final short LOUD = 5000;

    private ThreadPoolTaskExecutor executor;
    private FakeSpeechEngine engine;
    private EngineGuard guard;
    private TranscriptionProperties properties;
    private DaemonMetrics metrics;
    private TranscriptionWorkflow workflow;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("stt-test-");
        executor.initialize();
        engine = new FakeSpeechEngine();
        properties = new TranscriptionProperties();
        guard = new EngineGuard(properties);
        metrics = new DaemonMetrics(new SimpleMeterRegistry());
        workflow = new TranscriptionWorkflow(executor, engine, guard, new RmsVoiceActivityDetector(properties),
                new TranscriptFilter(properties), properties, metrics);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void joinsSegmentsInTemporalOrder() throws Exception {
        engine.script("hello", "world");
        byte[] pcm = concat(tone(400, LOUD), silence(1000), tone(400, LOUD));

        String text = workflow.submit(capture(pcm)).result().get(5, TimeUnit.SECONDS);

        assertThat(text).isEqualTo("hello world");
        assertThat(engine.segmentLengths()).containsExactly(16_000, 16_000);
        assertThat(metrics.summary()).containsEntry("transcriptions_total", 1L);
    }

    @Test
    void silenceYieldsEmptyTranscriptWithoutEngineCall() throws Exception {
        String text = workflow.submit(capture(silence(1000))).result().get(5, TimeUnit.SECONDS);

        assertThat(text).isEmpty();
        assertThat(engine.calls.get()).isZero();
    }

    @Test
    void garbledSegmentsAreDropped() throws Exception {
        engine.script("you you you you you you you you you", "ok");
        byte[] pcm = concat(tone(400, LOUD), silence(1000), tone(400, LOUD));

        assertThat(workflow.submit(capture(pcm)).result().get(5, TimeUnit.SECONDS)).isEqualTo("ok");
    }

    @Test
    void retriesOnceAfterFailure() throws Exception {
        engine.failuresBeforeSuccess = 1;
        engine.defaultText = "recovered";

        String text = workflow.submit(capture(tone(500, LOUD))).result().get(5, TimeUnit.SECONDS);

        assertThat(text).isEqualTo("recovered");
        assertThat(engine.calls.get()).isEqualTo(2);
    }

    @Test
    void failsWhenRetryDisabled() {
        properties.setRetryOnFailure(false);
        engine.failuresBeforeSuccess = 1;

        assertThatThrownBy(() -> workflow.submit(capture(tone(500, LOUD))).result().get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(TranscriptionException.class);
        assertThat(metrics.summary()).containsEntry("transcription_failures", 1L);
    }

    @Test
    void secondFailureIsReported() {
        engine.failuresBeforeSuccess = 2;

        assertThatThrownBy(() -> workflow.submit(capture(tone(500, LOUD))).result().get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Engine configured to fail");
    }

    @Test
    void cancelInterruptsEngineAndNeverCompletes() throws Exception {
        engine.blockCalls = true;
        PendingCapture pending = capture(tone(500, LOUD));
        TranscriptionTask task = workflow.submit(pending);
        assertThat(engine.entered.await(5, TimeUnit.SECONDS)).isTrue();

        task.cancel();

        await().atMost(Duration.ofSeconds(5)).until(() -> guard.availablePermits() == 1);
        Thread.sleep(100);
        assertThat(task.result()).isNotDone();
        assertThat(task.isCancelled()).isTrue();
        verify(pending, atLeastOnce()).discard();
    }

    @Test
    void capturedAudioIsReleasedAfterUse() throws Exception {
        AudioBuffer buffer = AudioBuffer.adopt(tone(500, LOUD));
        PendingCapture pending = mock(PendingCapture.class);
        when(pending.awaitBuffer()).thenReturn(buffer);
        engine.defaultText = "done";

        workflow.submit(pending).result().get(5, TimeUnit.SECONDS);

        assertThat(buffer.isReleased()).isTrue();
        verify(pending).discard();
    }

    @Test
    void transcribesWavFile(@TempDir Path dir) throws Exception {
        engine.script("from", "file");
        Path file = Files.write(dir.resolve("memo.wav"), wav(concat(tone(400, LOUD), silence(1000), tone(400, LOUD))));

        String text = workflow.submitFile(file).result().get(5, TimeUnit.SECONDS);

        assertThat(text).isEqualTo("from file");
        assertThat(engine.segmentLengths()).containsExactly(16_000, 16_000);
    }

    @Test
    void unreadableWavFailsTheTask(@TempDir Path dir) throws Exception {
        Path file = Files.write(dir.resolve("stereo.wav"), wav(tone(400, LOUD), 16_000, 2, 16));

        assertThatThrownBy(() -> workflow.submitFile(file).result().get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Unsupported WAV format");
        assertThat(engine.calls.get()).isZero();
    }

    private static PendingCapture capture(byte[] pcm) throws InterruptedException {
        PendingCapture pending = mock(PendingCapture.class);
        when(pending.awaitBuffer()).thenReturn(AudioBuffer.adopt(pcm));
        return pending;
    }
}
