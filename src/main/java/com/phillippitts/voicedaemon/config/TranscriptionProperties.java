package com.phillippitts.voicedaemon.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the transcription workflow and its voice-activity segmentation.
 *
 * <p>Example application.properties:
 * <pre>
 * transcription.retry-on-failure=true
 * transcription.max-token-repeats=6
 * transcription.max-file-bytes=104857600
 * transcription.vad.silence-threshold=800
 * transcription.vad.min-silence-ms=500
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "transcription")
public class TranscriptionProperties {

    /** Retry a failed transcription pass once before surfacing the error. */
    private boolean retryOnFailure = true;

    /** A token repeated more often than this in a row marks the output as garbled. */
    @Min(value = 2, message = "max-token-repeats must be at least 2")
    private int maxTokenRepeats = 6;

    /** Maximum wait for the engine permit before a segment fails (ms). */
    @Positive(message = "engine-acquire-timeout-ms must be positive")
    private long engineAcquireTimeoutMs = 5000;

    /** Largest WAV file TRANSCRIBE_FILE reads (bytes). */
    @Positive(message = "max-file-bytes must be positive")
    private long maxFileBytes = 100L * 1024 * 1024;

    @Valid
    private Vad vad = new Vad();

    public boolean isRetryOnFailure() {
        return retryOnFailure;
    }

    public void setRetryOnFailure(boolean retryOnFailure) {
        this.retryOnFailure = retryOnFailure;
    }

    public int getMaxTokenRepeats() {
        return maxTokenRepeats;
    }

    public void setMaxTokenRepeats(int maxTokenRepeats) {
        this.maxTokenRepeats = maxTokenRepeats;
    }

    public long getEngineAcquireTimeoutMs() {
        return engineAcquireTimeoutMs;
    }

    public void setEngineAcquireTimeoutMs(long engineAcquireTimeoutMs) {
        this.engineAcquireTimeoutMs = engineAcquireTimeoutMs;
    }

    public long getMaxFileBytes() {
        return maxFileBytes;
    }

    public void setMaxFileBytes(long maxFileBytes) {
        this.maxFileBytes = maxFileBytes;
    }

    public Vad getVad() {
        return vad;
    }

    public void setVad(Vad vad) {
        this.vad = vad;
    }

    /**
     * RMS energy voice-activity detection.
     */
    public static class Vad {

        /** RMS amplitude below which a window counts as silence (0-32767). */
        @Min(0)
        @Max(32767)
        private int silenceThreshold = 800;

        /** Analysis window length (ms). */
        @Min(5)
        @Max(100)
        private int windowMs = 20;

        /** Shortest run of voiced windows kept as speech (ms). */
        @Min(0)
        private int minSpeechMs = 250;

        /** Silence needed to split two speech segments (ms). */
        @Min(0)
        private int minSilenceMs = 500;

        /** Audio kept on both sides of a speech segment (ms). */
        @Min(0)
        private int paddingMs = 100;

        public int getSilenceThreshold() {
            return silenceThreshold;
        }

        public void setSilenceThreshold(int silenceThreshold) {
            this.silenceThreshold = silenceThreshold;
        }

        public int getWindowMs() {
            return windowMs;
        }

        public void setWindowMs(int windowMs) {
            this.windowMs = windowMs;
        }

        public int getMinSpeechMs() {
            return minSpeechMs;
        }

        public void setMinSpeechMs(int minSpeechMs) {
            this.minSpeechMs = minSpeechMs;
        }

        public int getMinSilenceMs() {
            return minSilenceMs;
        }

        public void setMinSilenceMs(int minSilenceMs) {
            this.minSilenceMs = minSilenceMs;
        }

        public int getPaddingMs() {
            return paddingMs;
        }

        public void setPaddingMs(int paddingMs) {
            this.paddingMs = paddingMs;
        }
    }
}
