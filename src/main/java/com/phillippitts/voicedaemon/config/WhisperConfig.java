package com.phillippitts.voicedaemon.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the whisper.cpp speech engine.
 * Binds to properties prefixed with "transcription.whisper".
 *
 * <pre>
 * transcription.whisper.binary-path=tools/whisper.cpp/main
 * transcription.whisper.model-path=models/ggml-base.en.bin
 * transcription.whisper.timeout-seconds=60
 * transcription.whisper.language=en
 * transcription.whisper.threads=4
 * transcription.whisper.max-stdout-bytes=1048576
 * </pre>
 *
 * @param binaryPath Path to the whisper.cpp binary executable
 * @param modelPath Path to the GGML model file (.bin)
 * @param timeoutSeconds Maximum time one whisper process may run (in seconds)
 * @param language Initial language code; may be changed at runtime while idle
 * @param threads Number of CPU threads whisper.cpp may use
 * @param maxStdoutBytes Maximum stdout accumulation in bytes
 */
@ConfigurationProperties(prefix = "transcription.whisper")
@Validated
public record WhisperConfig(
        @DefaultValue("tools/whisper.cpp/main")
        @NotBlank(message = "Whisper binary path must not be blank")
        String binaryPath,

        @DefaultValue("models/ggml-base.en.bin")
        @NotBlank(message = "Whisper model path must not be blank")
        String modelPath,

        @DefaultValue("60")
        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @DefaultValue("en")
        @NotBlank(message = "Language code must not be blank")
        String language,

        @DefaultValue("4")
        @Positive(message = "Thread count must be positive")
        int threads,

        @DefaultValue("1048576")
        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes
) {

    public WhisperConfig withLanguage(String newLanguage) {
        return new WhisperConfig(binaryPath, modelPath, timeoutSeconds, newLanguage, threads, maxStdoutBytes);
    }
}
