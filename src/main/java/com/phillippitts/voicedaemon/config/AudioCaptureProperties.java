package com.phillippitts.voicedaemon.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.Optional;

/**
 * Microphone capture settings, bound from {@code audio.capture.*}. The sample format itself is
 * fixed (16 kHz, 16-bit PCM, mono, little-endian) and not configurable.
 *
 * @param chunkMillis   length of one read from the capture source
 * @param maxDurationMs a recording is cut off after this long; the audio captured so far is kept
 * @param deviceName    mixer name hint; blank selects the system default input
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public record AudioCaptureProperties(
        @DefaultValue("40") @Min(10) @Max(200) int chunkMillis,
        @DefaultValue("120000") @Min(100) @Max(600_000) int maxDurationMs,
        String deviceName
) {

    public AudioCaptureProperties {
        deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName.trim();
    }

    public Optional<String> device() {
        return Optional.ofNullable(deviceName);
    }
}
