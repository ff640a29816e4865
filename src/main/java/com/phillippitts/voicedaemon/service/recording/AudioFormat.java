package com.phillippitts.voicedaemon.service.recording;

/**
 * The one PCM format the daemon records and transcribes: 16 kHz, 16-bit signed, mono,
 * little-endian.
 */
public final class AudioFormat {

    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    public static final int REQUIRED_CHANNELS = 1;

    /** Signed PCM flag for Java Sound. */
    public static final boolean REQUIRED_SIGNED = true;
    /** Endian flag for Java Sound (false = little-endian). */
    public static final boolean REQUIRED_BIG_ENDIAN = false;

    /** Bytes per PCM frame. */
    public static final int REQUIRED_BLOCK_ALIGN = (REQUIRED_BITS_PER_SAMPLE / 8) * REQUIRED_CHANNELS; // 2 bytes
    /** Bytes per second. */
    public static final int REQUIRED_BYTE_RATE = REQUIRED_SAMPLE_RATE * REQUIRED_BLOCK_ALIGN;           // 32,000

    // WAV header constants (PCM simple header)
    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}

    /** Bytes covering the given duration, aligned to whole frames. */
    public static int bytesFor(long millis) {
        long bytes = (millis * REQUIRED_BYTE_RATE) / 1000L;
        return (int) (bytes - (bytes % REQUIRED_BLOCK_ALIGN));
    }

    public static javax.sound.sampled.AudioFormat toJavaSound() {
        return new javax.sound.sampled.AudioFormat(
                REQUIRED_SAMPLE_RATE,
                REQUIRED_BITS_PER_SAMPLE,
                REQUIRED_CHANNELS,
                REQUIRED_SIGNED,
                REQUIRED_BIG_ENDIAN
        );
    }
}
