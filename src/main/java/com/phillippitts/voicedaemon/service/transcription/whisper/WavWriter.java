package com.phillippitts.voicedaemon.service.transcription.whisper;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static com.phillippitts.voicedaemon.service.recording.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.voicedaemon.service.recording.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.voicedaemon.service.recording.AudioFormat.REQUIRED_BYTE_RATE;
import static com.phillippitts.voicedaemon.service.recording.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.voicedaemon.service.recording.AudioFormat.REQUIRED_SAMPLE_RATE;
import static com.phillippitts.voicedaemon.service.recording.AudioFormat.WAV_HEADER_SIZE;

/**
 * Writes the WAV file handed to whisper.cpp: 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
final class WavWriter {

    private WavWriter() {}

    /**
     * @param pcm     raw PCM16LE mono audio at 16 kHz
     * @param wavPath output file (created or overwritten)
     * @throws IOException if the file cannot be written
     */
    static void write(byte[] pcm, Path wavPath) throws IOException {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            os.write(header(pcm.length));
            os.write(pcm);
        }
    }

    static byte[] header(int dataSize) {
        byte[] h = new byte[WAV_HEADER_SIZE];
        putAscii(h, 0, "RIFF");
        putLeInt(h, 4, 36 + dataSize);
        putAscii(h, 8, "WAVE");
        putAscii(h, 12, "fmt ");
        putLeInt(h, 16, 16);                           // PCM fmt chunk size
        putLeShort(h, 20, 1);                          // PCM
        putLeShort(h, 22, REQUIRED_CHANNELS);
        putLeInt(h, 24, REQUIRED_SAMPLE_RATE);
        putLeInt(h, 28, REQUIRED_BYTE_RATE);
        putLeShort(h, 32, REQUIRED_BLOCK_ALIGN);
        putLeShort(h, 34, REQUIRED_BITS_PER_SAMPLE);
        putAscii(h, 36, "data");
        putLeInt(h, 40, dataSize);
        return h;
    }

    private static void putAscii(byte[] dst, int off, String s) {
        for (int i = 0; i < s.length(); i++) {
            dst[off + i] = (byte) s.charAt(i);
        }
    }

    private static void putLeShort(byte[] dst, int off, int v) {
        dst[off] = (byte) (v & 0xFF);
        dst[off + 1] = (byte) ((v >>> 8) & 0xFF);
    }

    private static void putLeInt(byte[] dst, int off, int v) {
        dst[off] = (byte) (v & 0xFF);
        dst[off + 1] = (byte) ((v >>> 8) & 0xFF);
        dst[off + 2] = (byte) ((v >>> 16) & 0xFF);
        dst[off + 3] = (byte) ((v >>> 24) & 0xFF);
    }
}
