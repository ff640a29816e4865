package com.phillippitts.voicedaemon.service.transcription;

import com.phillippitts.voicedaemon.domain.AudioBuffer;
import com.phillippitts.voicedaemon.exception.TranscriptionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

import static com.phillippitts.voicedaemon.service.recording.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.voicedaemon.service.recording.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.voicedaemon.service.recording.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.voicedaemon.service.recording.AudioFormat.REQUIRED_SAMPLE_RATE;

/**
 * Reads the samples of a WAV file on the transcription worker.
 *
 * <p>Only the format the daemon records is accepted: uncompressed PCM, 16 kHz, 16-bit, mono.
 * Chunks other than {@code fmt } and {@code data} are skipped. Any other layout is a
 * {@link TranscriptionException}.
 */
final class WavFileInput implements AudioInput {

    private static final Logger LOG = LogManager.getLogger(WavFileInput.class);

    private static final int RIFF_HEADER_SIZE = 12;
    private static final int CHUNK_HEADER_SIZE = 8;
    private static final int FMT_CHUNK_MIN_SIZE = 16;
    private static final int AUDIO_FORMAT_PCM = 1;

    private final Path path;
    private final long maxFileBytes;
    private AudioBuffer loaded;

    WavFileInput(Path path, long maxFileBytes) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.maxFileBytes = maxFileBytes;
    }

    Path path() {
        return path;
    }

    @Override
    public synchronized AudioBuffer awaitBuffer() {
        byte[] wav = readFile();
        try {
            loaded = AudioBuffer.adopt(extractPcm(wav));
            LOG.debug("Loaded {} bytes of PCM from {}", loaded.length(), path.getFileName());
            return loaded;
        } finally {
            Arrays.fill(wav, (byte) 0);
        }
    }

    @Override
    public synchronized void discard() {
        if (loaded != null) {
            loaded.release();
        }
    }

    private byte[] readFile() {
        try {
            long size = Files.size(path);
            if (size > maxFileBytes) {
                throw new TranscriptionException("Audio file too large: " + size + " bytes. Max: "
                        + maxFileBytes + " bytes");
            }
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new TranscriptionException("Cannot read audio file " + path + ": " + e.getMessage(), e);
        }
    }

    static byte[] extractPcm(byte[] wav) {
        if (wav.length < RIFF_HEADER_SIZE || !"RIFF".equals(chunkId(wav, 0)) || !"WAVE".equals(chunkId(wav, 8))) {
            throw new TranscriptionException("Not a RIFF/WAVE file");
        }
        boolean formatSeen = false;
        int offset = RIFF_HEADER_SIZE;
        while (offset + CHUNK_HEADER_SIZE <= wav.length) {
            String id = chunkId(wav, offset);
            int size = readLeInt(wav, offset + 4);
            int body = offset + CHUNK_HEADER_SIZE;
            if (size < 0 || body + (long) size > wav.length) {
                throw new TranscriptionException("Invalid chunk size " + size + " at offset " + offset);
            }
            if ("fmt ".equals(id)) {
                checkFormat(wav, body, size);
                formatSeen = true;
            } else if ("data".equals(id)) {
                if (!formatSeen) {
                    throw new TranscriptionException("WAV data chunk precedes fmt chunk");
                }
                if (size % REQUIRED_BLOCK_ALIGN != 0) {
                    throw new TranscriptionException("WAV data not aligned to " + REQUIRED_BLOCK_ALIGN
                            + "-byte frames. Size: " + size);
                }
                return Arrays.copyOfRange(wav, body, body + size);
            }
            // chunks are padded to even sizes
            offset = body + size + (size & 1);
        }
        throw new TranscriptionException(formatSeen ? "Missing data chunk in WAV file" : "Missing fmt chunk in WAV file");
    }

    private static void checkFormat(byte[] wav, int offset, int size) {
        if (size < FMT_CHUNK_MIN_SIZE) {
            throw new TranscriptionException("fmt chunk too small: " + size + " bytes");
        }
        int audioFormat = readLeShort(wav, offset);
        int channels = readLeShort(wav, offset + 2);
        int sampleRate = readLeInt(wav, offset + 4);
        int bitsPerSample = readLeShort(wav, offset + 14);
        if (audioFormat != AUDIO_FORMAT_PCM || channels != REQUIRED_CHANNELS
                || sampleRate != REQUIRED_SAMPLE_RATE || bitsPerSample != REQUIRED_BITS_PER_SAMPLE) {
            throw new TranscriptionException("Unsupported WAV format: format " + audioFormat + ", "
                    + channels + " channel(s), " + sampleRate + " Hz, " + bitsPerSample
                    + "-bit. Expected 16 kHz 16-bit mono PCM");
        }
    }

    private static String chunkId(byte[] wav, int offset) {
        return new String(wav, offset, 4, StandardCharsets.US_ASCII);
    }

    private static int readLeShort(byte[] a, int off) {
        return (a[off] & 0xFF) | ((a[off + 1] & 0xFF) << 8);
    }

    private static int readLeInt(byte[] a, int off) {
        return (a[off] & 0xFF)
                | ((a[off + 1] & 0xFF) << 8)
                | ((a[off + 2] & 0xFF) << 16)
                | ((a[off + 3] & 0xFF) << 24);
    }
}
