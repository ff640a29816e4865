package com.phillippitts.voicedaemon.testutil;

import com.phillippitts.voicedaemon.service.recording.AudioFormat;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static java.nio.charset.StandardCharsets.US_ASCII;

/**
 * Synthetic PCM16LE mono 16 kHz audio.
 */
public final class PcmFixtures {

    private PcmFixtures() {}

    public static byte[] silence(int millis) {
        return new byte[AudioFormat.bytesFor(millis)];
    }

    /** Square wave of the given amplitude, loud enough to count as speech. */
    public static byte[] tone(int millis, short amplitude) {
        byte[] pcm = new byte[AudioFormat.bytesFor(millis)];
        for (int i = 0; i < pcm.length; i += 2) {
            short sample = (i / 2) % 2 == 0 ? amplitude : (short) -amplitude;
            pcm[i] = (byte) (sample & 0xFF);
            pcm[i + 1] = (byte) ((sample >> 8) & 0xFF);
        }
        return pcm;
    }

    public static byte[] concat(byte[]... parts) {
        int total = 0;
        for (byte[] part : parts) {
            total += part.length;
        }
        byte[] out = new byte[total];
        int pos = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, out, pos, part.length);
            pos += part.length;
        }
        return out;
    }

    /** Wraps PCM in a canonical 44-byte WAV header with the given format fields. */
    public static byte[] wav(byte[] pcm, int sampleRate, int channels, int bitsPerSample) {
        int blockAlign = channels * bitsPerSample / 8;
        ByteBuffer out = ByteBuffer.allocate(44 + pcm.length).order(ByteOrder.LITTLE_ENDIAN);
        out.put("RIFF".getBytes(US_ASCII)).putInt(36 + pcm.length)
                .put("WAVE".getBytes(US_ASCII))
                .put("fmt ".getBytes(US_ASCII)).putInt(16)
                .putShort((short) 1).putShort((short) channels).putInt(sampleRate)
                .putInt(sampleRate * blockAlign).putShort((short) blockAlign).putShort((short) bitsPerSample)
                .put("data".getBytes(US_ASCII)).putInt(pcm.length)
                .put(pcm);
        return out.array();
    }

    public static byte[] wav(byte[] pcm) {
        return wav(pcm, AudioFormat.REQUIRED_SAMPLE_RATE, AudioFormat.REQUIRED_CHANNELS,
                AudioFormat.REQUIRED_BITS_PER_SAMPLE);
    }
}
