package com.phillippitts.voicedaemon.service.transcription;

import com.phillippitts.voicedaemon.config.TranscriptionProperties;
import com.phillippitts.voicedaemon.domain.SpeechSpan;
import com.phillippitts.voicedaemon.service.recording.AudioFormat;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Energy-based voice activity detection over PCM16LE mono audio.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Divide audio into fixed windows ({@code vad.window-ms})</li>
 *   <li>Calculate the RMS amplitude of each window</li>
 *   <li>Windows at or above {@code vad.silence-threshold} are voiced</li>
 *   <li>Voiced runs separated by less than {@code vad.min-silence-ms} are merged</li>
 *   <li>Runs shorter than {@code vad.min-speech-ms} are discarded</li>
 *   <li>Surviving spans are padded by {@code vad.padding-ms} on both sides, clamped to the buffer</li>
 * </ol>
 */
@Component
public class RmsVoiceActivityDetector implements VoiceActivityDetector {

    private final TranscriptionProperties.Vad vad;

    public RmsVoiceActivityDetector(TranscriptionProperties properties) {
        this.vad = properties.getVad();
    }

    @Override
    public List<SpeechSpan> segment(byte[] pcm) {
        List<SpeechSpan> spans = new ArrayList<>();
        if (pcm == null || pcm.length < AudioFormat.REQUIRED_BLOCK_ALIGN) {
            return spans;
        }

        int windowBytes = Math.max(AudioFormat.REQUIRED_BLOCK_ALIGN, AudioFormat.bytesFor(vad.getWindowMs()));
        int minSilenceBytes = AudioFormat.bytesFor(vad.getMinSilenceMs());
        int minSpeechBytes = AudioFormat.bytesFor(vad.getMinSpeechMs());
        int paddingBytes = AudioFormat.bytesFor(vad.getPaddingMs());

        // Voiced runs, merged across short gaps
        List<int[]> runs = new ArrayList<>();
        int runStart = -1;
        int runEnd = -1;
        for (int pos = 0; pos < pcm.length; pos += windowBytes) {
            int len = Math.min(windowBytes, pcm.length - pos);
            if (calculateRms(pcm, pos, len) >= vad.getSilenceThreshold()) {
                if (runStart == -1) {
                    runStart = pos;
                } else if (pos > runEnd && pos - runEnd >= minSilenceBytes) {
                    runs.add(new int[] {runStart, runEnd});
                    runStart = pos;
                }
                runEnd = pos + len;
            }
        }
        if (runStart != -1) {
            runs.add(new int[] {runStart, runEnd});
        }

        int lastEnd = 0;
        for (int[] run : runs) {
            if (run[1] - run[0] < minSpeechBytes) {
                continue;
            }
            int start = Math.max(lastEnd, align(run[0] - paddingBytes));
            int end = Math.min(pcm.length - (pcm.length % AudioFormat.REQUIRED_BLOCK_ALIGN),
                    align(run[1] + paddingBytes));
            if (end > start) {
                spans.add(new SpeechSpan(start, end));
                lastEnd = end;
            }
        }
        return spans;
    }

    private static int align(int bytes) {
        int clamped = Math.max(0, bytes);
        return clamped - (clamped % AudioFormat.REQUIRED_BLOCK_ALIGN);
    }

    /**
     * RMS amplitude of a PCM16LE window (0-32767 range).
     */
    static double calculateRms(byte[] pcm, int offset, int length) {
        long sumSquares = 0;
        int sampleCount = 0;
        for (int i = offset; i + 1 < offset + length && i + 1 < pcm.length; i += 2) {
            int sample = (pcm[i] & 0xFF) | (pcm[i + 1] << 8);
            sumSquares += (long) sample * sample;
            sampleCount++;
        }
        if (sampleCount == 0) {
            return 0;
        }
        return Math.sqrt((double) sumSquares / sampleCount);
    }
}
