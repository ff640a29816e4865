package com.phillippitts.voicedaemon.service.transcription;

import com.phillippitts.voicedaemon.domain.SpeechSpan;

import java.util.List;

/**
 * Finds the speech regions of a recording.
 */
public interface VoiceActivityDetector {

    /**
     * @param pcm PCM16LE mono 16 kHz audio
     * @return non-overlapping speech spans in temporal order; empty for silence
     */
    List<SpeechSpan> segment(byte[] pcm);
}
