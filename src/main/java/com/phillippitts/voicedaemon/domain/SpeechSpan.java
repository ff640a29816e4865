package com.phillippitts.voicedaemon.domain;

/**
 * A contiguous region of speech inside an audio buffer, as byte offsets [start, end).
 */
public record SpeechSpan(int startByte, int endByte) {

    public SpeechSpan {
        if (startByte < 0 || endByte < startByte) {
            throw new IllegalArgumentException("Invalid span [" + startByte + ", " + endByte + ")");
        }
    }

    public int length() {
        return endByte - startByte;
    }
}
