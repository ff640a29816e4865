package com.phillippitts.voicedaemon.service.recording;

import com.phillippitts.voicedaemon.exception.AudioDeviceException;

/**
 * Exclusive microphone producing PCM16LE mono 16 kHz chunks.
 *
 * <p>At most one recording uses the source at a time: {@link #open()} is called on the control
 * thread, {@link #read(byte[])} and {@link #close()} on the capture thread.
 */
public interface AudioCaptureSource {

    /**
     * Acquires the device.
     *
     * @throws AudioDeviceException if the device is missing, busy or access is denied
     */
    void open();

    /**
     * Blocks until audio is available and copies it into {@code buffer}.
     *
     * @return bytes read, 0 if none were available yet
     * @throws AudioDeviceException if the device fails while capturing
     */
    int read(byte[] buffer);

    /** Releases the device. Idempotent. */
    void close();
}
