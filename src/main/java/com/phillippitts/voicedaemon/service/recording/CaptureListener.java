package com.phillippitts.voicedaemon.service.recording;

import com.phillippitts.voicedaemon.exception.AudioDeviceException;

/**
 * Notified on the capture thread when an active recording fails.
 */
@FunctionalInterface
public interface CaptureListener {

    void onCaptureFailed(AudioDeviceException failure);
}
