package com.phillippitts.voicedaemon.service.recording;

import com.phillippitts.voicedaemon.config.AudioCaptureProperties;
import com.phillippitts.voicedaemon.exception.AudioDeviceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.util.Objects;
import java.util.Optional;

/**
 * Java Sound microphone backed by a {@link TargetDataLine}.
 */
@Component
public class JavaSoundCaptureSource implements AudioCaptureSource {

    private static final Logger LOG = LogManager.getLogger(JavaSoundCaptureSource.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final DataLineProvider provider;

    private volatile TargetDataLine line;

    @Autowired
    public JavaSoundCaptureSource(AudioCaptureProperties props) {
        this(props, defaultProvider());
    }

    // Package-private for tests
    JavaSoundCaptureSource(AudioCaptureProperties props, DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.provider = Objects.requireNonNull(provider);
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public void open() {
        if (line != null) {
            throw new AudioDeviceException("MIC_BUSY", "Microphone is still held by the previous recording");
        }
        String device = props.device().orElse("default");
        try {
            TargetDataLine opened = provider.open(AudioFormat.toJavaSound(), props.device());
            opened.start();
            line = opened;
            LOG.info("Microphone opened: device='{}', chunk={}ms", device, props.chunkMillis());
        } catch (LineUnavailableException e) {
            throw new AudioDeviceException("MIC_UNAVAILABLE", "Microphone unavailable: " + e.getMessage(), e);
        } catch (SecurityException e) {
            throw new AudioDeviceException("MIC_PERMISSION_DENIED", "Microphone access denied: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new AudioDeviceException("MIC_UNSUPPORTED", "No microphone supports 16 kHz mono PCM: "
                    + e.getMessage(), e);
        }
    }

    @Override
    public int read(byte[] buffer) {
        TargetDataLine current = line;
        if (current == null) {
            throw new AudioDeviceException("CAPTURE_ERROR", "Capture line is not open");
        }
        int n = current.read(buffer, 0, buffer.length);
        if (n < 0) {
            throw new AudioDeviceException("CAPTURE_ERROR", "Capture line closed unexpectedly");
        }
        return n;
    }

    @Override
    public void close() {
        TargetDataLine current = line;
        line = null;
        if (current == null) {
            return;
        }
        try {
            current.stop();
            current.close();
        } catch (RuntimeException e) {
            LOG.debug("Error closing capture line: {}", e.toString());
        }
    }
}
