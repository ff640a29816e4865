package com.phillippitts.voicedaemon;

import com.phillippitts.voicedaemon.config.AudioCaptureProperties;
import com.phillippitts.voicedaemon.config.DaemonProperties;
import com.phillippitts.voicedaemon.config.RefinementProperties;
import com.phillippitts.voicedaemon.config.ThreadPoolProperties;
import com.phillippitts.voicedaemon.config.TranscriptionProperties;
import com.phillippitts.voicedaemon.config.WhisperConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        DaemonProperties.class,
        AudioCaptureProperties.class,
        TranscriptionProperties.class,
        WhisperConfig.class,
        RefinementProperties.class,
        ThreadPoolProperties.class
})
public class VoiceDaemonApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceDaemonApplication.class, args);
    }

}
