package com.phillippitts.voicedaemon.service.transcription.whisper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts external processes. Tests substitute a factory returning a scripted {@link Process}.
 */
interface ProcessFactory {

    /**
     * @param command    full command line, executable first
     * @param workingDir working directory for the process (may be null)
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
