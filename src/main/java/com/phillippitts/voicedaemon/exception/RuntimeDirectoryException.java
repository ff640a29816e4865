package com.phillippitts.voicedaemon.exception;

import java.nio.file.Path;

/**
 * Thrown when the runtime directory that holds the daemon socket is unsafe: owned by another
 * user, a symbolic link, not a directory, or impossible to create with private permissions.
 */
public class RuntimeDirectoryException extends VoiceDaemonException {

    private final Path directory;

    public RuntimeDirectoryException(Path directory, String message) {
        super(message + ": " + directory);
        this.directory = directory;
    }

    public RuntimeDirectoryException(Path directory, String message, Throwable cause) {
        super(message + ": " + directory, cause);
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public String errorType() {
        return "RuntimeDirectoryError";
    }
}
