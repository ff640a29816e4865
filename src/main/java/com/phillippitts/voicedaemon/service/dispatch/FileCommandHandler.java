package com.phillippitts.voicedaemon.service.dispatch;

import com.phillippitts.voicedaemon.domain.Command;
import com.phillippitts.voicedaemon.domain.CommandKind;
import com.phillippitts.voicedaemon.domain.CommandPayload;
import com.phillippitts.voicedaemon.exception.ProtocolException;
import com.phillippitts.voicedaemon.service.state.WorkflowCoordinator;
import com.phillippitts.voicedaemon.util.LogSanitizer;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * TRANSCRIBE_FILE. The path must name a readable regular file; its transcript arrives later as a
 * {@code transcription_completed} event, exactly like a recording's.
 */
@Component
class FileCommandHandler implements CommandHandler {

    private final WorkflowCoordinator coordinator;

    FileCommandHandler(WorkflowCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public Set<CommandKind> kinds() {
        return EnumSet.of(CommandKind.TRANSCRIBE_FILE);
    }

    @Override
    public Map<String, Object> handle(Command command) {
        String raw = command.payloadAs(CommandPayload.FilePayload.class).filePath();
        Path file = resolve(raw);
        coordinator.transcribeFile(file);
        return Map.of("file_path", file.toString());
    }

    private static Path resolve(String raw) {
        Path file;
        try {
            file = Path.of(raw);
        } catch (InvalidPathException e) {
            throw new ProtocolException("Invalid 'file_path': " + LogSanitizer.truncate(raw, 64), e);
        }
        if (!file.isAbsolute()) {
            throw new ProtocolException("'file_path' must be absolute: " + LogSanitizer.truncate(raw, 64));
        }
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new ProtocolException("File not found or not readable: " + LogSanitizer.truncate(raw, 64));
        }
        return file.normalize();
    }
}
