package com.phillippitts.voicedaemon.service.dispatch;

import com.phillippitts.voicedaemon.config.RefinementProperties;
import com.phillippitts.voicedaemon.domain.Command;
import com.phillippitts.voicedaemon.domain.CommandKind;
import com.phillippitts.voicedaemon.domain.CommandPayload;
import com.phillippitts.voicedaemon.domain.RefinementRequest;
import com.phillippitts.voicedaemon.exception.ProtocolException;
import com.phillippitts.voicedaemon.service.state.WorkflowCoordinator;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * PROCESS_TEXT and TRANSLATE_TEXT. The refined text arrives later as a
 * {@code processing_completed} event.
 */
@Component
class TextCommandHandler implements CommandHandler {

    private final WorkflowCoordinator coordinator;
    private final RefinementProperties properties;

    TextCommandHandler(WorkflowCoordinator coordinator, RefinementProperties properties) {
        this.coordinator = coordinator;
        this.properties = properties;
    }

    @Override
    public Set<CommandKind> kinds() {
        return EnumSet.of(CommandKind.PROCESS_TEXT, CommandKind.TRANSLATE_TEXT);
    }

    @Override
    public Map<String, Object> handle(Command command) {
        if (command.kind() == CommandKind.TRANSLATE_TEXT) {
            CommandPayload.TranslationPayload payload = command.payloadAs(CommandPayload.TranslationPayload.class);
            checkLength(payload.text());
            coordinator.processText(payload.text(), RefinementRequest.translate(payload.targetLanguage()));
            return Map.of("chars", payload.text().length(), "target_lang", payload.targetLanguage());
        }
        CommandPayload.TextPayload payload = command.payloadAs(CommandPayload.TextPayload.class);
        checkLength(payload.text());
        coordinator.processText(payload.text(), RefinementRequest.refine());
        return Map.of("chars", payload.text().length());
    }

    private void checkLength(String text) {
        if (text.length() > properties.getMaxInputChars()) {
            throw new ProtocolException("Text of " + text.length() + " characters exceeds limit of "
                    + properties.getMaxInputChars());
        }
    }
}
