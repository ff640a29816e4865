package com.phillippitts.voicedaemon.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-kind payload of a {@link Command}. Each command kind accepts exactly one payload shape;
 * the protocol codec builds the matching record and rejects anything else.
 */
public interface CommandPayload {

    /** Payload of commands that carry no arguments. */
    record NoPayload() implements CommandPayload {
        public static final NoPayload INSTANCE = new NoPayload();
    }

    /** {@code PROCESS_TEXT}: text to refine. */
    record TextPayload(String text) implements CommandPayload {
        public TextPayload {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /** {@code TRANSLATE_TEXT}: text and target language. */
    record TranslationPayload(String text, String targetLanguage) implements CommandPayload {
        public TranslationPayload {
            Objects.requireNonNull(text, "text must not be null");
            Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
        }
    }

    /** {@code TRANSCRIBE_FILE}: path of a WAV file readable by the daemon. */
    record FilePayload(String filePath) implements CommandPayload {
        public FilePayload {
            Objects.requireNonNull(filePath, "filePath must not be null");
        }
    }

    /** {@code UPDATE_CONFIG}: dotted setting keys to new values. */
    record ConfigPayload(Map<String, String> settings) implements CommandPayload {
        public ConfigPayload {
            Objects.requireNonNull(settings, "settings must not be null");
            settings = Collections.unmodifiableMap(new LinkedHashMap<>(settings));
        }
    }
}
