package com.phillippitts.voicedaemon.domain;

import java.util.Objects;

/**
 * What the LLM provider should do with a piece of text.
 *
 * @param mode           refine (clean up dictation) or translate
 * @param targetLanguage target language for {@link Mode#TRANSLATE}, null otherwise
 */
public record RefinementRequest(Mode mode, String targetLanguage) {

    public enum Mode {
        REFINE,
        TRANSLATE
    }

    public RefinementRequest {
        Objects.requireNonNull(mode, "mode must not be null");
        if (mode == Mode.TRANSLATE && (targetLanguage == null || targetLanguage.isBlank())) {
            throw new IllegalArgumentException("targetLanguage is required for translation");
        }
    }

    public static RefinementRequest refine() {
        return new RefinementRequest(Mode.REFINE, null);
    }

    public static RefinementRequest translate(String targetLanguage) {
        return new RefinementRequest(Mode.TRANSLATE, targetLanguage);
    }
}
