package com.phillippitts.voicedaemon.service.refinement;

import com.phillippitts.voicedaemon.domain.RefinementRequest;

/**
 * System instructions sent with each provider request.
 */
final class RefinementPrompts {

    static final double REFINE_TEMPERATURE = 0.3;
    static final double TRANSLATE_TEMPERATURE = 0.1;

    private static final String REFINE = "You are an expert editor. Fix grammar, punctuation and coherence of the "
            + "dictated text while keeping its meaning, language and tone. Return ONLY the corrected text, "
            + "without explanations or notes.";

    private RefinementPrompts() {}

    static String systemInstruction(RefinementRequest request) {
        if (request.mode() == RefinementRequest.Mode.TRANSLATE) {
            return "You are an expert translator. Translate the following text into '" + request.targetLanguage()
                    + "'. Return ONLY the translated text, without explanations or notes.";
        }
        return REFINE;
    }

    static double temperature(RefinementRequest request) {
        return request.mode() == RefinementRequest.Mode.TRANSLATE ? TRANSLATE_TEMPERATURE : REFINE_TEMPERATURE;
    }
}
