package com.phillippitts.voicedaemon.service.refinement;

import com.phillippitts.voicedaemon.domain.RefinementRequest;

import java.io.IOException;

/**
 * Network-bound language model used to refine or translate text.
 */
public interface LlmProvider {

    /**
     * @return the {@code refinement.provider} value selecting this provider
     */
    String name();

    /**
     * Sends one request to the model.
     *
     * @return the refined or translated text, never blank
     * @throws IOException if the model is unreachable, answers with an error or an unusable body
     */
    String refine(String text, RefinementRequest request) throws IOException;
}
