package com.phillippitts.voicedaemon.exception;

/**
 * Thrown when the LLM provider fails after the retry budget is exhausted.
 * Carries the caller's original text unmodified so it can be handed back to the client.
 */
public class RefinementException extends VoiceDaemonException {

    private final String originalText;
    private final int attempts;

    public RefinementException(String message, String originalText, int attempts, Throwable cause) {
        super(message, cause);
        this.originalText = originalText;
        this.attempts = attempts;
    }

    public String getOriginalText() {
        return originalText;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public String errorType() {
        return "RefinementError";
    }
}
