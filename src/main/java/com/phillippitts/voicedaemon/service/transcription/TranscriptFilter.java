package com.phillippitts.voicedaemon.service.transcription;

import com.phillippitts.voicedaemon.config.TranscriptionProperties;
import com.phillippitts.voicedaemon.domain.TranscriptionResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces engine output that carries no usable speech to the empty string.
 *
 * <p>Rejected output:
 * <ul>
 *   <li>results flagged {@code noSpeech}</li>
 *   <li>blank-audio markers such as {@code [BLANK_AUDIO]} or {@code (silence)}</li>
 *   <li>a single token repeated more than {@code transcription.max-token-repeats} times in a row,
 *       the usual signature of a hallucinating decoder</li>
 * </ul>
 */
@Component
public class TranscriptFilter {

    private static final Logger LOG = LogManager.getLogger(TranscriptFilter.class);

    /** Bracketed or parenthesised annotations emitted instead of words. */
    private static final Pattern MARKER = Pattern.compile("\\[[^\\]]*\\]|\\([^)]*\\)|\\*[^*]*\\*");

    private final int maxTokenRepeats;

    public TranscriptFilter(TranscriptionProperties properties) {
        this.maxTokenRepeats = properties.getMaxTokenRepeats();
    }

    /**
     * @return cleaned text, or "" when the result contains no usable speech
     */
    public String clean(TranscriptionResult result) {
        if (result == null || result.noSpeech()) {
            return "";
        }
        String text = MARKER.matcher(result.text()).replaceAll(" ").trim().replaceAll("\\s+", " ");
        if (text.isEmpty()) {
            return "";
        }
        if (hasRunawayRepeat(text)) {
            LOG.debug("Discarding garbled engine output ({} chars)", text.length());
            return "";
        }
        return text;
    }

    private boolean hasRunawayRepeat(String text) {
        String previous = null;
        int run = 0;
        for (String raw : text.split("\\s+")) {
            String token = raw.replaceAll("[^\\p{L}\\p{N}']", "").toLowerCase(Locale.ROOT);
            if (token.isEmpty()) {
                continue;
            }
            if (token.equals(previous)) {
                run++;
                if (run > maxTokenRepeats) {
                    return true;
                }
            } else {
                previous = token;
                run = 1;
            }
        }
        return false;
    }
}
