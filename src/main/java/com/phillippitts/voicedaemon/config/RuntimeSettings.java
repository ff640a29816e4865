package com.phillippitts.voicedaemon.config;

import com.phillippitts.voicedaemon.exception.ProtocolException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Settings that clients may change at runtime through {@code UPDATE_CONFIG}.
 *
 * <p>Seeded from the bound properties at startup. Written only on the control thread while the
 * daemon is idle; read by workers through volatile fields.
 */
@Component
public class RuntimeSettings {

    private static final Logger LOG = LogManager.getLogger(RuntimeSettings.class);

    public static final String LANGUAGE_KEY = "transcription.language";
    public static final String PROVIDER_KEY = "refinement.provider";

    private static final Set<String> PROVIDERS = Set.of("local", "gemini");
    private static final Pattern LANGUAGE = Pattern.compile("^(auto|[a-z]{2,3})$");

    private final WhisperConfig whisper;
    private final RefinementProperties refinement;
    private final DaemonProperties daemon;

    private volatile String language;
    private volatile String provider;

    public RuntimeSettings(WhisperConfig whisper, RefinementProperties refinement, DaemonProperties daemon) {
        this.whisper = whisper;
        this.refinement = refinement;
        this.daemon = daemon;
        this.language = whisper.language();
        this.provider = refinement.getProvider();
    }

    public String language() {
        return language;
    }

    public String provider() {
        return provider;
    }

    /**
     * Validates and applies a set of changes atomically: either every key is applied or none.
     *
     * @return the effective configuration after the update
     * @throws ProtocolException on unknown keys or invalid values
     */
    public Map<String, Object> apply(Map<String, String> changes) {
        String newLanguage = language;
        String newProvider = provider;
        for (Map.Entry<String, String> change : changes.entrySet()) {
            String value = change.getValue() == null ? "" : change.getValue().trim();
            switch (change.getKey()) {
                case LANGUAGE_KEY -> {
                    if (!LANGUAGE.matcher(value).matches()) {
                        throw new ProtocolException("Invalid language code: '" + value + "'");
                    }
                    newLanguage = value;
                }
                case PROVIDER_KEY -> {
                    if (!PROVIDERS.contains(value)) {
                        throw new ProtocolException("Invalid provider '" + value + "', expected one of " + PROVIDERS);
                    }
                    newProvider = value;
                }
                default -> throw new ProtocolException("Unknown config key: " + change.getKey());
            }
        }
        language = newLanguage;
        provider = newProvider;
        LOG.info("Runtime configuration updated: language={}, provider={}", newLanguage, newProvider);
        return effectiveConfig();
    }

    /**
     * Current non-secret configuration as reported by {@code GET_CONFIG}.
     */
    public Map<String, Object> effectiveConfig() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put(LANGUAGE_KEY, language);
        config.put(PROVIDER_KEY, provider);
        config.put("transcription.whisper.model-path", whisper.modelPath());
        config.put("refinement.request-timeout-ms", refinement.getRequestTimeoutMs());
        config.put("refinement.retry-attempts", refinement.getRetryAttempts());
        config.put("refinement.max-input-chars", refinement.getMaxInputChars());
        config.put("refinement.ollama.model", refinement.getOllama().getModel());
        config.put("refinement.gemini.model", refinement.getGemini().getModel());
        config.put("daemon.allow-foreign-stop", daemon.isAllowForeignStop());
        config.put("daemon.max-frame-bytes", daemon.getMaxFrameBytes());
        return config;
    }
}
