package com.phillippitts.voicedaemon.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for LLM text refinement: provider selection, timeout and retry policy.
 *
 * <p>Retry waits grow exponentially from {@code retry-min-wait-ms} and are capped at
 * {@code retry-max-wait-ms}.
 */
@Validated
@ConfigurationProperties(prefix = "refinement")
public class RefinementProperties {

    /** Provider used for refinement: "local" (Ollama) or "gemini". */
    @Pattern(regexp = "local|gemini", message = "provider must be 'local' or 'gemini'")
    private String provider = "local";

    /** Per-attempt timeout (ms). */
    @Positive
    private long requestTimeoutMs = 30_000;

    /** Total attempts, including the first. */
    @Min(1)
    private int retryAttempts = 3;

    @Positive
    private long retryMinWaitMs = 2_000;

    @Positive
    private long retryMaxWaitMs = 10_000;

    /** Longest accepted input text (characters). */
    @Positive
    private int maxInputChars = 6_000;

    @Valid
    private Ollama ollama = new Ollama();

    @Valid
    private Gemini gemini = new Gemini();

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public void setRetryAttempts(int retryAttempts) {
        this.retryAttempts = retryAttempts;
    }

    public long getRetryMinWaitMs() {
        return retryMinWaitMs;
    }

    public void setRetryMinWaitMs(long retryMinWaitMs) {
        this.retryMinWaitMs = retryMinWaitMs;
    }

    public long getRetryMaxWaitMs() {
        return retryMaxWaitMs;
    }

    public void setRetryMaxWaitMs(long retryMaxWaitMs) {
        this.retryMaxWaitMs = retryMaxWaitMs;
    }

    public int getMaxInputChars() {
        return maxInputChars;
    }

    public void setMaxInputChars(int maxInputChars) {
        this.maxInputChars = maxInputChars;
    }

    public Ollama getOllama() {
        return ollama;
    }

    public void setOllama(Ollama ollama) {
        this.ollama = ollama;
    }

    public Gemini getGemini() {
        return gemini;
    }

    public void setGemini(Gemini gemini) {
        this.gemini = gemini;
    }

    /**
     * Local Ollama server.
     */
    public static class Ollama {
        @NotBlank
        private String baseUrl = "http://localhost:11434";
        @NotBlank
        private String model = "qwen2.5:3b";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }
    }

    /**
     * Google Gemini REST API.
     */
    public static class Gemini {
        @NotBlank
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";
        @NotBlank
        private String model = "gemini-1.5-flash";
        /** API key; usually supplied through the GEMINI_API_KEY environment variable. */
        private String apiKey;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }
}
