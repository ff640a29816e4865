package com.phillippitts.voicedaemon.config;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Shared HTTP client for the LLM providers.
 *
 * <p>The call timeout matches the per-attempt refinement timeout so a cancelled attempt does not
 * keep its connection open past its budget.
 */
@Configuration
public class LlmClientConfig {

    @Bean
    public OkHttpClient llmHttpClient(RefinementProperties properties) {
        Duration timeout = Duration.ofMillis(properties.getRequestTimeoutMs());
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(Math.min(5_000, properties.getRequestTimeoutMs())))
                .readTimeout(timeout)
                .callTimeout(timeout)
                .retryOnConnectionFailure(false)
                .build();
    }
}
