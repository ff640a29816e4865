package com.phillippitts.voicedaemon.service.refinement;

import com.phillippitts.voicedaemon.config.RefinementProperties;
import com.phillippitts.voicedaemon.domain.RefinementRequest;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeminiLlmProviderTest {

    private MockWebServer server;
    private RefinementProperties properties;
    private GeminiLlmProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        properties = new RefinementProperties();
        properties.getGemini().setBaseUrl(server.url("/v1beta/").toString());
        properties.getGemini().setModel("gemini-1.5-flash");
        properties.getGemini().setApiKey("test-key");
        provider = new GeminiLlmProvider(new OkHttpClient(), properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void postsGenerateContentWithApiKeyHeader() throws Exception {
        server.enqueue(new MockResponse().setBody(
                "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Hello, \"},{\"text\":\"world.\"}]}}]}"));

        String refined = provider.refine("hello world", RefinementRequest.refine());

        assertThat(refined).isEqualTo("Hello, world.");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1beta/models/gemini-1.5-flash:generateContent");
        assertThat(request.getHeader("x-goog-api-key")).isEqualTo("test-key");
        JSONObject body = new JSONObject(request.getBody().readUtf8());
        assertThat(body.getJSONArray("contents").getJSONObject(0).getJSONArray("parts").getJSONObject(0)
                .getString("text")).isEqualTo("hello world");
        assertThat(body.getJSONObject("systemInstruction").toString()).contains("expert editor");
    }

    @Test
    void missingApiKeyFailsWithoutRequest() {
        properties.getGemini().setApiKey(" ");

        assertThatThrownBy(() -> provider.refine("hello", RefinementRequest.refine()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("API key is not configured");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void httpErrorBecomesIOException() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"error\":\"quota\"}"));

        assertThatThrownBy(() -> provider.refine("hello", RefinementRequest.refine()))
                .isInstanceOf(IOException.class)
                .hasMessageStartingWith("Gemini returned HTTP 429");
    }

    @Test
    void unusableBodiesAreRejected() {
        assertThatThrownBy(() -> GeminiLlmProvider.extractText("{\"candidates\":[]}"))
                .hasMessage("Gemini returned no candidates");
        assertThatThrownBy(() -> GeminiLlmProvider.extractText(
                "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"  \"}]}}]}"))
                .hasMessage("Gemini returned an empty answer");
        assertThatThrownBy(() -> GeminiLlmProvider.extractText("{\"candidates\":[{}]}"))
                .hasMessageStartingWith("Malformed Gemini response");
    }
}
