package com.phillippitts.voicedaemon.service.refinement;

import com.phillippitts.voicedaemon.config.RefinementProperties;
import com.phillippitts.voicedaemon.domain.RefinementRequest;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;

import static com.phillippitts.voicedaemon.service.refinement.OllamaLlmProvider.MEDIA_TYPE_APPLICATION_JSON;
import static com.phillippitts.voicedaemon.service.refinement.OllamaLlmProvider.abbreviate;
import static com.phillippitts.voicedaemon.service.refinement.OllamaLlmProvider.trimSlash;

/**
 * Google Gemini through the {@code models/{model}:generateContent} REST endpoint.
 */
@Component
public class GeminiLlmProvider implements LlmProvider {

    private static final Logger LOG = LogManager.getLogger(GeminiLlmProvider.class);

    private final OkHttpClient httpClient;
    private final RefinementProperties.Gemini props;

    public GeminiLlmProvider(OkHttpClient httpClient, RefinementProperties properties) {
        this.httpClient = httpClient;
        this.props = properties.getGemini();
    }

    @Override
    public String name() {
        return "gemini";
    }

    @Override
    public String refine(String text, RefinementRequest request) throws IOException {
        String apiKey = props.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new IOException("Gemini API key is not configured (refinement.gemini.api-key)");
        }
        JSONObject body = new JSONObject()
                .put("systemInstruction", new JSONObject()
                        .put("parts", new JSONArray().put(new JSONObject()
                                .put("text", RefinementPrompts.systemInstruction(request)))))
                .put("contents", new JSONArray().put(new JSONObject()
                        .put("role", "user")
                        .put("parts", new JSONArray().put(new JSONObject().put("text", text)))))
                .put("generationConfig", new JSONObject()
                        .put("temperature", RefinementPrompts.temperature(request)));

        Request httpRequest = new Request.Builder()
                .url(trimSlash(props.getBaseUrl()) + "/models/" + props.getModel() + ":generateContent")
                .header("x-goog-api-key", apiKey)
                .post(RequestBody.create(body.toString(), MEDIA_TYPE_APPLICATION_JSON))
                .build();

        LOG.debug("Sending {} request to gemini model {}", request.mode(), props.getModel());
        try (Response response = httpClient.newCall(httpRequest).execute()) {
            ResponseBody responseBody = response.body();
            String payload = responseBody == null ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                throw new IOException("Gemini returned HTTP " + response.code() + ": " + abbreviate(payload));
            }
            return extractText(payload);
        }
    }

    static String extractText(String payload) throws IOException {
        try {
            JSONArray candidates = new JSONObject(payload).optJSONArray("candidates");
            if (candidates == null || candidates.isEmpty()) {
                throw new IOException("Gemini returned no candidates");
            }
            JSONArray parts = candidates.getJSONObject(0).getJSONObject("content").getJSONArray("parts");
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < parts.length(); i++) {
                text.append(parts.getJSONObject(i).optString("text", ""));
            }
            String result = text.toString().trim();
            if (result.isEmpty()) {
                throw new IOException("Gemini returned an empty answer");
            }
            return result;
        } catch (JSONException e) {
            throw new IOException("Malformed Gemini response: " + e.getMessage(), e);
        }
    }
}
