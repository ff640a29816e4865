package com.phillippitts.voicedaemon.service.refinement;

import com.phillippitts.voicedaemon.config.RefinementProperties;
import com.phillippitts.voicedaemon.domain.RefinementRequest;
import okhttp3.MediaType;
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

/**
 * Local model served by Ollama ({@code POST /api/chat}, non-streaming).
 */
@Component
public class OllamaLlmProvider implements LlmProvider {

    private static final Logger LOG = LogManager.getLogger(OllamaLlmProvider.class);
    static final MediaType MEDIA_TYPE_APPLICATION_JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final RefinementProperties.Ollama props;

    public OllamaLlmProvider(OkHttpClient httpClient, RefinementProperties properties) {
        this.httpClient = httpClient;
        this.props = properties.getOllama();
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public String refine(String text, RefinementRequest request) throws IOException {
        JSONObject body = new JSONObject()
                .put("model", props.getModel())
                .put("stream", false)
                .put("messages", new JSONArray()
                        .put(new JSONObject().put("role", "system")
                                .put("content", RefinementPrompts.systemInstruction(request)))
                        .put(new JSONObject().put("role", "user").put("content", text)))
                .put("options", new JSONObject().put("temperature", RefinementPrompts.temperature(request)));

        Request httpRequest = new Request.Builder()
                .url(trimSlash(props.getBaseUrl()) + "/api/chat")
                .post(RequestBody.create(body.toString(), MEDIA_TYPE_APPLICATION_JSON))
                .build();

        LOG.debug("Sending {} request to ollama model {}", request.mode(), props.getModel());
        try (Response response = httpClient.newCall(httpRequest).execute()) {
            ResponseBody responseBody = response.body();
            String payload = responseBody == null ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                throw new IOException("Ollama returned HTTP " + response.code() + ": " + abbreviate(payload));
            }
            return extractContent(payload);
        }
    }

    static String extractContent(String payload) throws IOException {
        try {
            String content = new JSONObject(payload).getJSONObject("message").getString("content").trim();
            if (content.isEmpty()) {
                throw new IOException("Ollama returned an empty message");
            }
            return content;
        } catch (JSONException e) {
            throw new IOException("Malformed Ollama response: " + e.getMessage(), e);
        }
    }

    static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    static String abbreviate(String payload) {
        return payload.length() <= 200 ? payload : payload.substring(0, 200) + "...";
    }
}
