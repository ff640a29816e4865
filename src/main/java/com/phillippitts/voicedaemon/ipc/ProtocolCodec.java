package com.phillippitts.voicedaemon.ipc;

import com.phillippitts.voicedaemon.domain.Command;
import com.phillippitts.voicedaemon.domain.CommandKind;
import com.phillippitts.voicedaemon.domain.CommandPayload;
import com.phillippitts.voicedaemon.domain.DaemonPhase;
import com.phillippitts.voicedaemon.domain.DaemonResponse;
import com.phillippitts.voicedaemon.domain.DaemonSnapshot;
import com.phillippitts.voicedaemon.exception.ProtocolException;
import com.phillippitts.voicedaemon.util.LogSanitizer;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * JSON encoding of requests, responses and state events.
 *
 * <p>Request: {@code {"command": "<KIND>", "payload": {...}}}.
 * <p>Response/event:
 * <pre>
 * {"type": "response"|"event", "event": name|null, "status": "success"|"error",
 *  "data": {...}|null, "error": msg|null, "error_type": type|null,
 *  "state": {"phase", "sequence", "recording_owner", "transcript", "last_error"}}
 * </pre>
 *
 * <p>Decoding a request validates the payload shape of its kind; anything malformed is a
 * {@link ProtocolException}.
 */
public final class ProtocolCodec {

    /** Default target language of TRANSLATE_TEXT. */
    public static final String DEFAULT_TARGET_LANGUAGE = "en";

    private static final Pattern TARGET_LANGUAGE = Pattern.compile("^[a-zA-Z\\s\\-]{2,20}$");

    private ProtocolCodec() {
    }

    public static Command decodeRequest(String json, UUID sessionId) {
        JSONObject root = parseObject(json);
        Object name = root.opt("command");
        if (!(name instanceof String commandName) || commandName.isBlank()) {
            throw new ProtocolException("Missing 'command' field");
        }
        CommandKind kind = CommandKind.fromWireName(commandName)
                .orElseThrow(() -> new ProtocolException("Unknown command: "
                        + LogSanitizer.truncate(commandName, 64)));
        JSONObject payload = payloadObject(root.opt("payload"));
        return new Command(kind, decodePayload(kind, payload), sessionId);
    }

    public static String encodeRequest(Command command) {
        JSONObject root = new JSONObject();
        root.put("command", command.kind().name());
        CommandPayload payload = command.payload();
        if (payload instanceof CommandPayload.TextPayload text) {
            root.put("payload", new JSONObject().put("text", text.text()));
        } else if (payload instanceof CommandPayload.TranslationPayload translation) {
            root.put("payload", new JSONObject()
                    .put("text", translation.text())
                    .put("target_lang", translation.targetLanguage()));
        } else if (payload instanceof CommandPayload.FilePayload file) {
            root.put("payload", new JSONObject().put("file_path", file.filePath()));
        } else if (payload instanceof CommandPayload.ConfigPayload config) {
            root.put("payload", new JSONObject(config.settings()));
        }
        return root.toString();
    }

    public static String encodeResponse(DaemonResponse response) {
        JSONObject root = new JSONObject();
        root.put("type", response.type().wireName());
        root.put("event", nullable(response.event()));
        root.put("status", response.status().wireName());
        root.put("data", response.data() == null ? JSONObject.NULL : new JSONObject(response.data()));
        root.put("error", nullable(response.error()));
        root.put("error_type", nullable(response.errorType()));
        root.put("state", encodeState(response.state()));
        return root.toString();
    }

    public static DaemonResponse decodeResponse(String json) {
        JSONObject root = parseObject(json);
        try {
            DaemonResponse.Type type = "event".equals(root.getString("type"))
                    ? DaemonResponse.Type.EVENT : DaemonResponse.Type.RESPONSE;
            DaemonResponse.Status status = "success".equals(root.getString("status"))
                    ? DaemonResponse.Status.SUCCESS : DaemonResponse.Status.ERROR;
            JSONObject data = root.optJSONObject("data");
            return new DaemonResponse(
                    type,
                    optNullableString(root, "event"),
                    status,
                    data == null ? null : data.toMap(),
                    optNullableString(root, "error"),
                    optNullableString(root, "error_type"),
                    decodeState(root.getJSONObject("state")));
        } catch (JSONException | IllegalArgumentException e) {
            throw new ProtocolException("Malformed response: " + e.getMessage(), e);
        }
    }

    static JSONObject encodeState(DaemonSnapshot state) {
        JSONObject json = new JSONObject();
        json.put("phase", state.phase().wireName());
        json.put("sequence", state.sequence());
        json.put("recording_owner", state.recordingOwner() == null
                ? JSONObject.NULL : state.recordingOwner().toString());
        json.put("transcript", state.transcript());
        json.put("last_error", nullable(state.lastError()));
        return json;
    }

    static DaemonSnapshot decodeState(JSONObject json) {
        String phaseName = json.getString("phase");
        DaemonPhase phase = DaemonPhase.fromWireName(phaseName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown phase: " + phaseName));
        String owner = optNullableString(json, "recording_owner");
        return new DaemonSnapshot(
                phase,
                json.getLong("sequence"),
                owner == null ? null : UUID.fromString(owner),
                json.optString("transcript", ""),
                optNullableString(json, "last_error"));
    }

    private static CommandPayload decodePayload(CommandKind kind, JSONObject payload) {
        switch (kind) {
            case PROCESS_TEXT:
                return new CommandPayload.TextPayload(requireText(payload));
            case TRANSLATE_TEXT:
                return new CommandPayload.TranslationPayload(requireText(payload), targetLanguage(payload));
            case TRANSCRIBE_FILE:
                return new CommandPayload.FilePayload(requireString(payload, "file_path"));
            case UPDATE_CONFIG:
                return configPayload(payload);
            default:
                return CommandPayload.NoPayload.INSTANCE;
        }
    }

    private static String requireText(JSONObject payload) {
        return requireString(payload, "text");
    }

    private static String requireString(JSONObject payload, String field) {
        Object value = payload.opt(field);
        if (!(value instanceof String s) || s.isBlank()) {
            throw new ProtocolException("Payload field '" + field + "' must be a non-empty string");
        }
        return s;
    }

    private static String targetLanguage(JSONObject payload) {
        Object value = payload.opt("target_lang");
        if (value == null || value == JSONObject.NULL) {
            return DEFAULT_TARGET_LANGUAGE;
        }
        if (!(value instanceof String language) || !TARGET_LANGUAGE.matcher(language).matches()) {
            throw new ProtocolException("Invalid 'target_lang': expected 2-20 letters, spaces or hyphens");
        }
        return language;
    }

    private static CommandPayload.ConfigPayload configPayload(JSONObject payload) {
        if (payload.isEmpty()) {
            throw new ProtocolException("UPDATE_CONFIG requires at least one setting");
        }
        Map<String, String> settings = new LinkedHashMap<>();
        for (String key : payload.keySet()) {
            Object value = payload.get(key);
            if (value instanceof JSONObject || value == JSONObject.NULL || value instanceof JSONArray) {
                throw new ProtocolException("Setting '" + key + "' must be a scalar value");
            }
            settings.put(key, String.valueOf(value));
        }
        return new CommandPayload.ConfigPayload(settings);
    }

    private static JSONObject payloadObject(Object raw) {
        if (raw == null || raw == JSONObject.NULL) {
            return new JSONObject();
        }
        if (raw instanceof JSONObject object) {
            return object;
        }
        throw new ProtocolException("'payload' must be a JSON object");
    }

    private static JSONObject parseObject(String json) {
        try {
            return new JSONObject(json);
        } catch (JSONException e) {
            throw new ProtocolException("Invalid JSON: " + e.getMessage(), e);
        }
    }

    private static Object nullable(String value) {
        return value == null ? JSONObject.NULL : value;
    }

    private static String optNullableString(JSONObject json, String key) {
        return json.isNull(key) ? null : json.getString(key);
    }
}
