package com.phillippitts.voicedaemon.domain;

import com.phillippitts.voicedaemon.exception.VoiceDaemonException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outbound message: either the response to one request or a broadcast state event.
 *
 * <p>Every message carries the snapshot that was current when it was produced, so clients can
 * always render the phase authoritatively.
 *
 * <p>{@code data} is copied deeply into unmodifiable maps and lists, with numbers held the way
 * JSON carries them: integral values as {@link Long}, everything else as {@link Double}. A
 * message therefore compares equal to its own decoded wire form.
 *
 * @param type      response or event
 * @param event     event name for events (e.g. "recording_started"), null for responses
 * @param status    success or error
 * @param data      command- or event-specific data, may be null
 * @param error     human-readable error message, null on success
 * @param errorType wire error category (e.g. "ProtocolError"), null on success
 * @param state     snapshot attached to the message
 */
public record DaemonResponse(
        Type type,
        String event,
        Status status,
        Map<String, Object> data,
        String error,
        String errorType,
        DaemonSnapshot state
) {

    public enum Type {
        RESPONSE("response"),
        EVENT("event");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    public enum Status {
        SUCCESS("success"),
        ERROR("error");

        private final String wireName;

        Status(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    public DaemonResponse {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(state, "state must not be null");
        if (data != null) {
            data = normalizeMap(data);
        }
    }

    public static DaemonResponse success(DaemonSnapshot state, Map<String, Object> data) {
        return new DaemonResponse(Type.RESPONSE, null, Status.SUCCESS, data, null, null, state);
    }

    public static DaemonResponse error(VoiceDaemonException e, DaemonSnapshot state) {
        return new DaemonResponse(Type.RESPONSE, null, Status.ERROR, null, e.getMessage(), e.errorType(), state);
    }

    public static DaemonResponse event(String event, DaemonSnapshot state, Map<String, Object> data) {
        return new DaemonResponse(Type.EVENT, event, Status.SUCCESS, data, null, null, state);
    }

    public static DaemonResponse errorEvent(String event, DaemonSnapshot state, Map<String, Object> data,
                                            String error, String errorType) {
        return new DaemonResponse(Type.EVENT, event, Status.ERROR, data, error, errorType, state);
    }

    public boolean isEvent() {
        return type == Type.EVENT;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /** Returns a data value as a string, or null when absent. */
    public String dataString(String key) {
        if (data == null) {
            return null;
        }
        Object value = data.get(key);
        return value == null ? null : String.valueOf(value);
    }

    private static Map<String, Object> normalizeMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), normalize(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object normalize(Object value) {
        if (value instanceof Map<?, ?> nested) {
            return normalizeMap(nested);
        }
        if (value instanceof Collection<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            items.forEach(item -> copy.add(normalize(item)));
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Number number) {
            return normalizeNumber(number);
        }
        return value;
    }

    static Number normalizeNumber(Number number) {
        if (number instanceof Long) {
            return number;
        }
        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return number.longValue();
        }
        if (number instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE ? (Number) big.longValueExact() : big;
        }
        double d = number instanceof BigDecimal decimal ? decimal.doubleValue() : number.doubleValue();
        // JSON writes 12.0 as 12, so integral doubles must come back as the same Long
        if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 0x1p53) {
            return (long) d;
        }
        return d;
    }
}
