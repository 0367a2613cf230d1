package io.lighting.metakit.cursor;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Opaque cursor tokens.
 * <p>
 * A token is the standard Base64 encoding of a plain-text payload. Mappings are
 * serialized as {@code key=value&key=value} with URL-encoded keys and values, in the
 * map's iteration order; a single value is serialized as its URL-encoded text.
 * <p>
 * Tokens are not signed or encrypted. Anyone can read or forge them, so a decoded
 * cursor is caller-supplied input and must only ever be used as a bound parameter.
 */
public final class CursorCodec {
    private static final Base64.Encoder ENCODER = Base64.getEncoder();
    private static final Base64.Decoder DECODER = Base64.getDecoder();

    private CursorCodec() {
    }

    public static String encode(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        return encodePayload(serialize(values));
    }

    public static String encodeValue(Object value) {
        Objects.requireNonNull(value, "value");
        return encodePayload(urlEncode(String.valueOf(value)));
    }

    /**
     * Serialized payload of a mapping, the text that {@link #decode(String)} returns for
     * the token produced by {@link #encode(Map)}.
     */
    public static String serialize(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        StringBuilder out = new StringBuilder();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (out.length() > 0) {
                out.append('&');
            }
            out.append(urlEncode(entry.getKey()))
                .append('=')
                .append(urlEncode(String.valueOf(entry.getValue())));
        }
        return out.toString();
    }

    /**
     * @return the serialized payload carried by the token
     * @throws InvalidCursorException when the token is blank or not valid Base64
     */
    public static String decode(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidCursorException("cursor must not be blank");
        }
        try {
            return new String(DECODER.decode(token.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            throw new InvalidCursorException("cursor is not valid base64: " + token, ex);
        }
    }

    /**
     * Decodes a token produced by {@link #encode(Map)} back into its entries. A token
     * produced by {@link #encodeValue(Object)} yields an empty map.
     */
    public static Map<String, String> decodeValues(String token) {
        return parse(decode(token));
    }

    /**
     * The value to compare the cursor field against: the entry stored under
     * {@code cursorField} when the payload is a mapping that has one, otherwise the
     * whole decoded payload.
     */
    public static String comparisonValue(String token, String cursorField) {
        String payload = decode(token);
        Map<String, String> values = parse(payload);
        if (cursorField != null && values.containsKey(cursorField)) {
            return values.get(cursorField);
        }
        return urlDecode(payload);
    }

    private static Map<String, String> parse(String payload) {
        Map<String, String> values = new LinkedHashMap<>();
        if (payload.isEmpty()) {
            return values;
        }
        for (String pair : payload.split("&")) {
            int eq = pair.indexOf('=');
            if (eq < 0) {
                return new LinkedHashMap<>();
            }
            values.put(urlDecode(pair.substring(0, eq)), urlDecode(pair.substring(eq + 1)));
        }
        return values;
    }

    private static String encodePayload(String payload) {
        return ENCODER.encodeToString(payload.getBytes(StandardCharsets.UTF_8));
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String urlDecode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            throw new InvalidCursorException("cursor payload is malformed: " + value, ex);
        }
    }
}
