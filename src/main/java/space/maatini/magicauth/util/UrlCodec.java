package space.maatini.magicauth.util;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * URL encoding helpers for cookie names and redirect targets.
 */
public final class UrlCodec {

    private UrlCodec() {
        // Utility class
    }

    /**
     * Percent-encodes every character except unreserved ones
     * ({@code A-Z a-z 0-9 - . _ ~}), including slashes.
     * <p>
     * {@code blog/<int:year>/} becomes {@code blog%2F%3Cint%3Ayear%3E%2F}.
     */
    public static String percentEncode(String value) {
        if (value == null) {
            return "";
        }
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }

    /**
     * Percent-encodes each segment of a decoded path, keeping the slashes.
     */
    public static String encodePath(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        StringJoiner encoded = new StringJoiner("/");
        for (String segment : path.split("/", -1)) {
            encoded.add(percentEncode(segment));
        }
        return encoded.toString();
    }

    /**
     * Decodes a raw query string, keeping parameter order and repeated values.
     */
    public static Map<String, List<String>> decodeQuery(String rawQuery) {
        Map<String, List<String>> parameters = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return parameters;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = decode(eq >= 0 ? pair.substring(0, eq) : pair);
            String value = eq >= 0 ? decode(pair.substring(eq + 1)) : "";
            parameters.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        }
        return parameters;
    }

    /**
     * Encodes query parameters in form encoding, keeping their order and
     * repeated values.
     */
    public static String encodeQuery(Map<String, List<String>> parameters) {
        StringJoiner query = new StringJoiner("&");
        for (Map.Entry<String, List<String>> entry : parameters.entrySet()) {
            String name = URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8);
            List<String> values = entry.getValue();
            if (values == null || values.isEmpty()) {
                query.add(name + "=");
                continue;
            }
            for (String value : values) {
                query.add(name + "=" + URLEncoder.encode(value != null ? value : "", StandardCharsets.UTF_8));
            }
        }
        return query.toString();
    }

    private static String decode(String raw) {
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // malformed escape, keep as sent
            return raw;
        }
    }
}
