package space.maatini.magicauth.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The parts of an incoming HTTP request the access gate looks at.
 *
 * @param path            request path with a leading slash
 * @param queryParameters query parameters in request order
 * @param cookies         cookie values by name
 */
public record AccessRequest(
        String path,
        Map<String, List<String>> queryParameters,
        Map<String, String> cookies) {

    public AccessRequest {
        path = normalizePath(path);
        queryParameters = queryParameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(queryParameters))
                : Map.of();
        cookies = cookies != null ? Map.copyOf(cookies) : Map.of();
    }

    public static AccessRequest of(String path) {
        return new AccessRequest(path, Map.of(), Map.of());
    }

    /**
     * Last value of a query parameter, or null when absent. With
     * {@code ?token=old&token=new} this is {@code new}.
     */
    public String queryParameter(String name) {
        List<String> values = queryParameters.get(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }

    public String cookie(String name) {
        return cookies.get(name);
    }

    private static String normalizePath(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        return path.startsWith("/") ? path : "/" + path;
    }
}
