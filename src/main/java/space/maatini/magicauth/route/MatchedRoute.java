package space.maatini.magicauth.route;

import java.util.Map;

/**
 * A request path resolved to the protected route covering it.
 */
public record MatchedRoute(ProtectedRoute route, String protectedPath, Map<String, Object> params) {

    public MatchedRoute {
        params = params != null ? Map.copyOf(params) : Map.of();
    }
}
