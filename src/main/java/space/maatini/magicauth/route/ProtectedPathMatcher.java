package space.maatini.magicauth.route;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Resolves a request path to the protected route covering it.
 * <p>
 * Matching rules, applied to every registered route until one matches:
 * <ol>
 * <li>the path without its leading slashes must start with the route prefix</li>
 * <li>the pattern must match the start of what follows the prefix</li>
 * <li>if the template does not end in a slash, the remaining suffix must be
 * empty or start with a slash, so {@code admin} covers {@code /admin/users}
 * but not {@code /admin-panel}</li>
 * <li>a predicate returning false skips the route; a predicate throwing
 * keeps it protected</li>
 * </ol>
 */
@ApplicationScoped
public class ProtectedPathMatcher {

    private static final Logger LOG = Logger.getLogger(ProtectedPathMatcher.class);

    @Inject
    ProtectedRouteRegistry registry;

    public ProtectedPathMatcher() {
    }

    public ProtectedPathMatcher(ProtectedRouteRegistry registry) {
        this.registry = registry;
    }

    /**
     * Finds the first protected route covering the given path.
     *
     * @param requestPath the request path, e.g. {@code /blog/2024/my-post/}
     * @return the matched route, or empty if the path is not protected
     */
    public Optional<MatchedRoute> match(String requestPath) {
        if (requestPath == null) {
            return Optional.empty();
        }
        String path = stripLeadingSlashes(requestPath);

        for (ProtectedRoute route : registry.routes()) {
            if (!path.startsWith(route.prefix())) {
                continue;
            }
            String remainder = path.substring(route.prefix().length());

            Optional<PatternMatch> match = route.pattern().match(remainder);
            if (match.isEmpty()) {
                continue;
            }

            String suffix = match.get().remaining();
            if (!route.pattern().endsWithSlash() && !suffix.isEmpty() && !suffix.startsWith("/")) {
                continue;
            }

            if (route.hasPredicate() && !isProtectedVariant(route, match.get(), requestPath)) {
                continue;
            }

            return Optional.of(new MatchedRoute(route, route.protectedPath(), match.get().params()));
        }
        return Optional.empty();
    }

    /**
     * Returns true if the path falls under any protected route.
     */
    public boolean isProtected(String requestPath) {
        return match(requestPath).isPresent();
    }

    private boolean isProtectedVariant(ProtectedRoute route, PatternMatch match, String requestPath) {
        try {
            return route.predicate().test(match.params());
        } catch (Exception e) {
            LOG.errorf(e, "Error evaluating protect predicate for path %s, treating it as protected", requestPath);
            return true;
        }
    }

    private static String stripLeadingSlashes(String path) {
        int i = 0;
        while (i < path.length() && path.charAt(i) == '/') {
            i++;
        }
        return path.substring(i);
    }
}
