package space.maatini.magicauth.route;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Process-wide table of protected routes.
 * <p>
 * Populated once at startup by {@link ProtectedRouteDiscovery} and read
 * concurrently by every request afterwards. Routes keep their registration
 * order, which decides between overlapping routes.
 */
@ApplicationScoped
public class ProtectedRouteRegistry {

    private static final Logger LOG = Logger.getLogger(ProtectedRouteRegistry.class);

    private final Set<ProtectedRoute> routes = new CopyOnWriteArraySet<>();

    public void register(String prefix, PathPattern pattern) {
        register(prefix, pattern, null);
    }

    /**
     * Adds a protected route. Registering an identical triple twice is a no-op.
     */
    public void register(String prefix, PathPattern pattern, RoutePredicate predicate) {
        if (routes.add(new ProtectedRoute(prefix, pattern, predicate))) {
            LOG.debugf("Registered protected route %s%s", prefix != null ? prefix : "", pattern);
        }
    }

    /**
     * Canonical paths of all registered routes.
     */
    public List<String> getProtectedPaths() {
        return routes.stream()
                .map(ProtectedRoute::protectedPath)
                .toList();
    }

    /**
     * Returns true if the canonical path belongs to a registered route.
     */
    public boolean isRegistered(String protectedPath) {
        if (protectedPath == null) {
            return false;
        }
        for (ProtectedRoute route : routes) {
            if (route.protectedPath().equals(protectedPath)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Read-only view for the matcher, in registration order.
     */
    public Set<ProtectedRoute> routes() {
        return Collections.unmodifiableSet(routes);
    }

    public int size() {
        return routes.size();
    }

    public void walkPatterns(List<RouteNode> nodes) {
        walkPatterns(nodes, "");
    }

    /**
     * Registers the protected nodes of a route tree.
     * <p>
     * A protected group is registered as a whole and not descended into;
     * an unprotected group is descended into with its template appended to
     * the prefix; a protected leaf is registered with its predicate.
     */
    public void walkPatterns(List<RouteNode> nodes, String prefix) {
        if (nodes == null) {
            return;
        }
        for (RouteNode node : nodes) {
            if (node == null) {
                throw new IllegalArgumentException("Route tree under '" + prefix + "' contains a null node");
            }
            if (node instanceof RouteNode.Group group) {
                if (group.protect()) {
                    register(prefix, group.pattern());
                } else {
                    walkPatterns(group.children(), prefix + group.pattern());
                }
            } else if (node instanceof RouteNode.Leaf leaf && leaf.protect()) {
                register(prefix, leaf.pattern(), leaf.predicate());
            }
        }
        LOG.debugf("Parsed protected paths %s", getProtectedPaths());
    }

    /**
     * Removes every route. Only meant for test isolation.
     */
    public void reset() {
        routes.clear();
    }
}
