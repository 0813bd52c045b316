package space.maatini.magicauth.route;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import space.maatini.magicauth.config.MagicAuthConfig;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Builds the protected route registry at application startup from every
 * {@link RouteTree} bean and the configured {@code magic-auth.protected-paths}.
 * <p>
 * A malformed route tree fails the startup.
 */
@ApplicationScoped
public class ProtectedRouteDiscovery {

    private static final Logger LOG = Logger.getLogger(ProtectedRouteDiscovery.class);

    @Inject
    MagicAuthConfig config;

    @Inject
    ProtectedRouteRegistry registry;

    @Inject
    Instance<RouteTree> routeTrees;

    private final AtomicBoolean started = new AtomicBoolean();
    private volatile boolean completed;

    void onStart(@Observes StartupEvent event) {
        discover();
    }

    /**
     * Walks all route sources into the registry. Subsequent calls are no-ops.
     */
    public void discover() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        int trees = 0;
        for (RouteTree tree : routeTrees) {
            registry.walkPatterns(tree.routes());
            trees++;
        }

        List<String> configured = config.protectedPaths().orElse(List.of());
        for (String template : configured) {
            registry.register("", PathPattern.compile(stripLeadingSlashes(template)));
        }

        LOG.infof("Discovered %d protected route(s) from %d route tree(s) and %d configured path(s)",
                registry.size(), trees, configured.size());
        completed = true;
    }

    public boolean isDiscovered() {
        return completed;
    }

    private static String stripLeadingSlashes(String template) {
        String result = template.trim();
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        return result;
    }
}
