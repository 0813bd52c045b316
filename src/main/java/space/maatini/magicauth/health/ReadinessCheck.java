package space.maatini.magicauth.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import space.maatini.magicauth.route.ProtectedRouteDiscovery;
import space.maatini.magicauth.route.ProtectedRouteRegistry;

/**
 * Readiness health check for the access gate.
 * Reports DOWN until protected-route discovery has completed, since requests
 * served before that would see an empty registry.
 */
@Readiness
@ApplicationScoped
public class ReadinessCheck implements HealthCheck {

    @Inject
    ProtectedRouteDiscovery discovery;

    @Inject
    ProtectedRouteRegistry registry;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("magic-auth-readiness")
                .withData("routes.discovered", discovery.isDiscovered())
                .withData("routes.protected", registry.size());

        if (discovery.isDiscovered()) {
            return builder.up().build();
        }
        return builder.down().build();
    }
}
