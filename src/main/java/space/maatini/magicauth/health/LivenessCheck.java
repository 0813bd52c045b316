package space.maatini.magicauth.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Liveness;
import space.maatini.magicauth.config.MagicAuthConfig;

/**
 * Liveness health check for the access gate.
 * Indicates whether the application is running and responsive.
 */
@Liveness
@ApplicationScoped
public class LivenessCheck implements HealthCheck {

    @Inject
    MagicAuthConfig config;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("magic-auth-liveness")
                .withData("token.param", config.tokenParam())
                .withData("admin.enabled", config.admin().enabled())
                .withData("cleanup.enabled", config.cleanup().enabled());

        return builder.up().build();
    }
}
