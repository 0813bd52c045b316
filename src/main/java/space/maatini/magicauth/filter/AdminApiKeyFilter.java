package space.maatini.magicauth.filter;

import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import space.maatini.magicauth.config.MagicAuthConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Guards the token admin API with a bearer API key.
 * <p>
 * Requests under {@code /magic-auth/admin} must carry
 * {@code Authorization: Bearer <magic-auth.admin.api-key>}. When the admin
 * API is disabled the request is left to the resource, which answers 404.
 */
@Provider
@PreMatching
@Priority(Priorities.AUTHENTICATION)
@ApplicationScoped
public class AdminApiKeyFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(AdminApiKeyFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    @Inject
    MagicAuthConfig config;

    @Override
    public void filter(ContainerRequestContext requestContext) throws IOException {
        String path = requestContext.getUriInfo().getPath();
        if (!MagicAuthorizationFilter.isAdminPath(path) || !config.admin().enabled()) {
            return;
        }

        Optional<String> apiKey = config.admin().apiKey().filter(key -> !key.isBlank());
        if (apiKey.isEmpty()) {
            LOG.warnf("Admin request to %s rejected: magic-auth.admin.api-key is not configured", path);
            abortWithUnauthorized(requestContext, "Admin API key not configured");
            return;
        }

        String presented = bearerToken(requestContext.getHeaderString(HttpHeaders.AUTHORIZATION));
        if (presented == null || !constantTimeEquals(apiKey.get(), presented)) {
            LOG.infof("Admin request to %s rejected: missing or invalid API key", path);
            abortWithUnauthorized(requestContext, "Authentication required");
        }
    }

    private static String bearerToken(String header) {
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private static boolean constantTimeEquals(String expected, String presented) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }

    private void abortWithUnauthorized(ContainerRequestContext requestContext, String message) {
        requestContext.abortWith(Response
            .status(Response.Status.UNAUTHORIZED)
            .type(MediaType.APPLICATION_JSON)
            .entity(new ErrorResponse("unauthorized", message))
            .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
            .build());
    }

    /**
     * Error response structure.
     */
    public record ErrorResponse(String code, String message) {
    }
}
