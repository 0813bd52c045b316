package space.maatini.magicauth.filter;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import space.maatini.magicauth.model.AccessDecision;
import space.maatini.magicauth.model.AccessRequest;
import space.maatini.magicauth.model.DenialReason;
import space.maatini.magicauth.model.TokenCookie;
import space.maatini.magicauth.service.MagicAuthorizationGate;
import space.maatini.magicauth.util.UrlCodec;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Request filter guarding protected routes with magic tokens.
 * <p>
 * Runs before resource matching, so every request path is checked. Denied
 * requests are answered by the {@link ForbiddenResponder}; requests carrying
 * a valid token in the query string are redirected to the same URL without
 * it; cookie-authorized requests continue and get the cookie refreshed by
 * the response filter.
 */
@Provider
@PreMatching
@Priority(Priorities.AUTHENTICATION)
@ApplicationScoped
public class MagicAuthorizationFilter implements ContainerRequestFilter, ContainerResponseFilter {

    private static final Logger LOG = Logger.getLogger(MagicAuthorizationFilter.class);
    static final String TOKEN_COOKIE_PROPERTY = "magic-auth.cookie";
    static final String ADMIN_PATH = "/magic-auth/admin";

    @Inject
    MagicAuthorizationGate gate;

    @Inject
    ForbiddenResponder forbiddenResponder;

    @Inject
    MeterRegistry meterRegistry;

    Clock clock = Clock.systemUTC();

    private Counter unprotectedCounter;
    private Counter grantedCounter;
    private final Map<DenialReason, Counter> deniedCounters = new EnumMap<>(DenialReason.class);
    private Timer filterTimer;

    @PostConstruct
    void init() {
        unprotectedCounter = Counter.builder("magic-auth.access.unprotected")
            .description("Requests to paths that are not protected")
            .register(meterRegistry);

        grantedCounter = Counter.builder("magic-auth.access.granted")
            .description("Requests granted by a valid token")
            .register(meterRegistry);

        for (DenialReason reason : DenialReason.values()) {
            deniedCounters.put(reason, Counter.builder("magic-auth.access.denied")
                .description("Requests denied by the access gate")
                .tag("reason", reason.code())
                .register(meterRegistry));
        }

        filterTimer = Timer.builder("magic-auth.filter.duration")
            .description("Access gate evaluation duration")
            .register(meterRegistry);
    }

    @Override
    public void filter(ContainerRequestContext requestContext) throws IOException {
        long startTime = System.nanoTime();
        String path = requestContext.getUriInfo().getPath();
        if (path == null || !path.startsWith("/")) {
            path = "/" + (path != null ? path : "");
        }

        if (isInternalPath(path)) {
            LOG.debugf("Skipping access gate for internal path: %s", path);
            return;
        }

        try {
            AccessDecision decision = gate.evaluate(toAccessRequest(requestContext, path), clock.instant());

            switch (decision.outcome()) {
                case PASS -> unprotectedCounter.increment();
                case ALLOW -> {
                    grantedCounter.increment();
                    requestContext.setProperty(TOKEN_COOKIE_PROPERTY, decision.cookie());
                }
                case REDIRECT -> {
                    grantedCounter.increment();
                    requestContext.abortWith(Response
                        .status(Response.Status.FOUND)
                        .location(URI.create(decision.location()))
                        .header(HttpHeaders.SET_COOKIE, decision.cookie().toHeaderValue())
                        .build());
                }
                case DENY -> {
                    deniedCounters.get(decision.reason()).increment();
                    requestContext.abortWith(forbiddenResponder.respond(path, decision.reason()));
                }
            }
        } catch (Exception e) {
            LOG.errorf(e, "Error during access gate evaluation for %s", path);
            requestContext.abortWith(ForbiddenResponder.plainForbidden("Access denied"));
        } finally {
            long duration = System.nanoTime() - startTime;
            filterTimer.record(duration, TimeUnit.NANOSECONDS);
        }
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext)
            throws IOException {
        Object cookie = requestContext.getProperty(TOKEN_COOKIE_PROPERTY);
        if (cookie instanceof TokenCookie tokenCookie) {
            responseContext.getHeaders().add(HttpHeaders.SET_COOKIE, tokenCookie.toHeaderValue());
        }
    }

    /**
     * Extracts path, ordered query parameters and cookies from the request.
     */
    private AccessRequest toAccessRequest(ContainerRequestContext requestContext, String path) {
        Map<String, String> cookies = new HashMap<>();
        for (Map.Entry<String, Cookie> entry : requestContext.getCookies().entrySet()) {
            if (entry.getValue() != null && entry.getValue().getValue() != null) {
                cookies.put(entry.getKey(), entry.getValue().getValue());
            }
        }
        String rawQuery = requestContext.getUriInfo().getRequestUri().getRawQuery();
        return new AccessRequest(path, UrlCodec.decodeQuery(rawQuery), cookies);
    }

    /**
     * Checks if a path is an internal Quarkus or admin path. Admin paths are
     * guarded by {@link AdminApiKeyFilter} instead.
     */
    private boolean isInternalPath(String path) {
        return path.startsWith("/q/") || isAdminPath(path);
    }

    static boolean isAdminPath(String path) {
        return path != null && (path.equals(ADMIN_PATH) || path.startsWith(ADMIN_PATH + "/"));
    }
}
