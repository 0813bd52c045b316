package space.maatini.magicauth.service;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import space.maatini.magicauth.config.AccessSettings;
import space.maatini.magicauth.config.MagicAuthConfig;
import space.maatini.magicauth.event.AccessDeniedEvent;
import space.maatini.magicauth.event.AccessEventListener;
import space.maatini.magicauth.event.AccessGrantedEvent;
import space.maatini.magicauth.model.AccessDecision;
import space.maatini.magicauth.model.AccessRequest;
import space.maatini.magicauth.model.DenialReason;
import space.maatini.magicauth.model.TokenCookie;
import space.maatini.magicauth.model.ValidationResult;
import space.maatini.magicauth.route.MatchedRoute;
import space.maatini.magicauth.route.ProtectedPathMatcher;
import space.maatini.magicauth.token.TokenValidator;
import space.maatini.magicauth.util.UrlCodec;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Decides for one request whether it may reach a protected route:
 * <ol>
 * <li>unprotected path: pass</li>
 * <li>no token in the query string nor in the pattern cookie: deny {@code no_token}</li>
 * <li>token present but not accepted: deny {@code invalid_token}</li>
 * <li>token from the query string accepted: redirect to the same URL without
 * the token parameter and persist the token in a cookie</li>
 * <li>token from the cookie accepted: allow and refresh the cookie</li>
 * </ol>
 * The query parameter always wins over the cookie, so a stale cookie never
 * shadows a fresh link.
 */
@ApplicationScoped
public class MagicAuthorizationGate {

    private static final Logger LOG = Logger.getLogger(MagicAuthorizationGate.class);

    @Inject
    MagicAuthConfig config;

    @Inject
    ProtectedPathMatcher matcher;

    @Inject
    TokenValidator validator;

    @Inject
    Instance<AccessEventListener> listenerBeans;

    private AccessSettings settings;
    private List<AccessEventListener> listeners;

    public MagicAuthorizationGate() {
    }

    public MagicAuthorizationGate(ProtectedPathMatcher matcher, TokenValidator validator,
                                  AccessSettings settings, List<AccessEventListener> listeners) {
        this.matcher = matcher;
        this.validator = validator;
        this.settings = settings;
        this.listeners = List.copyOf(listeners);
    }

    @PostConstruct
    void init() {
        settings = AccessSettings.from(config);
        List<AccessEventListener> resolved = new ArrayList<>();
        listenerBeans.forEach(resolved::add);
        listeners = List.copyOf(resolved);
        LOG.debugf("Access gate initialized with %d listener(s), token parameter '%s'",
                listeners.size(), settings.tokenParam());
    }

    public AccessSettings settings() {
        return settings;
    }

    /**
     * Evaluates a request at the given instant.
     */
    public AccessDecision evaluate(AccessRequest request, Instant now) {
        Optional<MatchedRoute> matched = matcher.match(request.path());
        if (matched.isEmpty()) {
            LOG.debugf("Access granted to %s: not a protected path", request.path());
            return AccessDecision.pass();
        }

        String protectedPath = matched.get().protectedPath();
        String cookieName = cookieName(protectedPath);

        String queryToken = emptyToNull(request.queryParameter(settings.tokenParam()));
        String candidate = queryToken != null ? queryToken : emptyToNull(request.cookie(cookieName));
        if (candidate == null) {
            LOG.infof("Access denied to %s: no token provided", request.path());
            return deny(request, protectedPath, DenialReason.NO_TOKEN);
        }

        ValidationResult result = validator.validate(candidate, protectedPath, now);
        if (!result.isGranted()) {
            LOG.infof("Access denied to %s: %s", request.path(),
                    result.reason() == DenialReason.NO_TOKEN ? "no token provided" : "invalid token provided");
            return deny(request, protectedPath, result.reason());
        }

        AccessGrantedEvent granted = new AccessGrantedEvent(request, result.token(), protectedPath);
        notifyListeners(listener -> listener.onAccessGranted(granted));

        TokenCookie cookie = new TokenCookie(
                cookieName,
                candidate,
                cookiePath(protectedPath),
                settings.cookieMaxAge(),
                settings.cookieHttpOnly(),
                settings.cookieSecure(),
                settings.cookieSameSite());

        LOG.debugf("Access granted to %s", protectedPath);
        if (queryToken != null) {
            return AccessDecision.redirect(protectedPath, strippedLocation(request), cookie);
        }
        return AccessDecision.allow(protectedPath, cookie);
    }

    /**
     * Cookie name for a canonical path: the configured prefix followed by the
     * fully percent-encoded path. All URLs of one pattern share the cookie.
     */
    public String cookieName(String protectedPath) {
        return settings.cookiePrefix() + UrlCodec.percentEncode(protectedPath);
    }

    /**
     * Cookie scope: the static part of the canonical path before the first
     * parameter, or {@code /} when the pattern starts with one.
     */
    public static String cookiePath(String protectedPath) {
        int dynamic = protectedPath.indexOf('<');
        return "/" + (dynamic == -1 ? protectedPath : protectedPath.substring(0, dynamic));
    }

    private String strippedLocation(AccessRequest request) {
        Map<String, List<String>> remaining = new LinkedHashMap<>(request.queryParameters());
        remaining.remove(settings.tokenParam());

        String location = UrlCodec.encodePath(request.path());
        if (!remaining.isEmpty()) {
            location += "?" + UrlCodec.encodeQuery(remaining);
        }
        return location;
    }

    private AccessDecision deny(AccessRequest request, String protectedPath, DenialReason reason) {
        AccessDeniedEvent denied = new AccessDeniedEvent(request, request.path(), reason);
        notifyListeners(listener -> listener.onAccessDenied(denied));
        return AccessDecision.deny(protectedPath, reason);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private void notifyListeners(Consumer<AccessEventListener> notification) {
        for (AccessEventListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                LOG.warnf(e, "Access event listener %s failed", listener.getClass().getName());
            }
        }
    }
}
