package space.maatini.magicauth.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Configuration mapping for the magic authorization gate.
 * All configuration is loaded from application.yaml under the 'magic-auth' prefix.
 */
@ConfigMapping(prefix = "magic-auth")
public interface MagicAuthConfig {

    /**
     * Debug mode. Relaxes the secure-cookie default.
     */
    @WithDefault("false")
    boolean debug();

    /**
     * Query parameter carrying the access token.
     */
    @WithName("token-param")
    @WithDefault("token")
    String tokenParam();

    /**
     * Cookie persistence of validated tokens.
     */
    CookieConfig cookie();

    /**
     * Name of a {@code @Named} ForbiddenHandler bean rendering denials.
     */
    @WithName("forbidden-handler")
    Optional<String> forbiddenHandler();

    /**
     * Qute template id rendering denials.
     */
    @WithName("forbidden-template")
    Optional<String> forbiddenTemplate();

    /**
     * Route templates protected in addition to the contributed route trees.
     */
    @WithName("protected-paths")
    Optional<List<String>> protectedPaths();

    /**
     * Admin REST surface.
     */
    AdminConfig admin();

    /**
     * Periodic removal of expired and exhausted tokens.
     */
    CleanupConfig cleanup();

    /**
     * Audit logging of access decisions.
     */
    AuditConfig audit();

    interface CookieConfig {
        @WithDefault("magic_authorization_")
        String prefix();

        /**
         * Unset means secure unless debug is enabled.
         */
        Optional<Boolean> secure();

        @WithName("max-age")
        @WithDefault("31536000")
        int maxAge();

        @WithName("same-site")
        @WithDefault("lax")
        String sameSite();

        @WithName("http-only")
        @WithDefault("true")
        boolean httpOnly();
    }

    interface AdminConfig {
        @WithDefault("false")
        boolean enabled();

        /**
         * Bearer key every admin request must present. Without one the admin
         * API rejects all requests.
         */
        @WithName("api-key")
        Optional<String> apiKey();
    }

    interface CleanupConfig {
        @WithDefault("true")
        boolean enabled();

        @WithDefault("1h")
        Duration every();
    }

    interface AuditConfig {
        @WithDefault("true")
        boolean enabled();
    }
}
