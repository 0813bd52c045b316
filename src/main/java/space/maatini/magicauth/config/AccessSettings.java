package space.maatini.magicauth.config;

import java.util.Locale;

/**
 * Resolved, immutable view of the settings the access gate works with.
 */
public record AccessSettings(
        String tokenParam,
        String cookiePrefix,
        int cookieMaxAge,
        boolean cookieSecure,
        boolean cookieHttpOnly,
        SameSite cookieSameSite) {

    public static final String DEFAULT_TOKEN_PARAM = "token";
    public static final String DEFAULT_COOKIE_PREFIX = "magic_authorization_";
    public static final int DEFAULT_COOKIE_MAX_AGE = 60 * 60 * 24 * 365;

    public AccessSettings {
        if (tokenParam == null || tokenParam.isBlank()) {
            throw new IllegalArgumentException("token-param must not be blank");
        }
        if (cookiePrefix == null) {
            throw new IllegalArgumentException("cookie.prefix must not be null");
        }
        if (cookieSameSite == null) {
            cookieSameSite = SameSite.LAX;
        }
    }

    /**
     * Defaults as shipped, with secure cookies.
     */
    public static AccessSettings defaults() {
        return new AccessSettings(DEFAULT_TOKEN_PARAM, DEFAULT_COOKIE_PREFIX, DEFAULT_COOKIE_MAX_AGE,
                true, true, SameSite.LAX);
    }

    /**
     * Resolves the configuration mapping, applying the debug-dependent secure default.
     */
    public static AccessSettings from(MagicAuthConfig config) {
        MagicAuthConfig.CookieConfig cookie = config.cookie();
        return new AccessSettings(
                config.tokenParam(),
                cookie.prefix(),
                cookie.maxAge(),
                cookie.secure().orElse(!config.debug()),
                cookie.httpOnly(),
                SameSite.parse(cookie.sameSite()));
    }

    public AccessSettings withTokenParam(String tokenParam) {
        return new AccessSettings(tokenParam, cookiePrefix, cookieMaxAge, cookieSecure, cookieHttpOnly,
                cookieSameSite);
    }

    public AccessSettings withCookiePrefix(String cookiePrefix) {
        return new AccessSettings(tokenParam, cookiePrefix, cookieMaxAge, cookieSecure, cookieHttpOnly,
                cookieSameSite);
    }

    /**
     * SameSite attribute of the token cookie.
     */
    public enum SameSite {
        LAX,
        STRICT,
        NONE;

        public static SameSite parse(String value) {
            if (value == null || value.isBlank()) {
                return LAX;
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "Unsupported cookie.same-site value '" + value + "', expected lax, strict or none", e);
            }
        }

        /**
         * Attribute value as written into Set-Cookie.
         */
        public String attributeValue() {
            return switch (this) {
                case LAX -> "Lax";
                case STRICT -> "Strict";
                case NONE -> "None";
            };
        }
    }
}
