package space.maatini.magicauth.model;

import java.util.Objects;

/**
 * Result of the access gate for one request.
 * <ul>
 * <li>{@link Outcome#PASS}: path is not protected</li>
 * <li>{@link Outcome#ALLOW}: valid token from the cookie, continue to the handler</li>
 * <li>{@link Outcome#REDIRECT}: valid token from the query string, redirect to the stripped URL</li>
 * <li>{@link Outcome#DENY}: missing or invalid token</li>
 * </ul>
 */
public record AccessDecision(
        Outcome outcome,
        String protectedPath,
        String location,
        TokenCookie cookie,
        DenialReason reason) {

    public enum Outcome {
        PASS,
        ALLOW,
        REDIRECT,
        DENY
    }

    public static AccessDecision pass() {
        return new AccessDecision(Outcome.PASS, null, null, null, null);
    }

    public static AccessDecision allow(String protectedPath, TokenCookie cookie) {
        return new AccessDecision(Outcome.ALLOW, protectedPath, null, cookie, null);
    }

    public static AccessDecision redirect(String protectedPath, String location, TokenCookie cookie) {
        return new AccessDecision(Outcome.REDIRECT, protectedPath, Objects.requireNonNull(location, "location"),
                cookie, null);
    }

    public static AccessDecision deny(String protectedPath, DenialReason reason) {
        return new AccessDecision(Outcome.DENY, protectedPath, null, null, Objects.requireNonNull(reason, "reason"));
    }

    /**
     * Returns true unless the request is denied.
     */
    public boolean permitted() {
        return outcome != Outcome.DENY;
    }
}
