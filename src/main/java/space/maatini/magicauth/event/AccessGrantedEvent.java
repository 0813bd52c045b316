package space.maatini.magicauth.event;

import space.maatini.magicauth.model.AccessRequest;
import space.maatini.magicauth.model.AccessToken;

/**
 * Published after a token was accepted for a protected path.
 *
 * @param request       the request that presented the token
 * @param token         the token record after the access was recorded
 * @param protectedPath the canonical path of the matched route
 */
public record AccessGrantedEvent(AccessRequest request, AccessToken token, String protectedPath) {
}
