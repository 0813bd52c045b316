package space.maatini.magicauth.event;

import space.maatini.magicauth.model.AccessRequest;
import space.maatini.magicauth.model.DenialReason;

/**
 * Published after a request to a protected path was denied.
 *
 * @param request the denied request
 * @param path    the concrete request path
 * @param reason  why access was denied
 */
public record AccessDeniedEvent(AccessRequest request, String path, DenialReason reason) {
}
