package space.maatini.magicauth.filter;

import jakarta.ws.rs.core.Response;
import space.maatini.magicauth.model.DenialReason;

/**
 * Custom rendering of denied requests.
 * <p>
 * Register an implementation as a {@code @Named} bean and reference its name
 * in {@code magic-auth.forbidden-handler}.
 */
@FunctionalInterface
public interface ForbiddenHandler {

    /**
     * @param path   the concrete request path that was denied
     * @param reason why access was denied
     * @return the response sent to the client
     */
    Response handle(String path, DenialReason reason);
}
