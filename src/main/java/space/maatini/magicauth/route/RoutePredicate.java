package space.maatini.magicauth.route;

import java.util.Map;

/**
 * Decides from the captured route parameters whether a concrete URL of a
 * protected pattern actually requires a token.
 * <p>
 * Returning false leaves that variant public. A thrown exception is treated
 * as protected.
 */
@FunctionalInterface
public interface RoutePredicate {

    boolean test(Map<String, Object> params) throws Exception;
}
