package space.maatini.magicauth.route;

import java.util.List;

/**
 * Contributes application routes to protected-route discovery.
 * Implementations are CDI beans; every bean is walked once at startup.
 */
public interface RouteTree {

    List<RouteNode> routes();
}
