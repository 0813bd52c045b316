package space.maatini.magicauth.route;

import java.util.List;
import java.util.Objects;

/**
 * Node of an application route tree.
 * <p>
 * A {@link Group} nests further nodes under its template, a {@link Leaf} is a
 * terminal route. Either may be marked protected; only leaves carry a
 * predicate.
 */
public sealed interface RouteNode permits RouteNode.Group, RouteNode.Leaf {

    /**
     * Route template of this node, relative to its parent.
     */
    PathPattern pattern();

    boolean protect();

    static Group group(String template, RouteNode... children) {
        return new Group(PathPattern.compile(template), List.of(children), false);
    }

    static Group group(String template, List<RouteNode> children) {
        return new Group(PathPattern.compile(template), children, false);
    }

    /**
     * A group whose whole subtree requires a token.
     */
    static Group protectedGroup(String template, RouteNode... children) {
        return new Group(PathPattern.compile(template), List.of(children), true);
    }

    static Leaf leaf(String template) {
        return new Leaf(PathPattern.compile(template), false, null);
    }

    static Leaf protectedLeaf(String template) {
        return new Leaf(PathPattern.compile(template), true, null);
    }

    static Leaf protectedLeaf(String template, RoutePredicate predicate) {
        return new Leaf(PathPattern.compile(template), true, predicate);
    }

    record Group(PathPattern pattern, List<RouteNode> children, boolean protect) implements RouteNode {
        public Group {
            Objects.requireNonNull(pattern, "pattern");
            children = children != null ? List.copyOf(children) : List.of();
        }
    }

    record Leaf(PathPattern pattern, boolean protect, RoutePredicate predicate) implements RouteNode {
        public Leaf {
            Objects.requireNonNull(pattern, "pattern");
        }
    }
}
