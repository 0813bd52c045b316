package space.maatini.magicauth.route;

import java.util.Objects;

/**
 * A protected route: the registry prefix inherited from enclosing groups,
 * the route pattern itself and an optional predicate.
 * <p>
 * Identity covers all three components, so the same template registered
 * with two different predicates yields two entries.
 */
public record ProtectedRoute(String prefix, PathPattern pattern, RoutePredicate predicate) {

    public ProtectedRoute {
        prefix = prefix != null ? prefix : "";
        Objects.requireNonNull(pattern, "pattern");
    }

    public ProtectedRoute(String prefix, PathPattern pattern) {
        this(prefix, pattern, null);
    }

    /**
     * The canonical path tokens are issued for: prefix plus the literal
     * template, placeholders left unsubstituted.
     */
    public String protectedPath() {
        return prefix + pattern;
    }

    public boolean hasPredicate() {
        return predicate != null;
    }
}
