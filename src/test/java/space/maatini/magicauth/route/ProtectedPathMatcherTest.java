package space.maatini.magicauth.route;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProtectedPathMatcherTest {

    ProtectedRouteRegistry registry;
    ProtectedPathMatcher matcher;

    @BeforeEach
    void setup() {
        registry = new ProtectedRouteRegistry();
        matcher = new ProtectedPathMatcher(registry);
    }

    private void register(String prefix, String template) {
        registry.register(prefix, PathPattern.compile(template));
    }

    // --- Static patterns ---

    @Test
    void testUnregisteredPathIsNotProtected() {
        register("", "protected/");
        assertTrue(matcher.match("/public/").isEmpty());
    }

    @Test
    void testEmptyRegistryProtectsNothing() {
        assertFalse(matcher.isProtected("/anything/"));
    }

    @ParameterizedTest
    @CsvSource({
            "/admin,          true",
            "/admin/,         true",
            "/admin/users/,   true",
            "/admin-panel/,   false",
            "/administrator,  false",
            "/public/admin,   false",
    })
    void testPatternWithoutTrailingSlash(String path, boolean expected) {
        register("", "admin");
        assertEquals(expected, matcher.isProtected(path),
                "Path '%s' should %sbe protected by 'admin'".formatted(path, expected ? "" : "NOT "));
    }

    @ParameterizedTest
    @CsvSource({
            "/admin/,         true",
            "/admin/panel/,   true",
            "/admin/a/b/c,    true",
            "/admin,          false",
            "/admin-panel/,   false",
    })
    void testPatternWithTrailingSlash(String path, boolean expected) {
        register("", "admin/");
        assertEquals(expected, matcher.isProtected(path),
                "Path '%s' should %sbe protected by 'admin/'".formatted(path, expected ? "" : "NOT "));
    }

    @Test
    void testLeadingSlashesAreStripped() {
        register("", "protected/");
        assertTrue(matcher.isProtected("//protected/"));
    }

    @Test
    void testCanonicalPathIsReturned() {
        register("", "protected/");
        assertEquals("protected/", matcher.match("/protected/sub").orElseThrow().protectedPath());
    }

    // --- Dynamic patterns ---

    @Test
    void testDynamicPattern_MatchesAndCapturesParams() {
        register("", "blog/<int:year>/<str:slug>/");

        MatchedRoute matched = matcher.match("/blog/2024/my-post/").orElseThrow();

        assertEquals("blog/<int:year>/<str:slug>/", matched.protectedPath());
        assertEquals(Map.of("year", 2024, "slug", "my-post"), matched.params());
    }

    @Test
    void testDynamicPattern_DoesNotMatchSimilarPrefix() {
        register("", "blog/<int:year>/<str:slug>/");
        assertFalse(matcher.isProtected("/blog-archive/2024/my-post/"));
    }

    @Test
    void testDynamicPattern_MatchesSubpath() {
        register("", "blog/<int:year>/");
        assertTrue(matcher.isProtected("/blog/2024/january/"));
    }

    @Test
    void testDynamicPattern_OversizedIntStaysProtected() {
        register("", "blog/<int:year>/<str:slug>/");

        assertTrue(matcher.isProtected("/blog/99999999999/my-post/"));
        assertEquals("blog/<int:year>/<str:slug>/",
                matcher.match("/blog/99999999999999999999999/my-post/").orElseThrow().protectedPath());
    }

    @Test
    void testDynamicPatternWithoutSlash() {
        register("", "api/posts/<int:id>");

        assertTrue(matcher.isProtected("/api/posts/123"));
        assertTrue(matcher.isProtected("/api/posts/123/comments"));
        assertFalse(matcher.isProtected("/api/posts/123extra"));
    }

    // --- Prefixes ---

    @Test
    void testPrefixedPattern() {
        register("api/v1/", "secret/");

        assertTrue(matcher.isProtected("/api/v1/secret/"));
        assertFalse(matcher.isProtected("/api/v2/secret/"));
        assertEquals("api/v1/secret/", matcher.match("/api/v1/secret/").orElseThrow().protectedPath());
    }

    @Test
    void testDeeplyNestedPrefix() {
        register("top/mid/", "deep/");
        assertTrue(matcher.isProtected("/top/mid/deep/"));
    }

    @Test
    void testPrefixedDynamicPattern() {
        register("blog/", "<int:year>/<str:slug>/");
        assertEquals("blog/<int:year>/<str:slug>/",
                matcher.match("/blog/2024/my-post/").orElseThrow().protectedPath());
    }

    // --- Predicates ---

    @Test
    void testPredicate_SelectsProtectedVariants() {
        registry.register("", PathPattern.compile("<str:visibility>/<str:post>/"),
                params -> "private".equals(params.get("visibility")));

        assertFalse(matcher.isProtected("/public/my-post/"));
        assertTrue(matcher.isProtected("/private/my-post/"));
    }

    @Test
    void testPredicate_ComplexLogic() {
        registry.register("", PathPattern.compile("<str:visibility>/<str:category>/<str:post>/"),
                params -> "private".equals(params.get("visibility"))
                        || "confidential".equals(params.get("category")));

        assertFalse(matcher.isProtected("/public/general/my-post/"));
        assertTrue(matcher.isProtected("/private/general/my-post/"));
        assertTrue(matcher.isProtected("/public/confidential/my-post/"));
    }

    @Test
    void testPredicate_ExceptionFailsSafe() {
        registry.register("", PathPattern.compile("<str:post>/"),
                params -> ((String) params.get("visibility")).equals("private"));

        assertTrue(matcher.isProtected("/my-post/"));
    }

    @Test
    void testPredicate_CheckedExceptionFailsSafe() {
        registry.register("", PathPattern.compile("<str:post>/"), params -> {
            throw new Exception("lookup failed");
        });

        assertTrue(matcher.isProtected("/my-post/"));
    }

    @Test
    void testPredicate_FalseFallsThroughToOtherRoutes() {
        registry.register("", PathPattern.compile("<str:visibility>/<str:post>/"), params -> false);
        register("", "private/");

        assertEquals("private/", matcher.match("/private/my-post/").orElseThrow().protectedPath());
    }

    @Test
    void testOverlappingRoutes_FirstRegisteredWins() {
        register("", "admin/");
        register("admin/", "<str:section>/");

        assertEquals("admin/", matcher.match("/admin/users/").orElseThrow().protectedPath());
    }

    @Test
    void testNullPath() {
        register("", "protected/");
        assertTrue(matcher.match(null).isEmpty());
    }
}
