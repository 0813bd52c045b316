package space.maatini.magicauth.filter;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.response.Response;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.maatini.magicauth.model.AccessToken;
import space.maatini.magicauth.test.RecordingAccessListener;
import space.maatini.magicauth.test.SampleRouteTree;
import space.maatini.magicauth.token.TokenGenerator;
import space.maatini.magicauth.token.TokenRepository;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * HTTP-level tests of the access gate against the sample routes.
 */
@QuarkusTest
class MagicAuthorizationFilterTest {

    static final String PROTECTED_COOKIE = "magic_authorization_protected%2F";
    static final String BLOG_COOKIE = "magic_authorization_blog%2F%3Cint%3Ayear%3E%2F%3Cstr%3Aslug%3E%2F";

    @Inject
    TokenRepository repository;

    @Inject
    TokenGenerator generator;

    @Inject
    RecordingAccessListener listener;

    @BeforeEach
    void setup() {
        listener.clear();
    }

    private String issue(String path, Integer maxUses) {
        return repository.save(AccessToken.builder()
                .description("HTTP test")
                .path(path)
                .token(generator.generate())
                .maxUses(maxUses)
                .build()).token();
    }

    // --- Unprotected ---

    @Test
    void testPublicPath_Passes() {
        given()
            .when().get("/public/")
            .then()
            .statusCode(200)
            .body(equalTo("public"))
            .header("Set-Cookie", nullValue());
    }

    @Test
    void testInternalPath_NotGated() {
        given()
            .when().get("/q/health/live")
            .then()
            .statusCode(200);
    }

    // --- Denials ---

    @Test
    void testProtectedPath_NoToken() {
        given()
            .when().get("/protected/")
            .then()
            .statusCode(403)
            .body(equalTo("Access denied: No token provided"));

        assertEquals(1, listener.denied().size());
    }

    @Test
    void testProtectedPath_InvalidToken() {
        given()
            .queryParam("token", "invalid")
            .when().get("/protected/")
            .then()
            .statusCode(403)
            .body(equalTo("Access denied: Invalid token"));
    }

    @Test
    void testTokenForOtherPath_Denied() {
        String token = issue(SampleRouteTree.PROTECTED, null);

        given()
            .queryParam("token", token)
            .when().get("/blog/2024/my-post/")
            .then()
            .statusCode(403)
            .body(equalTo("Access denied: Invalid token"));
    }

    @Test
    void testExpiredToken_Denied() {
        String token = repository.save(AccessToken.builder()
                .description("expired")
                .path(SampleRouteTree.PROTECTED)
                .token(generator.generate())
                .expiresAt(Instant.now().minus(1, ChronoUnit.HOURS))
                .build()).token();

        given()
            .queryParam("token", token)
            .when().get("/protected/")
            .then()
            .statusCode(403);
    }

    // --- Query token ---

    @Test
    void testQueryToken_RedirectsWithCookie() {
        String token = issue(SampleRouteTree.PROTECTED, null);

        given()
            .redirects().follow(false)
            .queryParam("foo", "bar")
            .queryParam("token", token)
            .queryParam("baz", "qux")
            .when().get("/protected/")
            .then()
            .statusCode(302)
            .header("Location", endsWith("/protected/?foo=bar&baz=qux"))
            .header("Set-Cookie", startsWith(PROTECTED_COOKIE + "=" + token))
            .header("Set-Cookie", containsString("Path=/protected/"))
            .header("Set-Cookie", containsString("Max-Age=31536000"))
            .header("Set-Cookie", containsString("HttpOnly"))
            .header("Set-Cookie", containsString("SameSite=Lax"))
            .header("Set-Cookie", not(containsString("Secure")));

        assertEquals(1, listener.granted().size());
        assertEquals(1, repository.findByToken(token).orElseThrow().timesAccessed());
    }

    @Test
    void testRedirect_WithoutOtherParameters() {
        String token = issue(SampleRouteTree.PROTECTED, null);

        String location = given()
            .redirects().follow(false)
            .queryParam("token", token)
            .when().get("/protected/")
            .then()
            .statusCode(302)
            .extract().header("Location");

        assertTrue(location.endsWith("/protected/"), location);
        assertFalse(location.contains("token"), location);
    }

    // --- Cookie token ---

    @Test
    void testCookieToken_AllowsAndRefreshesCookie() {
        String token = issue(SampleRouteTree.PROTECTED, null);

        given()
            .cookie(PROTECTED_COOKIE, token)
            .when().get("/protected/")
            .then()
            .statusCode(200)
            .body(equalTo("protected"))
            .header("Set-Cookie", startsWith(PROTECTED_COOKIE + "=" + token));
    }

    @Test
    void testQueryTokenWinsOverStaleCookie() {
        String token = issue(SampleRouteTree.PROTECTED, null);

        given()
            .redirects().follow(false)
            .cookie(PROTECTED_COOKIE, "stale")
            .queryParam("token", token)
            .when().get("/protected/")
            .then()
            .statusCode(302);
    }

    // --- Dynamic patterns ---

    @Test
    void testSingleUseTokenOnDynamicPattern() {
        String token = issue(SampleRouteTree.BLOG, 1);

        Response first = given()
            .redirects().follow(false)
            .queryParam("token", token)
            .when().get("/blog/2024/my-post/");
        assertEquals(302, first.statusCode());
        assertTrue(first.header("Set-Cookie").startsWith(BLOG_COOKIE + "="));
        assertTrue(first.header("Set-Cookie").contains("Path=/blog/"));

        given()
            .cookie(BLOG_COOKIE, token)
            .when().get("/blog/2023/other-post/")
            .then()
            .statusCode(403)
            .body(equalTo("Access denied: Invalid token"));
    }

    @Test
    void testPatternCookieCoversOtherUrls() {
        String token = issue(SampleRouteTree.BLOG, null);

        given()
            .cookie(BLOG_COOKIE, token)
            .when().get("/blog/2023/other-post/")
            .then()
            .statusCode(200)
            .body(equalTo("blog 2023 other-post"));
    }

    @Test
    void testOversizedYear_StillRequiresToken() {
        given()
            .when().get("/blog/99999999999/my-post/")
            .then()
            .statusCode(403)
            .body(equalTo("Access denied: No token provided"));
    }

    @Test
    void testNonMatchingDynamicUrl_Passes() {
        // year must be numeric, so the blog pattern does not apply
        given()
            .when().get("/blog/latest/my-post/")
            .then()
            .statusCode(not(equalTo(403)));
    }

    // --- Predicates and groups ---

    @Test
    void testPredicate_PublicVariantPasses() {
        given()
            .when().get("/content/public/hello/")
            .then()
            .statusCode(200)
            .body(equalTo("public hello"));
    }

    @Test
    void testPredicate_PrivateVariantProtected() {
        given()
            .when().get("/content/private/hello/")
            .then()
            .statusCode(403);

        String token = issue(SampleRouteTree.CONTENT, null);
        given()
            .redirects().follow(false)
            .queryParam("token", token)
            .when().get("/content/private/hello/")
            .then()
            .statusCode(302)
            .header("Set-Cookie", containsString("Path=/content/"));
    }

    @Test
    void testProtectedGroupCoversChildren() {
        given()
            .when().get("/members/profile/")
            .then()
            .statusCode(403);

        String token = issue(SampleRouteTree.MEMBERS, null);
        given()
            .cookie("magic_authorization_members%2F", token)
            .when().get("/members/profile/")
            .then()
            .statusCode(200)
            .body(equalTo("profile"));
    }
}
