package space.maatini.magicauth.model;

import org.junit.jupiter.api.Test;
import space.maatini.magicauth.config.AccessSettings.SameSite;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Test
    void testAccessTokenBuilderDefaults() {
        AccessToken token = AccessToken.builder()
                .description("Test")
                .path("protected/")
                .token("secret")
                .build();

        assertTrue(token.valid());
        assertNotNull(token.createdAt());
        assertNull(token.maxUses());
        assertNull(token.expiresAt());
        assertEquals(0, token.timesAccessed());
        assertEquals("Test (protected/)", token.toString());
        assertFalse(token.toString().contains("secret"));
    }

    @Test
    void testAccessTokenValidation() {
        AccessToken.Builder valid = AccessToken.builder().description("d").path("p/").token("t");
        assertDoesNotThrow(valid::build);

        assertThrows(IllegalArgumentException.class,
                () -> AccessToken.builder().path("p/").token("t").build());
        assertThrows(IllegalArgumentException.class,
                () -> AccessToken.builder().description("d").token("t").build());
        assertThrows(IllegalArgumentException.class,
                () -> AccessToken.builder().description("d").path("p/").build());
        assertThrows(IllegalArgumentException.class,
                () -> AccessToken.builder().description("d").path("p/").token("x".repeat(65)).build());
        assertThrows(IllegalArgumentException.class,
                () -> AccessToken.builder().description("d".repeat(256)).path("p/").token("t").build());
        assertThrows(IllegalArgumentException.class,
                () -> AccessToken.builder().description("d").path("p/").token("t").maxUses(-1).build());
    }

    @Test
    void testAccessTokenUsability() {
        AccessToken token = AccessToken.builder()
                .description("d").path("protected/").token("t")
                .expiresAt(NOW.plusSeconds(60)).maxUses(2)
                .build();

        assertTrue(token.isUsableFor("protected/", NOW));
        assertFalse(token.isUsableFor("other/", NOW));
        assertFalse(token.isUsableFor("protected/", NOW.plusSeconds(60)));
        assertFalse(token.revoked().isUsableFor("protected/", NOW));

        AccessToken used = token.withUsage(NOW).withUsage(NOW.plusSeconds(1));
        assertEquals(2, used.timesAccessed());
        assertEquals(NOW.plusSeconds(1), used.lastAccessed());
        assertTrue(used.isExhausted());
        assertTrue(used.isExpiredOrExhausted(NOW));
        assertFalse(used.isUsableFor("protected/", NOW));
    }

    @Test
    void testAccessTokenCreatedAtDefaultsToNow() {
        Instant before = Instant.now();
        AccessToken token = new AccessToken(null, "d", "p/", "t", true, null, null, null, 0, null);

        assertNotNull(token.createdAt());
        assertFalse(token.createdAt().isBefore(before));
    }

    @Test
    void testZeroMaxUsesIsExhausted() {
        AccessToken token = AccessToken.builder().description("d").path("p/").token("t").maxUses(0).build();
        assertTrue(token.isExhausted());
    }

    @Test
    void testAccessDecisionFactoryMethods() {
        AccessDecision pass = AccessDecision.pass();
        assertEquals(AccessDecision.Outcome.PASS, pass.outcome());
        assertTrue(pass.permitted());

        AccessDecision deny = AccessDecision.deny("protected/", DenialReason.NO_TOKEN);
        assertFalse(deny.permitted());
        assertEquals(DenialReason.NO_TOKEN, deny.reason());

        assertThrows(NullPointerException.class, () -> AccessDecision.deny("protected/", null));
        assertThrows(NullPointerException.class, () -> AccessDecision.redirect("protected/", null, null));
    }

    @Test
    void testDenialReasonMessages() {
        assertEquals("no_token", DenialReason.NO_TOKEN.code());
        assertEquals("Access denied: No token provided", DenialReason.NO_TOKEN.message());
        assertEquals("invalid_token", DenialReason.INVALID_TOKEN.code());
        assertEquals("Access denied: Invalid token", DenialReason.INVALID_TOKEN.message());
    }

    @Test
    void testValidationResult() {
        AccessToken token = AccessToken.builder().description("d").path("p/").token("t").build();

        assertTrue(ValidationResult.granted(token).isGranted());
        ValidationResult denied = ValidationResult.denied(DenialReason.INVALID_TOKEN);
        assertFalse(denied.isGranted());
        assertEquals(DenialReason.INVALID_TOKEN, denied.reason());
    }

    @Test
    void testAccessRequest() {
        AccessRequest request = new AccessRequest("protected/",
                Map.of("token", List.of("a", "b"), "empty", List.of()), null);

        assertEquals("/protected/", request.path());
        assertEquals("b", request.queryParameter("token"));
        assertNull(request.queryParameter("empty"));
        assertNull(request.queryParameter("missing"));
        assertNull(request.cookie("missing"));
        assertEquals("/", AccessRequest.of(null).path());
    }

    @Test
    void testTokenCookieHeader() {
        TokenCookie cookie = new TokenCookie("magic_authorization_protected%2F", "secret", "/protected/",
                31536000, true, true, SameSite.LAX);

        assertEquals("magic_authorization_protected%2F=secret; Path=/protected/; Max-Age=31536000;"
                + " Secure; HttpOnly; SameSite=Lax", cookie.toHeaderValue());
        assertFalse(cookie.toString().contains("secret"));
    }
}
