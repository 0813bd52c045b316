package space.maatini.magicauth.token;

import jakarta.enterprise.context.ApplicationScoped;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates URL-safe token secrets from 32 bytes of secure randomness.
 */
@ApplicationScoped
public class TokenGenerator {

    static final int TOKEN_BYTES = 32;

    private final SecureRandom random = new SecureRandom();

    /**
     * Returns a new unpadded URL-safe Base64 secret of 43 characters.
     */
    public String generate() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
