package space.maatini.magicauth.token;

import space.maatini.magicauth.model.AccessToken;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of access tokens.
 * <p>
 * Implementations must make {@link #recordUsage} a single conditional
 * update so that concurrent requests presenting the same single-use token
 * cannot both succeed.
 */
public interface TokenRepository {

    /**
     * Inserts or replaces a token. Assigns an id when missing.
     *
     * @throws IllegalStateException if another record already holds the token value
     */
    AccessToken save(AccessToken token);

    Optional<AccessToken> findById(String id);

    Optional<AccessToken> findByToken(String token);

    List<AccessToken> findAll();

    boolean deleteById(String id);

    /**
     * Looks up a token that is valid, issued for the path, unexpired and not exhausted.
     */
    Optional<AccessToken> findUsable(String token, String protectedPath, Instant now);

    /**
     * Atomically increments the access count and sets the last access time of
     * the matching token, provided it is still usable for the path.
     *
     * @return the updated record, or empty if no usable token matched
     */
    Optional<AccessToken> recordUsage(String token, String protectedPath, Instant now);

    /**
     * Atomically marks the token with the given id invalid, keeping every
     * other field of the current record, access count included.
     *
     * @return the revoked record, or empty if no token has that id
     */
    Optional<AccessToken> revoke(String id);

    /**
     * Deletes every token that is expired or exhausted.
     *
     * @return the number of deleted tokens
     */
    int deleteExpiredOrExhausted(Instant now);
}
