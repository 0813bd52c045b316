package space.maatini.magicauth.token;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import space.maatini.magicauth.model.AccessToken;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token repository held in memory, keyed by token value.
 * <p>
 * Usage recording runs inside {@link ConcurrentHashMap#computeIfPresent},
 * which gives the per-record atomicity the validator relies on.
 */
@ApplicationScoped
public class InMemoryTokenRepository implements TokenRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryTokenRepository.class);

    private final Map<String, AccessToken> tokens = new ConcurrentHashMap<>();

    @Override
    public synchronized AccessToken save(AccessToken token) {
        AccessToken toStore = token.id() != null ? token : withId(token, UUID.randomUUID().toString());

        AccessToken holder = tokens.get(toStore.token());
        if (holder != null && !holder.id().equals(toStore.id())) {
            throw new IllegalStateException("Token value is already assigned to another access token");
        }

        // the token value of an existing record may have changed
        findById(toStore.id())
                .filter(existing -> !existing.token().equals(toStore.token()))
                .ifPresent(existing -> tokens.remove(existing.token()));

        tokens.put(toStore.token(), toStore);
        LOG.debugf("Saved access token %s for path %s", toStore.id(), toStore.path());
        return toStore;
    }

    @Override
    public Optional<AccessToken> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return tokens.values().stream()
                .filter(t -> id.equals(t.id()))
                .findFirst();
    }

    @Override
    public Optional<AccessToken> findByToken(String token) {
        return token == null ? Optional.empty() : Optional.ofNullable(tokens.get(token));
    }

    @Override
    public List<AccessToken> findAll() {
        return tokens.values().stream()
                .sorted(Comparator.comparing(AccessToken::createdAt).reversed())
                .toList();
    }

    @Override
    public synchronized boolean deleteById(String id) {
        return findById(id)
                .map(existing -> tokens.remove(existing.token()) != null)
                .orElse(false);
    }

    @Override
    public Optional<AccessToken> findUsable(String token, String protectedPath, Instant now) {
        return findByToken(token).filter(t -> t.isUsableFor(protectedPath, now));
    }

    @Override
    public Optional<AccessToken> recordUsage(String token, String protectedPath, Instant now) {
        if (token == null) {
            return Optional.empty();
        }
        AccessToken[] updated = new AccessToken[1];
        tokens.computeIfPresent(token, (key, current) -> {
            if (!current.isUsableFor(protectedPath, now)) {
                return current;
            }
            updated[0] = current.withUsage(now);
            return updated[0];
        });
        return Optional.ofNullable(updated[0]);
    }

    @Override
    public Optional<AccessToken> revoke(String id) {
        Optional<AccessToken> existing = findById(id);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        AccessToken[] updated = new AccessToken[1];
        tokens.computeIfPresent(existing.get().token(), (key, current) -> {
            if (!current.id().equals(id)) {
                return current;
            }
            updated[0] = current.revoked();
            return updated[0];
        });
        return Optional.ofNullable(updated[0]);
    }

    @Override
    public int deleteExpiredOrExhausted(Instant now) {
        int deleted = 0;
        for (Map.Entry<String, AccessToken> entry : tokens.entrySet()) {
            AccessToken candidate = entry.getValue();
            if (candidate.isExpiredOrExhausted(now) && tokens.remove(entry.getKey(), candidate)) {
                deleted++;
            }
        }
        return deleted;
    }

    private static AccessToken withId(AccessToken token, String id) {
        return new AccessToken(id, token.description(), token.path(), token.token(), token.valid(),
                token.expiresAt(), token.maxUses(), token.createdAt(), token.timesAccessed(),
                token.lastAccessed());
    }
}
