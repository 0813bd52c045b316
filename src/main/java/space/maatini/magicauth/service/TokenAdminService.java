package space.maatini.magicauth.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import space.maatini.magicauth.config.MagicAuthConfig;
import space.maatini.magicauth.model.AccessToken;
import space.maatini.magicauth.route.ProtectedRouteRegistry;
import space.maatini.magicauth.token.TokenCleanupJob;
import space.maatini.magicauth.token.TokenGenerator;
import space.maatini.magicauth.token.TokenRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Administrative operations on access tokens: issuing tokens for registered
 * protected paths, listing them with stale-path markers, revoking and
 * cleaning up.
 */
@ApplicationScoped
public class TokenAdminService {

    private static final Logger LOG = Logger.getLogger(TokenAdminService.class);

    /**
     * Prefix marking tokens whose path is no longer registered.
     */
    public static final String UNREGISTERED_MARKER = "❗ ";

    private static final int MAX_GENERATION_ATTEMPTS = 3;

    @Inject
    MagicAuthConfig config;

    @Inject
    ProtectedRouteRegistry registry;

    @Inject
    TokenRepository repository;

    @Inject
    TokenGenerator generator;

    @Inject
    TokenCleanupJob cleanupJob;

    /**
     * Canonical paths tokens can be issued for, sorted.
     */
    public List<String> protectedPaths() {
        return registry.getProtectedPaths().stream()
                .distinct()
                .sorted()
                .toList();
    }

    /**
     * Issues a new token for a registered protected path.
     *
     * @throws IllegalArgumentException if the path is not registered or the
     *                                  limits are invalid
     */
    public AccessToken issue(String description, String path, Instant expiresAt, Integer maxUses) {
        if (!registry.isRegistered(path)) {
            throw new IllegalArgumentException("Path '" + path + "' is not a registered protected path");
        }
        if (maxUses != null && maxUses < 1) {
            throw new IllegalArgumentException("maxUses must be at least 1");
        }

        for (int attempt = 1; ; attempt++) {
            AccessToken token = AccessToken.builder()
                    .description(description)
                    .path(path)
                    .token(generator.generate())
                    .expiresAt(expiresAt)
                    .maxUses(maxUses)
                    .createdAt(Instant.now())
                    .build();
            try {
                AccessToken saved = repository.save(token);
                LOG.infof("Issued access token %s for path %s", saved.id(), path);
                return saved;
            } catch (IllegalStateException e) {
                if (attempt >= MAX_GENERATION_ATTEMPTS) {
                    throw e;
                }
                LOG.warnf("Generated token value collided, retrying (attempt %d)", attempt);
            }
        }
    }

    public List<TokenView> list() {
        return repository.findAll().stream()
                .map(this::toView)
                .toList();
    }

    public Optional<TokenView> find(String id) {
        return repository.findById(id).map(this::toView);
    }

    /**
     * Marks a token invalid. Its record is kept for auditing.
     */
    public Optional<TokenView> revoke(String id) {
        return repository.revoke(id)
                .map(token -> {
                    LOG.infof("Revoked access token %s", id);
                    return toView(token);
                });
    }

    public boolean delete(String id) {
        return repository.deleteById(id);
    }

    /**
     * Deletes all expired or exhausted tokens.
     */
    public int cleanup() {
        return cleanupJob.run();
    }

    /**
     * The token path, prefixed with a warning marker if no registered route
     * produces it anymore.
     */
    public String displayPath(AccessToken token) {
        return registry.isRegistered(token.path()) ? token.path() : UNREGISTERED_MARKER + token.path();
    }

    /**
     * Link handing out the token, e.g. {@code /protected/?token=...}.
     * Dynamic paths keep their placeholders for the administrator to fill in.
     */
    public String accessLink(AccessToken token) {
        return "/" + token.path() + "?" + config.tokenParam() + "=" + token.token();
    }

    private TokenView toView(AccessToken token) {
        return new TokenView(
                token.id(),
                token.description(),
                token.path(),
                displayPath(token),
                registry.isRegistered(token.path()),
                token.valid(),
                token.expiresAt(),
                token.maxUses(),
                token.createdAt(),
                token.timesAccessed(),
                token.lastAccessed(),
                accessLink(token));
    }

    /**
     * Admin representation of a token.
     */
    public record TokenView(
            String id,
            String description,
            String path,
            String displayPath,
            boolean pathRegistered,
            boolean valid,
            Instant expiresAt,
            Integer maxUses,
            Instant createdAt,
            int timesAccessed,
            Instant lastAccessed,
            String accessLink) {
    }
}
