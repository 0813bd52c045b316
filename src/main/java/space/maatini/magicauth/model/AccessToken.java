package space.maatini.magicauth.model;

import java.time.Instant;

/**
 * Immutable access token granting time- and use-limited access to exactly
 * one canonical protected path.
 * <p>
 * {@code path} is the literal pattern string as produced by the route
 * registry, e.g. {@code blog/<int:year>/<str:slug>/}, never a concrete URL.
 */
public record AccessToken(
        String id,
        String description,
        String path,
        String token,
        boolean valid,
        Instant expiresAt,
        Integer maxUses,
        Instant createdAt,
        int timesAccessed,
        Instant lastAccessed) {

    public static final int MAX_DESCRIPTION_LENGTH = 255;
    public static final int MAX_PATH_LENGTH = 255;
    public static final int MAX_TOKEN_LENGTH = 64;

    public AccessToken {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description is required");
        }
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new IllegalArgumentException("description exceeds " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path is required");
        }
        if (path.length() > MAX_PATH_LENGTH) {
            throw new IllegalArgumentException("path exceeds " + MAX_PATH_LENGTH + " characters");
        }
        if (token == null || token.isEmpty()) {
            throw new IllegalArgumentException("token is required");
        }
        if (token.length() > MAX_TOKEN_LENGTH) {
            throw new IllegalArgumentException("token exceeds " + MAX_TOKEN_LENGTH + " characters");
        }
        if (maxUses != null && maxUses < 0) {
            throw new IllegalArgumentException("maxUses must not be negative");
        }
        if (timesAccessed < 0) {
            throw new IllegalArgumentException("timesAccessed must not be negative");
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Builder for creating AccessToken instances.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns true if the token may be used for the canonical path at the given instant.
     */
    public boolean isUsableFor(String protectedPath, Instant now) {
        return valid
                && path.equals(protectedPath)
                && !isExpired(now)
                && !isExhausted();
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public boolean isExhausted() {
        return maxUses != null && timesAccessed >= maxUses;
    }

    /**
     * Returns true if the token can never be used again and may be deleted.
     */
    public boolean isExpiredOrExhausted(Instant now) {
        return isExpired(now) || isExhausted();
    }

    /**
     * Copy with one more recorded access at the given instant.
     */
    public AccessToken withUsage(Instant now) {
        return new AccessToken(id, description, path, token, valid, expiresAt, maxUses, createdAt,
                timesAccessed + 1, now);
    }

    /**
     * Copy marked as no longer valid.
     */
    public AccessToken revoked() {
        return new AccessToken(id, description, path, token, false, expiresAt, maxUses, createdAt,
                timesAccessed, lastAccessed);
    }

    @Override
    public String toString() {
        // never expose the secret
        return description + " (" + path + ")";
    }

    /**
     * Builder for AccessToken.
     */
    public static class Builder {
        private String id;
        private String description;
        private String path;
        private String token;
        private boolean valid = true;
        private Instant expiresAt;
        private Integer maxUses;
        private Instant createdAt;
        private int timesAccessed;
        private Instant lastAccessed;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder valid(boolean valid) {
            this.valid = valid;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder maxUses(Integer maxUses) {
            this.maxUses = maxUses;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder timesAccessed(int timesAccessed) {
            this.timesAccessed = timesAccessed;
            return this;
        }

        public Builder lastAccessed(Instant lastAccessed) {
            this.lastAccessed = lastAccessed;
            return this;
        }

        public AccessToken build() {
            return new AccessToken(id, description, path, token, valid, expiresAt, maxUses,
                    createdAt, timesAccessed, lastAccessed);
        }
    }
}
