package de.bsommerfeld.golinks.core.domain;

import java.time.Instant;

/**
 * A personal API token. Only the SHA-256 hash of the plaintext is stored.
 *
 * @param lastUsedAt {@code null} until the token is first used
 * @param expiresAt  {@code null} for tokens that never expire
 * @param revokedAt  {@code null} while the token is not revoked
 */
public record ApiToken(
        String id,
        String userId,
        String name,
        String tokenHash,
        Instant lastUsedAt,
        Instant expiresAt,
        Instant createdAt,
        Instant revokedAt) {

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    /** Neither revoked nor expired at {@code now}. */
    public boolean isActive(Instant now) {
        return !isRevoked() && !isExpired(now);
    }
}
