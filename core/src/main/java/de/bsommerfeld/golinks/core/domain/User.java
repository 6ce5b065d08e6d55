package de.bsommerfeld.golinks.core.domain;

import java.time.Instant;

/**
 * A locally known user, created on first successful authentication and
 * refreshed on every subsequent login.
 *
 * @param id              random UUID assigned at creation
 * @param provider        identity provider name (e.g. the OIDC issuer)
 * @param subject         subject identifier within {@code provider}; the pair
 *                        is unique
 * @param email           email address reported by the provider
 * @param displayName     human readable name
 * @param displayNameSlug unique URL-safe slug derived from
 *                        {@code displayName}
 * @param role            authorization role
 * @param createdAt       creation time
 * @param updatedAt       time of the last login or role change
 */
public record User(
        String id,
        String provider,
        String subject,
        String email,
        String displayName,
        String displayNameSlug,
        Role role,
        Instant createdAt,
        Instant updatedAt) {

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
