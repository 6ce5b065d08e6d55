package de.bsommerfeld.golinks.core.domain;

import java.time.Instant;

/**
 * Grants one user access to a {@link Visibility#SECURE} link.
 *
 * @param sharedBy user who granted the access
 */
public record LinkShare(String linkId, String userId, String sharedBy, Instant createdAt) {
}
