package de.bsommerfeld.golinks.core.domain;

import java.time.Instant;

/**
 * A stored click joined with the visitor's display name. {@code userId} and
 * {@code displayName} are empty strings for anonymous visits or deleted users.
 */
public record RecentClick(Instant clickedAt, String referrer, String userId, String displayName) {
}
