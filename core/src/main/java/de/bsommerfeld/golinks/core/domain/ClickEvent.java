package de.bsommerfeld.golinks.core.domain;

import java.time.Instant;

/**
 * One visit of a short link, captured on the redirect path and persisted
 * asynchronously. Never carries a raw IP address.
 *
 * @param linkId    visited link
 * @param userId    signed-in visitor, {@code null} for anonymous visits
 * @param ipHash    salted hash of the client address
 * @param userAgent client user agent, may be {@code null}
 * @param referrer  HTTP referrer, may be {@code null}
 * @param clickedAt time the redirect was served
 */
public record ClickEvent(
        String linkId,
        String userId,
        String ipHash,
        String userAgent,
        String referrer,
        Instant clickedAt) {

    /**
     * Creates an event stamped with the current time.
     */
    public static ClickEvent now(String linkId, String userId, String ipHash, String userAgent, String referrer) {
        return new ClickEvent(linkId, userId, ipHash, userAgent, referrer, Instant.now());
    }
}
