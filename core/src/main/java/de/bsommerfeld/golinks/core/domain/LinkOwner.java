package de.bsommerfeld.golinks.core.domain;

/**
 * One row of a link's ownership set.
 *
 * @param userId  owning user
 * @param primary {@code true} for the creator of the link; exactly one owner
 *                per link is primary and that row can never be removed
 */
public record LinkOwner(String userId, boolean primary) {
}
