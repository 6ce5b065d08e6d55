package de.bsommerfeld.golinks.core.domain;

/**
 * A tag together with the number of links it is attached to.
 */
public record TagCount(Tag tag, long linkCount) {
}
