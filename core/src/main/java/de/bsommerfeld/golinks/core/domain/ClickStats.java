package de.bsommerfeld.golinks.core.domain;

/**
 * Raw click counts for a single link.
 */
public record ClickStats(long total, long last7Days, long last30Days) {
}
