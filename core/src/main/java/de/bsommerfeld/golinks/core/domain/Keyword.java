package de.bsommerfeld.golinks.core.domain;

import java.time.Instant;

/**
 * A host-level shortcut such as {@code go} or {@code jira}, expanded through
 * a URL template.
 *
 * @param keyword     lower-case name, unique
 * @param urlTemplate destination template, may contain placeholders
 */
public record Keyword(String id, String keyword, String urlTemplate, String description, Instant createdAt) {
}
