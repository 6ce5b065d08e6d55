package de.bsommerfeld.golinks.core.domain;

import java.time.Instant;

/**
 * A tag shared by all users. {@code slug} is derived from the name of the
 * first creator and is the only identity used for upserts.
 */
public record Tag(String id, String name, String slug, Instant createdAt) {
}
