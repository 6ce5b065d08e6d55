package de.bsommerfeld.golinks.core.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Fully materialized short link: the link row plus its ownership set and tags.
 *
 * <p>
 * The slug is stored lower-case and never changes after creation. Owners are
 * ordered primary first; tags are ordered by name. Both lists are immutable
 * copies and may be empty if the underlying rows are missing.
 *
 * @param id          random UUID assigned at creation
 * @param slug        globally unique short name
 * @param url         redirect destination
 * @param title       optional display title, empty string if unset
 * @param description optional description, empty string if unset
 * @param visibility  who may follow the link
 * @param createdAt   creation time
 * @param updatedAt   time of the last {@code update}
 * @param owners      ownership set, primary owner first
 * @param tags        attached tags, ordered by name
 */
public record Link(
        String id,
        String slug,
        String url,
        String title,
        String description,
        Visibility visibility,
        Instant createdAt,
        Instant updatedAt,
        List<LinkOwner> owners,
        List<Tag> tags) {

    public Link {
        visibility = visibility == null ? Visibility.PUBLIC : visibility;
        owners = owners == null ? List.of() : List.copyOf(owners);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public Optional<LinkOwner> primaryOwner() {
        return owners.stream().filter(LinkOwner::primary).findFirst();
    }

    public boolean isOwnedBy(String userId) {
        return owners.stream().anyMatch(o -> o.userId().equals(userId));
    }
}
