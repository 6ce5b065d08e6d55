package de.bsommerfeld.golinks.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.golinks.core.config.Dialect;
import de.bsommerfeld.golinks.core.domain.Link;
import de.bsommerfeld.golinks.core.domain.LinkOwner;
import de.bsommerfeld.golinks.core.domain.LinkShare;
import de.bsommerfeld.golinks.core.domain.Tag;
import de.bsommerfeld.golinks.core.domain.Visibility;
import de.bsommerfeld.golinks.core.slug.InvalidSlugException;
import de.bsommerfeld.golinks.core.slug.SlugRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Short links with their ownership sets and tags.
 *
 * <p>
 * Every returned {@link Link} is fully materialized: owners (primary first)
 * and tags (by name) are read on the same connection as the link row. Every
 * mutation touching more than one row runs in a single transaction, so a link
 * is never visible without its primary owner.
 *
 * <p>
 * Access control is left to callers: the store records a link's
 * {@link Visibility} and the users a {@link Visibility#SECURE} link is shared
 * with, but never filters on them.
 */
@Singleton
public class LinkStore {

    private static final Logger LOG = LoggerFactory.getLogger(LinkStore.class);

    private final Database database;
    private final TagStore tagStore;
    private final Clock clock;

    @Inject
    public LinkStore(Database database, TagStore tagStore) {
        this(database, tagStore, Clock.systemUTC());
    }

    LinkStore(Database database, TagStore tagStore, Clock clock) {
        this.database = database;
        this.tagStore = tagStore;
        this.clock = clock;
    }

    /**
     * Creates a {@link Visibility#PUBLIC} link owned by {@code ownerId} as its
     * primary owner.
     *
     * @see #create(String, String, String, String, Visibility, String)
     */
    public Link create(String slug, String url, String title, String description, String ownerId) {
        return create(slug, url, title, description, Visibility.PUBLIC, ownerId);
    }

    /**
     * Creates a link owned by {@code ownerId} as its primary owner.
     *
     * @throws StoreException {@code VALIDATION} for a malformed or reserved
     *                        slug, {@code SLUG_TAKEN} if the slug exists in any
     *                        letter case, {@code NOT_FOUND} if the owner is
     *                        unknown
     */
    public Link create(String slug, String url, String title, String description, Visibility visibility,
            String ownerId) {
        String normalized = normalizeSlug(slug);
        if (url == null || url.isBlank())
            throw StoreException.validation("url must not be empty");
        Dialect dialect = database.dialect();
        String id = UUID.randomUUID().toString();
        long now = clock.millis();

        database.inTransaction("createLink", conn -> {
            if (exists(conn, "exists-link-slug", normalized))
                throw StoreException.slugTaken(normalized);
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(dialect, "insert-link"))) {
                ps.setString(1, id);
                ps.setString(2, normalized);
                ps.setString(3, url.trim());
                ps.setString(4, nullToEmpty(title));
                ps.setString(5, nullToEmpty(description));
                ps.setString(6, valueOf(visibility));
                ps.setLong(7, now);
                ps.setLong(8, now);
                ps.executeUpdate();
            } catch (SQLException e) {
                if (SqlErrors.isUniqueViolation(e))
                    throw StoreException.slugTaken(normalized);
                throw e;
            }
            try {
                OwnershipStore.insertPrimaryOwner(conn, dialect, id, ownerId);
            } catch (SQLException e) {
                if (SqlErrors.isForeignKeyViolation(e))
                    throw StoreException.notFound("user", ownerId);
                throw e;
            }
            return null;
        });
        LOG.debug("Created link {} ({}) for owner {}", normalized, id, ownerId);
        return getById(id);
    }

    /**
     * Looks a link up by slug, ignoring letter case.
     */
    public Link getBySlug(String slug) {
        String normalized = slug == null ? "" : slug.trim().toLowerCase(Locale.ROOT);
        return database.withConnection("getLinkBySlug",
                conn -> selectOne(conn, "select-link-by-slug", normalized))
                .orElseThrow(() -> StoreException.notFound("link", normalized));
    }

    public Link getById(String id) {
        return database.withConnection("getLinkById", conn -> selectOne(conn, "select-link-by-id", id))
                .orElseThrow(() -> StoreException.notFound("link", id));
    }

    /**
     * Every link the user owns, as primary or co-owner, most recently updated
     * first.
     */
    public List<Link> listByOwner(String userId) {
        return database.withConnection("listLinksByOwner", conn -> selectMany(conn, "select-links-by-owner", userId));
    }

    /** All links, newest first. */
    public List<Link> listAll() {
        return database.withConnection("listLinks", conn -> selectMany(conn, "select-all-links"));
    }

    public List<Link> listByTag(String tagSlug) {
        return database.withConnection("listLinksByTag", conn -> selectMany(conn, "select-links-by-tag", tagSlug));
    }

    /** Links the user owns that carry the tag, most recently updated first. */
    public List<Link> listByOwnerAndTag(String userId, String tagSlug) {
        return database.withConnection("listLinksByOwnerAndTag",
                conn -> selectMany(conn, "select-links-by-owner-and-tag", userId, tagSlug));
    }

    /** Links the user owns or that are shared with them, ordered by slug. */
    public List<Link> listByOwnerOrShared(String userId) {
        return database.withConnection("listLinksByOwnerOrShared",
                conn -> selectMany(conn, "select-links-by-owner-or-shared", userId, userId));
    }

    public List<Link> listSharedWithUser(String userId) {
        return database.withConnection("listLinksSharedWithUser",
                conn -> selectMany(conn, "select-links-shared-with-user", userId));
    }

    public List<Tag> listTags(String linkId) {
        return database.withConnection("listLinkTags",
                conn -> TagStore.listForLink(conn, database.dialect(), linkId));
    }

    /**
     * Replaces url, title and description of a link, keeping its visibility.
     */
    public Link update(String id, String url, String title, String description) {
        return update(id, url, title, description, getById(id).visibility());
    }

    /**
     * Replaces the mutable fields of a link. The slug is immutable.
     */
    public Link update(String id, String url, String title, String description, Visibility visibility) {
        if (url == null || url.isBlank())
            throw StoreException.validation("url must not be empty");
        int updated = database.withConnection("updateLink", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(database.dialect(), "update-link"))) {
                ps.setString(1, url.trim());
                ps.setString(2, nullToEmpty(title));
                ps.setString(3, nullToEmpty(description));
                ps.setString(4, valueOf(visibility));
                ps.setLong(5, clock.millis());
                ps.setString(6, id);
                return ps.executeUpdate();
            }
        });
        if (updated == 0)
            throw StoreException.notFound("link", id);
        LOG.debug("Updated link {}", id);
        return getById(id);
    }

    public Link updateVisibility(String id, Visibility visibility) {
        int updated = database.withConnection("updateLinkVisibility", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    SqlLoader.load(database.dialect(), "update-link-visibility"))) {
                ps.setString(1, valueOf(visibility));
                ps.setLong(2, clock.millis());
                ps.setString(3, id);
                return ps.executeUpdate();
            }
        });
        if (updated == 0)
            throw StoreException.notFound("link", id);
        LOG.debug("Changed visibility of link {} to {}", id, valueOf(visibility));
        return getById(id);
    }

    /**
     * Deletes a link together with its ownership rows, tag assignments and
     * click history.
     */
    public void delete(String id) {
        int deleted = database.withConnection("deleteLink", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(database.dialect(), "delete-link"))) {
                ps.setString(1, id);
                return ps.executeUpdate();
            }
        });
        if (deleted == 0)
            throw StoreException.notFound("link", id);
        LOG.debug("Deleted link {}", id);
    }

    /**
     * Adds a non-primary owner.
     *
     * @throws StoreException {@code DUPLICATE_OWNER} if the user already owns
     *                        the link, {@code NOT_FOUND} if link or user is
     *                        unknown
     */
    public void addOwner(String linkId, String userId) {
        Dialect dialect = database.dialect();
        database.inTransaction("addOwner", conn -> {
            if (!exists(conn, "exists-link", linkId))
                throw StoreException.notFound("link", linkId);
            if (OwnershipStore.findOwner(conn, dialect, linkId, userId).isPresent())
                throw StoreException.duplicateOwner(linkId, userId);
            try {
                OwnershipStore.insertCoOwner(conn, dialect, linkId, userId);
            } catch (SQLException e) {
                if (SqlErrors.isUniqueViolation(e))
                    throw StoreException.duplicateOwner(linkId, userId);
                if (SqlErrors.isForeignKeyViolation(e))
                    throw StoreException.notFound("user", userId);
                throw e;
            }
            return null;
        });
        LOG.debug("Added co-owner {} to link {}", userId, linkId);
    }

    /**
     * Removes a co-owner. The primary owner can never be removed.
     */
    public void removeOwner(String linkId, String userId) {
        Dialect dialect = database.dialect();
        database.inTransaction("removeOwner", conn -> {
            Optional<LinkOwner> owner = OwnershipStore.findOwner(conn, dialect, linkId, userId);
            if (owner.isEmpty())
                throw StoreException.notFound("owner", userId + " of link " + linkId);
            if (owner.get().primary())
                throw StoreException.primaryOwnerImmutable(linkId, userId);
            OwnershipStore.deleteOwner(conn, dialect, linkId, userId);
            return null;
        });
        LOG.debug("Removed co-owner {} from link {}", userId, linkId);
    }

    /**
     * Grants {@code userId} access to the link.
     *
     * @return {@code false} if the share already existed
     * @throws StoreException {@code NOT_FOUND} if the link, the user or the
     *                        granting user is unknown
     */
    public boolean addShare(String linkId, String userId, String sharedBy) {
        boolean added = database.inTransaction("addShare", conn -> {
            if (!exists(conn, "exists-link", linkId))
                throw StoreException.notFound("link", linkId);
            if (exists(conn, "exists-link-share", linkId, userId))
                return false;
            try (PreparedStatement ps = conn.prepareStatement(
                    SqlLoader.load(database.dialect(), "insert-link-share"))) {
                ps.setString(1, linkId);
                ps.setString(2, userId);
                ps.setString(3, sharedBy);
                ps.setLong(4, clock.millis());
                ps.executeUpdate();
            } catch (SQLException e) {
                if (SqlErrors.isUniqueViolation(e))
                    return false;
                if (SqlErrors.isForeignKeyViolation(e))
                    throw StoreException.notFound("user", userId + " or " + sharedBy);
                throw e;
            }
            return true;
        });
        if (added)
            LOG.debug("Shared link {} with {} (by {})", linkId, userId, sharedBy);
        return added;
    }

    /**
     * @return {@code false} if there was no such share
     */
    public boolean removeShare(String linkId, String userId) {
        int deleted = database.withConnection("removeShare", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    SqlLoader.load(database.dialect(), "delete-link-share"))) {
                ps.setString(1, linkId);
                ps.setString(2, userId);
                return ps.executeUpdate();
            }
        });
        if (deleted > 0)
            LOG.debug("Removed share of link {} with {}", linkId, userId);
        return deleted > 0;
    }

    public boolean hasShare(String linkId, String userId) {
        return database.withConnection("hasShare", conn -> exists(conn, "exists-link-share", linkId, userId));
    }

    /** Shares of a link, oldest first. */
    public List<LinkShare> listShares(String linkId) {
        return database.withConnection("listShares", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    SqlLoader.load(database.dialect(), "select-link-shares"))) {
                ps.setString(1, linkId);
                try (ResultSet rs = ps.executeQuery()) {
                    List<LinkShare> shares = new ArrayList<>();
                    while (rs.next()) {
                        shares.add(new LinkShare(rs.getString("link_id"), rs.getString("user_id"),
                                rs.getString("shared_by"), Instant.ofEpochMilli(rs.getLong("created_at"))));
                    }
                    return shares;
                }
            }
        });
    }

    /**
     * Makes the link's tag set exactly the tags named by {@code names}. Names
     * deriving to an empty slug are skipped and names sharing a slug count
     * once. Calling it again with the same names changes nothing.
     *
     * @return the link's tags after the change, ordered by name
     */
    public List<Tag> setTags(String linkId, List<String> names) {
        Dialect dialect = database.dialect();
        List<String> requested = names == null ? List.of() : names;
        return database.inTransaction("setTags", conn -> {
            if (!exists(conn, "exists-link", linkId))
                throw StoreException.notFound("link", linkId);

            Map<String, Tag> desired = new LinkedHashMap<>();
            for (String name : requested) {
                String slug = SlugRules.deriveTagSlug(name);
                if (slug.isEmpty() || desired.containsKey(slug))
                    continue;
                desired.put(slug, tagStore.upsert(conn, name));
            }
            Set<String> desiredIds = new HashSet<>();
            desired.values().forEach(t -> desiredIds.add(t.id()));

            Set<String> currentIds = new HashSet<>();
            TagStore.listForLink(conn, dialect, linkId).forEach(t -> currentIds.add(t.id()));

            for (String tagId : desiredIds) {
                if (!currentIds.contains(tagId))
                    executeLinkTag(conn, "insert-link-tag", linkId, tagId);
            }
            for (String tagId : currentIds) {
                if (!desiredIds.contains(tagId))
                    executeLinkTag(conn, "delete-link-tag", linkId, tagId);
            }
            return TagStore.listForLink(conn, dialect, linkId);
        });
    }

    public long countAll() {
        return database.withConnection("countLinks", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(database.dialect(), "count-links"));
                    ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }

    // =====================================================================
    // Internals
    // =====================================================================

    private static String normalizeSlug(String slug) {
        try {
            return SlugRules.normalizeLinkSlug(slug);
        } catch (InvalidSlugException e) {
            throw StoreException.validation(e.getMessage(), e);
        }
    }

    private static String valueOf(Visibility visibility) {
        return (visibility == null ? Visibility.PUBLIC : visibility).value();
    }

    private boolean exists(Connection conn, String statement, String... keys) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(database.dialect(), statement))) {
            for (int i = 0; i < keys.length; i++)
                ps.setString(i + 1, keys[i]);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void executeLinkTag(Connection conn, String statement, String linkId, String tagId)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(database.dialect(), statement))) {
            ps.setString(1, linkId);
            ps.setString(2, tagId);
            ps.executeUpdate();
        }
    }

    private Optional<Link> selectOne(Connection conn, String statement, String key) throws SQLException {
        List<Link> links = selectMany(conn, statement, key);
        return links.isEmpty() ? Optional.empty() : Optional.of(links.get(0));
    }

    /**
     * Runs a link query and materializes owners and tags for every row.
     */
    private List<Link> selectMany(Connection conn, String statement, String... params) throws SQLException {
        Dialect dialect = database.dialect();
        List<Link> rows = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(dialect, statement))) {
            for (int i = 0; i < params.length; i++)
                ps.setString(i + 1, params[i]);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    rows.add(mapLink(rs));
            }
        }
        List<Link> links = new ArrayList<>(rows.size());
        for (Link row : rows) {
            links.add(new Link(row.id(), row.slug(), row.url(), row.title(), row.description(),
                    row.visibility(), row.createdAt(), row.updatedAt(),
                    OwnershipStore.listOwners(conn, dialect, row.id()),
                    TagStore.listForLink(conn, dialect, row.id())));
        }
        return links;
    }

    private static Link mapLink(ResultSet rs) throws SQLException {
        return new Link(
                rs.getString("id"),
                rs.getString("slug"),
                rs.getString("url"),
                nullToEmpty(rs.getString("title")),
                nullToEmpty(rs.getString("description")),
                Visibility.fromValue(rs.getString("visibility")),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                Instant.ofEpochMilli(rs.getLong("updated_at")),
                List.of(),
                List.of());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
