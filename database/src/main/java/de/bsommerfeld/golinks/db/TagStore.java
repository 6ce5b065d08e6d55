package de.bsommerfeld.golinks.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.golinks.core.config.Dialect;
import de.bsommerfeld.golinks.core.domain.Tag;
import de.bsommerfeld.golinks.core.domain.TagCount;
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
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Tags keyed by their derived slug.
 *
 * <p>
 * {@link #upsert(String)} is a single insert-if-absent statement followed by a
 * read, so concurrent upserts of names that derive to the same slug converge
 * on one row; the display name of whoever inserted first is kept.
 */
@Singleton
public class TagStore {

    private static final Logger LOG = LoggerFactory.getLogger(TagStore.class);

    static final int DEFAULT_SUGGEST_LIMIT = 10;
    static final int MAX_SUGGEST_LIMIT = 50;

    private final Database database;
    private final Clock clock;

    @Inject
    public TagStore(Database database) {
        this(database, Clock.systemUTC());
    }

    TagStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    /**
     * Returns the tag for {@code name}'s slug, creating it if absent.
     *
     * @throws StoreException {@code VALIDATION} if the name derives to an
     *                        empty slug
     */
    public Tag upsert(String name) {
        requireSlug(name);
        return database.withConnection("upsertTag", conn -> upsert(conn, name));
    }

    /**
     * Connection-scoped upsert used by {@link LinkStore#setTags} so tag
     * creation joins the caller's transaction.
     */
    Tag upsert(Connection conn, String name) throws SQLException {
        String slug = requireSlug(name);
        Dialect dialect = database.dialect();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(dialect, "insert-tag-if-absent"))) {
            ps.setString(1, UUID.randomUUID().toString());
            ps.setString(2, name.trim());
            ps.setString(3, slug);
            ps.setLong(4, clock.millis());
            if (ps.executeUpdate() > 0)
                LOG.debug("Created tag {}", slug);
        }
        // MySQL reads a REPEATABLE READ snapshot that may predate a concurrent
        // insert of the same slug; its override is a locking read.
        return findBySlug(conn, dialect, "select-tag-after-upsert", slug)
                .orElseThrow(() -> new StoreException(StoreException.Kind.STORAGE,
                        "tag vanished after upsert: " + slug));
    }

    public Tag getBySlug(String slug) {
        return database.withConnection("getTag", conn -> findBySlug(conn, database.dialect(), slug))
                .orElseThrow(() -> StoreException.notFound("tag", slug));
    }

    /** All tags ordered by name. */
    public List<Tag> list() {
        return database.withConnection("listTags", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(database.dialect(), "select-all-tags"));
                    ResultSet rs = ps.executeQuery()) {
                List<Tag> tags = new ArrayList<>();
                while (rs.next())
                    tags.add(mapTag(rs));
                return tags;
            }
        });
    }

    /** Tags attached to at least one link, with their link counts, ordered by name. */
    public List<TagCount> listWithCounts() {
        return database.withConnection("listTagsWithCounts", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    SqlLoader.load(database.dialect(), "select-tags-with-counts"));
                    ResultSet rs = ps.executeQuery()) {
                List<TagCount> counts = new ArrayList<>();
                while (rs.next())
                    counts.add(new TagCount(mapTag(rs), rs.getLong("link_count")));
                return counts;
            }
        });
    }

    /**
     * Tags whose slug starts with the slug derived from {@code prefix}.
     *
     * @param limit maximum results; non-positive means {@value #DEFAULT_SUGGEST_LIMIT},
     *              values above {@value #MAX_SUGGEST_LIMIT} are capped
     */
    public List<Tag> suggest(String prefix, int limit) {
        int effective = limit <= 0 ? DEFAULT_SUGGEST_LIMIT : Math.min(limit, MAX_SUGGEST_LIMIT);
        String pattern = escapeLike(SlugRules.deriveTagSlug(prefix)) + "%";
        return database.withConnection("suggestTags", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    SqlLoader.load(database.dialect(), "select-tags-by-prefix"))) {
                ps.setString(1, pattern);
                ps.setInt(2, effective);
                try (ResultSet rs = ps.executeQuery()) {
                    List<Tag> tags = new ArrayList<>();
                    while (rs.next())
                        tags.add(mapTag(rs));
                    return tags;
                }
            }
        });
    }

    /**
     * Escapes {@code LIKE} wildcards with {@code !}, the escape character
     * declared in {@code select-tags-by-prefix.sql}.
     */
    static String escapeLike(String value) {
        return value.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }

    static Optional<Tag> findBySlug(Connection conn, Dialect dialect, String slug) throws SQLException {
        return findBySlug(conn, dialect, "select-tag-by-slug", slug);
    }

    private static Optional<Tag> findBySlug(Connection conn, Dialect dialect, String statement, String slug)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(dialect, statement))) {
            ps.setString(1, slug);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapTag(rs)) : Optional.empty();
            }
        }
    }

    static List<Tag> listForLink(Connection conn, Dialect dialect, String linkId) throws SQLException {
        List<Tag> tags = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(dialect, "select-tags-for-link"))) {
            ps.setString(1, linkId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    tags.add(mapTag(rs));
            }
        }
        return tags;
    }

    static Tag mapTag(ResultSet rs) throws SQLException {
        return new Tag(rs.getString("id"), rs.getString("name"), rs.getString("slug"),
                Instant.ofEpochMilli(rs.getLong("created_at")));
    }

    private static String requireSlug(String name) {
        String slug = SlugRules.deriveTagSlug(name);
        if (slug.isEmpty())
            throw StoreException.validation("tag name has no usable characters: " + name);
        return slug;
    }
}
