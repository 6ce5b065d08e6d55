package de.bsommerfeld.golinks.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.golinks.core.domain.Keyword;
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
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Host-level keywords and their URL templates.
 */
@Singleton
public class KeywordStore {

    private static final Logger LOG = LoggerFactory.getLogger(KeywordStore.class);

    private static final Pattern KEYWORD = Pattern.compile("^[a-z][a-z0-9-]*$");

    private final Database database;
    private final Clock clock;

    @Inject
    public KeywordStore(Database database) {
        this(database, Clock.systemUTC());
    }

    KeywordStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    /**
     * @throws StoreException {@code VALIDATION} for a malformed keyword or an
     *                        empty template, {@code KEYWORD_TAKEN} if the
     *                        keyword exists
     */
    public Keyword create(String keyword, String urlTemplate, String description) {
        String normalized = normalize(keyword);
        String template = requireTemplate(urlTemplate);
        String id = UUID.randomUUID().toString();
        database.withConnection("createKeyword", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(database.dialect(), "insert-keyword"))) {
                ps.setString(1, id);
                ps.setString(2, normalized);
                ps.setString(3, template);
                ps.setString(4, nullToEmpty(description));
                ps.setLong(5, clock.millis());
                return ps.executeUpdate();
            } catch (SQLException e) {
                if (SqlErrors.isUniqueViolation(e))
                    throw StoreException.keywordTaken(normalized);
                throw e;
            }
        });
        LOG.info("Created keyword {}", normalized);
        return getById(id);
    }

    public Keyword getById(String id) {
        return database.withConnection("getKeyword", conn -> selectOne(conn, "select-keyword-by-id", id))
                .orElseThrow(() -> StoreException.notFound("keyword", id));
    }

    /** Looks a keyword up ignoring letter case and surrounding whitespace. */
    public Keyword getByKeyword(String keyword) {
        String normalized = keyword == null ? "" : keyword.trim().toLowerCase(Locale.ROOT);
        return database.withConnection("getKeywordByName",
                conn -> selectOne(conn, "select-keyword-by-keyword", normalized))
                .orElseThrow(() -> StoreException.notFound("keyword", normalized));
    }

    /** All keywords ordered by keyword. */
    public List<Keyword> list() {
        return database.withConnection("listKeywords", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    SqlLoader.load(database.dialect(), "select-all-keywords"));
                    ResultSet rs = ps.executeQuery()) {
                List<Keyword> keywords = new ArrayList<>();
                while (rs.next())
                    keywords.add(mapKeyword(rs));
                return keywords;
            }
        });
    }

    public Keyword update(String id, String keyword, String urlTemplate, String description) {
        String normalized = normalize(keyword);
        String template = requireTemplate(urlTemplate);
        int updated = database.withConnection("updateKeyword", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(database.dialect(), "update-keyword"))) {
                ps.setString(1, normalized);
                ps.setString(2, template);
                ps.setString(3, nullToEmpty(description));
                ps.setString(4, id);
                return ps.executeUpdate();
            } catch (SQLException e) {
                if (SqlErrors.isUniqueViolation(e))
                    throw StoreException.keywordTaken(normalized);
                throw e;
            }
        });
        if (updated == 0)
            throw StoreException.notFound("keyword", id);
        LOG.info("Updated keyword {}", normalized);
        return getById(id);
    }

    public void delete(String id) {
        int deleted = database.withConnection("deleteKeyword", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(database.dialect(), "delete-keyword"))) {
                ps.setString(1, id);
                return ps.executeUpdate();
            }
        });
        if (deleted == 0)
            throw StoreException.notFound("keyword", id);
        LOG.info("Deleted keyword {}", id);
    }

    /**
     * Trims and lower-cases a keyword: a letter followed by letters, digits
     * or hyphens.
     */
    static String normalize(String keyword) {
        String normalized = keyword == null ? "" : keyword.trim().toLowerCase(Locale.ROOT);
        if (!KEYWORD.matcher(normalized).matches())
            throw StoreException.validation("invalid keyword '" + keyword
                    + "': must start with a letter and contain only letters, digits and hyphens");
        return normalized;
    }

    private static String requireTemplate(String urlTemplate) {
        if (urlTemplate == null || urlTemplate.isBlank())
            throw StoreException.validation("url template must not be empty");
        return urlTemplate.trim();
    }

    private Optional<Keyword> selectOne(Connection conn, String statement, String key) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(database.dialect(), statement))) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapKeyword(rs)) : Optional.empty();
            }
        }
    }

    private static Keyword mapKeyword(ResultSet rs) throws SQLException {
        return new Keyword(
                rs.getString("id"),
                rs.getString("keyword"),
                rs.getString("url_template"),
                nullToEmpty(rs.getString("description")),
                Instant.ofEpochMilli(rs.getLong("created_at")));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
