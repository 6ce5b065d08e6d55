package de.bsommerfeld.golinks.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.golinks.core.config.Dialect;
import de.bsommerfeld.golinks.core.domain.Role;
import de.bsommerfeld.golinks.core.domain.User;
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
 * Users identified by their identity provider and subject.
 */
@Singleton
public class UserStore {

    private static final Logger LOG = LoggerFactory.getLogger(UserStore.class);

    static final int MAX_UPSERT_ATTEMPTS = 3;

    /** What happens to the links a deleted user is primary owner of. */
    public enum LinkAction {
        /** The replacing admin becomes primary owner. */
        REASSIGN,
        /** The links are deleted with the user. */
        DELETE
    }

    private final Database database;
    private final Clock clock;

    @Inject
    public UserStore(Database database) {
        this(database, Clock.systemUTC());
    }

    UserStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    /**
     * Creates or refreshes the user for {@code (provider, subject)}. Email,
     * display name and role are overwritten on every call; the display-name
     * slug is re-derived and made unique by appending {@code -2}, {@code -3},
     * and so on.
     *
     * <p>
     * Two first logins of the same identity, or two users claiming the same
     * slug at once, make the later transaction hit a unique constraint; it is
     * retried against the now committed row.
     *
     * @throws StoreException {@code TRANSIENT} if the conflict persists for
     *                        {@value #MAX_UPSERT_ATTEMPTS} attempts
     */
    public User upsert(String provider, String subject, String email, String displayName, Role role) {
        if (provider == null || provider.isBlank() || subject == null || subject.isBlank())
            throw StoreException.validation("provider and subject are required");
        Role effectiveRole = role == null ? Role.USER : role;
        String name = displayName == null ? "" : displayName.trim();
        long now = clock.millis();

        for (int attempt = 1;; attempt++) {
            try {
                String id = database.inTransaction("upsertUser",
                        conn -> upsertRow(conn, provider, subject, email, name, effectiveRole, now));
                return getById(id);
            } catch (UpsertConflict e) {
                if (attempt >= MAX_UPSERT_ATTEMPTS)
                    throw new StoreException(StoreException.Kind.TRANSIENT,
                            "upsertUser kept conflicting for " + provider + "/" + subject, e.getCause());
                LOG.debug("Concurrent upsert of {}/{}, retrying (attempt {})", provider, subject, attempt + 1);
            }
        }
    }

    private String upsertRow(Connection conn, String provider, String subject, String email, String name,
            Role role, long now) throws SQLException {
        Dialect dialect = database.dialect();
        Optional<User> existing = selectUser(conn, "select-user-by-provider", provider, subject);
        String excludeId = existing.map(User::id).orElse("");
        String slug = resolveUniqueSlug(conn, SlugRules.deriveDisplayNameSlug(name), excludeId);

        if (existing.isPresent()) {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(dialect, "update-user"))) {
                ps.setString(1, nullToEmpty(email));
                ps.setString(2, name);
                ps.setString(3, slug);
                ps.setString(4, role.value());
                ps.setLong(5, now);
                ps.setString(6, excludeId);
                ps.executeUpdate();
            } catch (SQLException e) {
                if (SqlErrors.isUniqueViolation(e))
                    throw new UpsertConflict(e);
                throw e;
            }
            return excludeId;
        }
        String newId = UUID.randomUUID().toString();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(dialect, "insert-user"))) {
            ps.setString(1, newId);
            ps.setString(2, provider);
            ps.setString(3, subject);
            ps.setString(4, nullToEmpty(email));
            ps.setString(5, name);
            ps.setString(6, slug);
            ps.setString(7, role.value());
            ps.setLong(8, now);
            ps.setLong(9, now);
            ps.executeUpdate();
        } catch (SQLException e) {
            if (SqlErrors.isUniqueViolation(e))
                throw new UpsertConflict(e);
            throw e;
        }
        LOG.debug("Created user {} for {}/{}", newId, provider, subject);
        return newId;
    }

    public User getById(String id) {
        return database.withConnection("getUser", conn -> selectUser(conn, "select-user-by-id", id))
                .orElseThrow(() -> StoreException.notFound("user", id));
    }

    public User getByDisplayNameSlug(String slug) {
        return database.withConnection("getUserBySlug",
                conn -> selectUser(conn, "select-user-by-display-name-slug", slug))
                .orElseThrow(() -> StoreException.notFound("user", slug));
    }

    /**
     * The oldest user with this email. Emails are not unique across
     * providers.
     */
    public User getByEmail(String email) {
        return database.withConnection("getUserByEmail", conn -> selectUser(conn, "select-user-by-email", email))
                .orElseThrow(() -> StoreException.notFound("user", email));
    }

    /** All users ordered by display name. */
    public List<User> listAll() {
        return database.withConnection("listUsers", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(database.dialect(), "select-all-users"));
                    ResultSet rs = ps.executeQuery()) {
                List<User> users = new ArrayList<>();
                while (rs.next())
                    users.add(mapUser(rs));
                return users;
            }
        });
    }

    public User updateRole(String id, Role role) {
        int updated = database.withConnection("updateUserRole", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    SqlLoader.load(database.dialect(), "update-user-role"))) {
                ps.setString(1, role.value());
                ps.setLong(2, clock.millis());
                ps.setString(3, id);
                return ps.executeUpdate();
            }
        });
        if (updated == 0)
            throw StoreException.notFound("user", id);
        LOG.info("Changed role of user {} to {}", id, role.value());
        return getById(id);
    }

    public long countAll() {
        return count("count-users", null);
    }

    /** Number of links the user is primary owner of. */
    public long countPrimaryLinks(String userId) {
        return count("count-primary-links", userId);
    }

    private long count(String statement, String param) {
        return database.withConnection(statement, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(database.dialect(), statement))) {
                if (param != null)
                    ps.setString(1, param);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            }
        });
    }

    /**
     * Deletes {@code targetId} on behalf of {@code adminId}, in one
     * transaction. Links the target is primary owner of are reassigned to the
     * admin or deleted according to {@code action}; their co-ownerships are
     * dropped and the shares they granted are attributed to the admin. API
     * tokens and received shares go with the user.
     *
     * @return the number of links reassigned or deleted
     * @throws StoreException {@code VALIDATION} if both ids are the same,
     *                        {@code NOT_FOUND} if either user is unknown
     */
    public int deleteWithLinks(String targetId, String adminId, LinkAction action) {
        if (action == null)
            throw StoreException.validation("link action is required");
        if (targetId == null || targetId.equals(adminId))
            throw StoreException.validation("a user cannot be deleted in favour of themselves");
        Dialect dialect = database.dialect();
        int affected = database.inTransaction("deleteUser", conn -> {
            if (selectUser(conn, "select-user-by-id", targetId).isEmpty())
                throw StoreException.notFound("user", targetId);
            if (selectUser(conn, "select-user-by-id", adminId).isEmpty())
                throw StoreException.notFound("user", adminId);

            List<String> linkIds = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(dialect, "select-primary-link-ids"))) {
                ps.setString(1, targetId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next())
                        linkIds.add(rs.getString(1));
                }
            }
            for (String linkId : linkIds) {
                if (action == LinkAction.REASSIGN) {
                    // the admin may already co-own the link
                    OwnershipStore.deleteOwner(conn, dialect, linkId, adminId);
                    execute(conn, "update-link-primary-owner", adminId, linkId, targetId);
                } else {
                    execute(conn, "delete-link", linkId);
                }
            }
            execute(conn, "delete-user-owner-rows", targetId);
            execute(conn, "update-share-granter", adminId, targetId);
            execute(conn, "delete-user", targetId);
            return linkIds.size();
        });
        LOG.info("Deleted user {} ({} link(s) {} by {})", targetId, affected,
                action == LinkAction.REASSIGN ? "reassigned" : "deleted", adminId);
        return affected;
    }

    private String resolveUniqueSlug(Connection conn, String base, String excludeId) throws SQLException {
        String candidate = base;
        for (int suffix = 2; slugTaken(conn, candidate, excludeId); suffix++) {
            candidate = base + "-" + suffix;
        }
        return candidate;
    }

    private boolean slugTaken(Connection conn, String slug, String excludeId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                SqlLoader.load(database.dialect(), "exists-display-name-slug"))) {
            ps.setString(1, slug);
            ps.setString(2, excludeId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private int execute(Connection conn, String statement, String... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(database.dialect(), statement))) {
            for (int i = 0; i < params.length; i++)
                ps.setString(i + 1, params[i]);
            return ps.executeUpdate();
        }
    }

    private Optional<User> selectUser(Connection conn, String statement, String... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(database.dialect(), statement))) {
            for (int i = 0; i < params.length; i++)
                ps.setString(i + 1, params[i]);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapUser(rs)) : Optional.empty();
            }
        }
    }

    private static User mapUser(ResultSet rs) throws SQLException {
        return new User(
                rs.getString("id"),
                rs.getString("provider"),
                rs.getString("subject"),
                rs.getString("email"),
                rs.getString("display_name"),
                rs.getString("display_name_slug"),
                Role.fromValue(rs.getString("role")),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                Instant.ofEpochMilli(rs.getLong("updated_at")));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /** A unique-constraint race inside {@link #upsert}; the transaction is retried. */
    private static final class UpsertConflict extends RuntimeException {

        UpsertConflict(SQLException cause) {
            super(cause);
        }
    }
}
