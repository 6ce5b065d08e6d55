package de.bsommerfeld.golinks.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.golinks.core.config.Dialect;
import de.bsommerfeld.golinks.core.domain.LinkOwner;
import de.bsommerfeld.golinks.core.domain.Role;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the {@code link_owners} table plus the connection-scoped
 * writes {@link LinkStore} performs inside its own transactions.
 */
@Singleton
public class OwnershipStore {

    private final Database database;

    @Inject
    public OwnershipStore(Database database) {
        this.database = database;
    }

    public boolean isOwner(String linkId, String userId) {
        return database.withConnection("isOwner",
                conn -> findOwner(conn, database.dialect(), linkId, userId).isPresent());
    }

    /**
     * Admins may act on any link and are answered without a query. Everyone
     * else needs an ownership row.
     */
    public boolean isOwnerOrAdmin(String userId, String linkId, Role role) {
        if (role == Role.ADMIN)
            return true;
        return isOwner(linkId, userId);
    }

    /**
     * Returns the ownership set of a link, primary owner first. Empty for an
     * unknown link.
     */
    public List<LinkOwner> listOwners(String linkId) {
        return database.withConnection("listOwners", conn -> listOwners(conn, database.dialect(), linkId));
    }

    static List<LinkOwner> listOwners(Connection conn, Dialect dialect, String linkId) throws SQLException {
        List<LinkOwner> owners = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(dialect, "select-link-owners"))) {
            ps.setString(1, linkId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    owners.add(mapOwner(rs));
            }
        }
        return owners;
    }

    static Optional<LinkOwner> findOwner(Connection conn, Dialect dialect, String linkId, String userId)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(dialect, "select-link-owner"))) {
            ps.setString(1, linkId);
            ps.setString(2, userId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapOwner(rs)) : Optional.empty();
            }
        }
    }

    static void insertPrimaryOwner(Connection conn, Dialect dialect, String linkId, String userId)
            throws SQLException {
        insertOwner(conn, dialect, linkId, userId, true);
    }

    static void insertCoOwner(Connection conn, Dialect dialect, String linkId, String userId)
            throws SQLException {
        insertOwner(conn, dialect, linkId, userId, false);
    }

    static int deleteOwner(Connection conn, Dialect dialect, String linkId, String userId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(dialect, "delete-link-owner"))) {
            ps.setString(1, linkId);
            ps.setString(2, userId);
            return ps.executeUpdate();
        }
    }

    private static void insertOwner(Connection conn, Dialect dialect, String linkId, String userId,
            boolean primary) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(dialect, "insert-link-owner"))) {
            ps.setString(1, linkId);
            ps.setString(2, userId);
            ps.setInt(3, primary ? 1 : 0);
            ps.executeUpdate();
        }
    }

    private static LinkOwner mapOwner(ResultSet rs) throws SQLException {
        return new LinkOwner(rs.getString("user_id"), rs.getInt("is_primary") != 0);
    }
}
