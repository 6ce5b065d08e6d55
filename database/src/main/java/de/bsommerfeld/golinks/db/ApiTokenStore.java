package de.bsommerfeld.golinks.db;

import com.google.common.hash.Hashing;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.golinks.core.domain.ApiToken;
import de.bsommerfeld.golinks.core.domain.IssuedToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Personal API tokens.
 *
 * <p>
 * Tokens are {@value #TOKEN_PREFIX} followed by 32 random bytes in base62.
 * Only their hex SHA-256 hash is persisted, so a lost token can be revoked but
 * never shown again.
 */
@Singleton
public class ApiTokenStore {

    private static final Logger LOG = LoggerFactory.getLogger(ApiTokenStore.class);

    static final String TOKEN_PREFIX = "jl_";
    private static final String BASE62 = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";
    private static final int TOKEN_BYTES = 32;

    private final Database database;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    @Inject
    public ApiTokenStore(Database database) {
        this(database, Clock.systemUTC());
    }

    ApiTokenStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    /**
     * Issues a new token for the user.
     *
     * @param expiresAt {@code null} for a token that never expires
     * @throws StoreException {@code VALIDATION} for an empty name,
     *                        {@code NOT_FOUND} if the user is unknown
     */
    public IssuedToken create(String userId, String name, Instant expiresAt) {
        if (name == null || name.isBlank())
            throw StoreException.validation("token name must not be empty");
        String plaintext = generate();
        String hash = hash(plaintext);
        String id = UUID.randomUUID().toString();
        database.withConnection("createApiToken", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    SqlLoader.load(database.dialect(), "insert-api-token"))) {
                ps.setString(1, id);
                ps.setString(2, userId);
                ps.setString(3, name.trim());
                ps.setString(4, hash);
                setInstant(ps, 5, expiresAt);
                ps.setLong(6, clock.millis());
                return ps.executeUpdate();
            } catch (SQLException e) {
                if (SqlErrors.isForeignKeyViolation(e))
                    throw StoreException.notFound("user", userId);
                throw e;
            }
        });
        LOG.info("Issued API token {} ({}) for user {}", id, name.trim(), userId);
        return new IssuedToken(plaintext, getByHash(hash));
    }

    public ApiToken getByHash(String tokenHash) {
        return database.withConnection("getApiToken", conn -> selectOne(conn, tokenHash))
                .orElseThrow(() -> StoreException.notFound("api token", "hash " + abbreviate(tokenHash)));
    }

    /** Tokens of a user, newest first, revoked ones included. */
    public List<ApiToken> listByUser(String userId) {
        return database.withConnection("listApiTokens", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    SqlLoader.load(database.dialect(), "select-api-tokens-by-user"))) {
                ps.setString(1, userId);
                try (ResultSet rs = ps.executeQuery()) {
                    List<ApiToken> tokens = new ArrayList<>();
                    while (rs.next())
                        tokens.add(mapToken(rs));
                    return tokens;
                }
            }
        });
    }

    /**
     * Revokes a token of {@code userId}. Revoking twice keeps the first
     * revocation time.
     *
     * @throws StoreException {@code NOT_FOUND} if the user has no such token
     */
    public void revoke(String id, String userId) {
        int updated = database.withConnection("revokeApiToken", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    SqlLoader.load(database.dialect(), "revoke-api-token"))) {
                ps.setLong(1, clock.millis());
                ps.setString(2, id);
                ps.setString(3, userId);
                return ps.executeUpdate();
            }
        });
        if (updated == 0)
            throw StoreException.notFound("api token", id);
        LOG.info("Revoked API token {} of user {}", id, userId);
    }

    public void updateLastUsed(String id) {
        database.withConnection("touchApiToken", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    SqlLoader.load(database.dialect(), "update-api-token-last-used"))) {
                ps.setLong(1, clock.millis());
                ps.setString(2, id);
                return ps.executeUpdate();
            }
        });
    }

    /**
     * Resolves a presented plaintext token. Unknown, revoked and expired
     * tokens yield an empty result; a match records its use.
     */
    public Optional<ApiToken> authenticate(String plaintext) {
        if (plaintext == null || !plaintext.startsWith(TOKEN_PREFIX))
            return Optional.empty();
        Optional<ApiToken> token = database.withConnection("authenticateApiToken",
                conn -> selectOne(conn, hash(plaintext)));
        if (token.isEmpty() || !token.get().isActive(clock.instant())) {
            LOG.debug("Rejected API token {}", token.map(ApiToken::id).orElse("<unknown>"));
            return Optional.empty();
        }
        updateLastUsed(token.get().id());
        return token;
    }

    String generate() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return TOKEN_PREFIX + base62(bytes);
    }

    static String base62(byte[] bytes) {
        BigInteger n = new BigInteger(1, bytes);
        BigInteger base = BigInteger.valueOf(BASE62.length());
        StringBuilder encoded = new StringBuilder();
        while (n.signum() > 0) {
            BigInteger[] divMod = n.divideAndRemainder(base);
            encoded.append(BASE62.charAt(divMod[1].intValue()));
            n = divMod[0];
        }
        return encoded.reverse().toString();
    }

    /** Hex SHA-256 of the plaintext token, the form tokens are stored in. */
    public static String hash(String plaintext) {
        return Hashing.sha256().hashString(plaintext, StandardCharsets.UTF_8).toString();
    }

    private Optional<ApiToken> selectOne(Connection conn, String tokenHash) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                SqlLoader.load(database.dialect(), "select-api-token-by-hash"))) {
            ps.setString(1, tokenHash);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapToken(rs)) : Optional.empty();
            }
        }
    }

    private static ApiToken mapToken(ResultSet rs) throws SQLException {
        return new ApiToken(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("name"),
                rs.getString("token_hash"),
                getInstant(rs, "last_used_at"),
                getInstant(rs, "expires_at"),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                getInstant(rs, "revoked_at"));
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null)
            ps.setNull(index, Types.BIGINT);
        else
            ps.setLong(index, value.toEpochMilli());
    }

    private static String abbreviate(String hash) {
        return hash == null || hash.length() <= 8 ? String.valueOf(hash) : hash.substring(0, 8) + "...";
    }
}
