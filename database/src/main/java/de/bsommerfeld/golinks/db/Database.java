package de.bsommerfeld.golinks.db;

import de.bsommerfeld.golinks.core.config.DatabaseConfig;
import de.bsommerfeld.golinks.core.config.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * Connection factory for one configured database.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. On SQLite every connection enables foreign keys and a busy timeout,
 * since both are per-connection settings there, and begins its transactions
 * as {@code IMMEDIATE}: a transaction that reads before it writes takes the
 * write lock up front and waits out the busy timeout instead of failing on
 * the lock upgrade. The journal mode is switched to WAL once in
 * {@link #initialize()}. PostgreSQL and MySQL need no session setup.
 *
 * <h3>Transaction boundaries</h3>
 * {@link #inTransaction} runs multi-statement work with auto-commit disabled
 * and rolls back on any failure. {@link #withConnection} runs single reads and
 * writes in auto-commit mode. Both convert an unhandled {@link SQLException}
 * into a {@link StoreException}.
 */
public class Database {

    private static final Logger LOG = LoggerFactory.getLogger(Database.class);

    static final int SQLITE_BUSY_TIMEOUT_MS = 5000;

    private final Dialect dialect;
    private final String url;
    private final String username;
    private final String password;
    private final Properties sqliteProperties;

    public Database(Dialect dialect, String url, String username, String password) {
        this.dialect = dialect;
        this.url = url;
        this.username = username;
        this.password = password;
        this.sqliteProperties = dialect.isEmbedded() ? sqliteConfig().toProperties() : null;
    }

    /**
     * Builds the database from configuration. Credentials embedded in the DSN
     * are used unless {@code username} / {@code password} are configured
     * explicitly.
     *
     * @throws IllegalStateException if the DSN cannot be interpreted
     */
    public static Database fromConfig(DatabaseConfig config) {
        Dialect dialect = Dialect.fromName(config.getDialect());
        JdbcTarget target = JdbcTarget.parse(dialect, config.getDsn());
        String username = isBlank(config.getUsername()) ? target.username() : config.getUsername();
        String password = isBlank(config.getPassword()) ? target.password() : config.getPassword();
        return new Database(dialect, target.url(), username, password);
    }

    static String toJdbcUrl(Dialect dialect, String dsn) {
        return JdbcTarget.parse(dialect, dsn).url();
    }

    private static SQLiteConfig sqliteConfig() {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(SQLITE_BUSY_TIMEOUT_MS);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        return config;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public Dialect dialect() {
        return dialect;
    }

    String url() {
        return url;
    }

    String username() {
        return username;
    }

    /**
     * Prepares the database for use: creates the parent directory of a SQLite
     * file and enables WAL journaling. A no-op on server dialects beyond a
     * connectivity check.
     */
    public void initialize() {
        LOG.info("Initializing {} database", dialect.configName());
        if (dialect.isEmbedded()) {
            createSqliteDirectory();
        }
        try (Connection conn = getConnection()) {
            if (dialect.isEmbedded()) {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute("PRAGMA journal_mode = WAL");
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("initialize database", e);
        }
    }

    private void createSqliteDirectory() {
        String file = url.substring(dialect.jdbcPrefix().length());
        int query = file.indexOf('?');
        if (query >= 0)
            file = file.substring(0, query);
        if (file.isEmpty() || file.startsWith(":memory:") || file.startsWith("file:"))
            return;
        Path parent = Paths.get(file).toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StoreException(StoreException.Kind.STORAGE,
                    "Failed to create database directory " + parent, e);
        }
    }

    Connection getConnection() throws SQLException {
        if (dialect.isEmbedded())
            return DriverManager.getConnection(url, sqliteProperties);
        return isBlank(username)
                ? DriverManager.getConnection(url)
                : DriverManager.getConnection(url, username, password);
    }

    /**
     * Work executed against an open connection.
     */
    @FunctionalInterface
    interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    <T> T withConnection(String operation, SqlWork<T> work) {
        try (Connection conn = getConnection()) {
            return work.apply(conn);
        } catch (SQLException e) {
            throw SqlErrors.translate(operation, e);
        }
    }

    <T> T inTransaction(String operation, SqlWork<T> work) {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.apply(conn);
                commit(conn);
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate(operation, e);
        }
    }

    private void commit(Connection conn) throws SQLException {
        // sqlite-jdbc's commit() opens the next IMMEDIATE transaction right away;
        // leaving manual-commit mode commits without taking the write lock again.
        if (dialect.isEmbedded())
            conn.setAutoCommit(true);
        else
            conn.commit();
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException ex) {
            cause.addSuppressed(ex);
        }
    }
}
