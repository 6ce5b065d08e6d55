package de.bsommerfeld.golinks.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies the versioned schema migrations that are not yet recorded in
 * {@code schema_migrations}.
 *
 * <p>
 * Migrations are forward-only. Each one runs in its own transaction together
 * with its bookkeeping row, so a failed migration leaves no record and is
 * retried on the next start. PostgreSQL and SQLite roll DDL back with the
 * transaction; MySQL commits DDL implicitly, so a half-applied MySQL migration
 * must be repaired by hand.
 */
@Singleton
public class Migrator {

    private static final Logger LOG = LoggerFactory.getLogger(Migrator.class);

    static final List<Migration> MIGRATIONS = List.of(
            new Migration(1, "create users", "001_create_users"),
            new Migration(2, "create sessions", "002_create_sessions"),
            new Migration(3, "create links", "003_create_links"),
            new Migration(4, "create tags", "004_create_tags"),
            new Migration(5, "create link_tags", "005_create_link_tags"),
            new Migration(6, "create link_owners", "006_create_link_owners"),
            new Migration(7, "add display_name_slug", "007_add_display_name_slug"),
            new Migration(8, "create link_clicks", "008_create_link_clicks"),
            new Migration(9, "create api_tokens", "009_create_api_tokens"),
            new Migration(10, "create keywords", "010_create_keywords"),
            new Migration(11, "add link visibility", "011_add_link_visibility"),
            new Migration(12, "create link_shares", "012_create_link_shares"));

    private final Database database;
    private final Clock clock;

    @Inject
    public Migrator(Database database) {
        this(database, Clock.systemUTC());
    }

    Migrator(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    /**
     * Applies every pending migration.
     *
     * @return the number of migrations applied by this call
     */
    public int migrate() {
        return migrate(Integer.MAX_VALUE);
    }

    /**
     * Applies pending migrations up to and including {@code targetVersion}.
     */
    int migrate(int targetVersion) {
        Set<Integer> applied = appliedVersions();
        int count = 0;
        for (Migration migration : MIGRATIONS) {
            if (migration.version() > targetVersion)
                break;
            if (applied.contains(migration.version()))
                continue;
            apply(migration);
            count++;
        }
        if (count == 0) {
            LOG.info("Database schema is up to date (version {}).", currentVersion());
        } else {
            LOG.info("Applied {} migration(s), schema now at version {}.", count, currentVersion());
        }
        return count;
    }

    /**
     * Returns the highest applied version, or {@code 0} for an empty database.
     */
    public int currentVersion() {
        Set<Integer> applied = appliedVersions();
        return applied.stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    private Set<Integer> appliedVersions() {
        return database.withConnection("read schema version", conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(SqlLoader.load(database.dialect(), "create-schema-migrations"));
            }
            Set<Integer> versions = new HashSet<>();
            try (PreparedStatement ps = conn.prepareStatement(
                    SqlLoader.load(database.dialect(), "select-applied-migrations"));
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    versions.add(rs.getInt(1));
            }
            return versions;
        });
    }

    private void apply(Migration migration) {
        LOG.info("Applying migration {} ({})", migration.version(), migration.name());
        String script = SqlLoader.loadMigration(database.dialect(), migration.file());
        database.inTransaction("migration " + migration.version(), conn -> {
            executeScript(conn, script);
            try (PreparedStatement ps = conn.prepareStatement(
                    SqlLoader.load(database.dialect(), "insert-schema-migration"))) {
                ps.setInt(1, migration.version());
                ps.setString(2, migration.name());
                ps.setLong(3, clock.millis());
                ps.executeUpdate();
            }
            return null;
        });
    }

    private static void executeScript(Connection conn, String script) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            for (String sql : statements(script)) {
                stmt.execute(sql);
            }
        }
    }

    /**
     * Splits a script on statement-terminating semicolons (a semicolon at the
     * end of a line) and drops {@code --} comment lines.
     */
    static List<String> statements(String script) {
        List<String> result = new ArrayList<>();
        for (String chunk : script.split(";\\s*(\\r?\\n|$)")) {
            StringBuilder sb = new StringBuilder();
            for (String line : chunk.split("\\r?\\n")) {
                if (line.trim().startsWith("--"))
                    continue;
                sb.append(line).append('\n');
            }
            String sql = sb.toString().trim();
            if (!sql.isEmpty())
                result.add(sql);
        }
        return result;
    }
}
