package de.bsommerfeld.golinks.db;

import de.bsommerfeld.golinks.core.config.Dialect;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MigratorTest {

    @TempDir
    Path tempDir;

    @Test
    void migrate_shouldApplyEveryMigrationOnce() {
        Database db = TestDatabases.empty(tempDir);
        Migrator migrator = new Migrator(db);

        assertEquals(0, migrator.currentVersion());
        assertEquals(Migrator.MIGRATIONS.size(), migrator.migrate());
        assertEquals(12, migrator.currentVersion());
        assertEquals(0, migrator.migrate(), "Second run should find nothing pending");
    }

    @Test
    void migrate_shouldCreateAllTables() throws SQLException {
        Database db = TestDatabases.migrated(tempDir);

        Set<String> tables = new HashSet<>();
        try (Connection conn = db.getConnection();
                ResultSet rs = conn.createStatement().executeQuery(
                        "SELECT name FROM sqlite_master WHERE type = 'table'")) {
            while (rs.next())
                tables.add(rs.getString(1));
        }
        assertTrue(tables.containsAll(List.of("schema_migrations", "users", "sessions", "links", "tags",
                "link_tags", "link_owners", "link_clicks", "api_tokens", "keywords", "link_shares")), "Missing tables in " + tables);
    }

    @Test
    void migrate_shouldResumeFromPartialSchema() {
        Database db = TestDatabases.empty(tempDir);
        Migrator migrator = new Migrator(db);

        assertEquals(3, migrator.migrate(3));
        assertEquals(3, migrator.currentVersion());
        assertEquals(9, migrator.migrate());
        assertEquals(12, migrator.currentVersion());
    }

    @Test
    void migrate_shouldBackfillUniqueDisplayNameSlugs() throws SQLException {
        Database db = TestDatabases.empty(tempDir);
        Migrator migrator = new Migrator(db);
        migrator.migrate(6);

        try (Connection conn = db.getConnection()) {
            insertLegacyUser(conn, "aaaaaaaa-0001", "s1", "Jane Doe", 1);
            insertLegacyUser(conn, "aaaaaaaa-0002", "s2", "jane doe", 2);
            insertLegacyUser(conn, "bbbbbbbb-0003", "s3", "-Bob-", 3);
            insertLegacyUser(conn, "cccccccc-0004", "s4", "!!!", 4);
        }
        migrator.migrate();

        Map<String, String> slugs = new HashMap<>();
        try (Connection conn = db.getConnection();
                ResultSet rs = conn.createStatement().executeQuery("SELECT id, display_name_slug FROM users")) {
            while (rs.next())
                slugs.put(rs.getString(1), rs.getString(2));
        }
        assertEquals("jane-doe", slugs.get("aaaaaaaa-0001"));
        assertEquals("jane-doe-2", slugs.get("aaaaaaaa-0002"));
        assertEquals("bob", slugs.get("bbbbbbbb-0003"));
        assertEquals("user-cccccccc", slugs.get("cccccccc-0004"));
    }

    @Test
    void everyMigrationShouldResolveForEveryDialect() {
        for (Dialect dialect : Dialect.values()) {
            for (Migration migration : Migrator.MIGRATIONS) {
                String script = SqlLoader.loadMigration(dialect, migration.file());
                assertFalse(Migrator.statements(script).isEmpty(),
                        migration.file() + " is empty for " + dialect);
            }
        }
    }

    @Test
    void migrationScripts_shouldUseDialectOverrides() {
        assertEquals("migrations/002_create_sessions.sql",
                SqlLoader.resolve(SqlLoader.MIGRATIONS_ROOT, Dialect.SQLITE, "002_create_sessions"));
        assertEquals("migrations/postgres/002_create_sessions.sql",
                SqlLoader.resolve(SqlLoader.MIGRATIONS_ROOT, Dialect.POSTGRES, "002_create_sessions"));
        assertEquals("migrations/mysql/002_create_sessions.sql",
                SqlLoader.resolve(SqlLoader.MIGRATIONS_ROOT, Dialect.MYSQL, "002_create_sessions"));

        assertTrue(SqlLoader.loadMigration(Dialect.POSTGRES, "002_create_sessions").contains("BYTEA"));
        assertTrue(SqlLoader.loadMigration(Dialect.MYSQL, "002_create_sessions").contains("TIMESTAMP(6)"));
        assertTrue(SqlLoader.loadMigration(Dialect.SQLITE, "002_create_sessions").contains("REAL"));
    }

    @Test
    void displayNameBackfill_shouldUseDialectSpecificSyntax() {
        assertTrue(SqlLoader.loadMigration(Dialect.SQLITE, "007_add_display_name_slug").contains("TRIM(display_name_slug, '-')"));
        assertTrue(SqlLoader.loadMigration(Dialect.POSTGRES, "007_add_display_name_slug").contains("BTRIM"));
        String mysql = SqlLoader.loadMigration(Dialect.MYSQL, "007_add_display_name_slug");
        assertTrue(mysql.contains("TRIM(BOTH '-' FROM"));
        assertTrue(mysql.contains("JOIN ("));
        assertFalse(mysql.contains("||"));
    }

    @Test
    void migrate_shouldMakeExistingLinksPublic() throws SQLException {
        Database db = TestDatabases.empty(tempDir);
        Migrator migrator = new Migrator(db);
        migrator.migrate(10);

        try (Connection conn = db.getConnection()) {
            conn.createStatement().executeUpdate("INSERT INTO links (id, slug, url, title, description, created_at, "
                    + "updated_at) VALUES ('l1', 'wiki', 'https://example.com', '', '', 1, 1)");
        }
        migrator.migrate();

        try (Connection conn = db.getConnection();
                ResultSet rs = conn.createStatement().executeQuery("SELECT visibility FROM links WHERE id = 'l1'")) {
            assertTrue(rs.next());
            assertEquals("public", rs.getString(1));
        }
    }

    @Test
    void linkShares_shouldKeepGrantingUserWithoutCascade() {
        for (Dialect dialect : Dialect.values()) {
            String script = SqlLoader.loadMigration(dialect, "012_create_link_shares");
            assertTrue(script.contains("ON DELETE CASCADE"), dialect.configName());
            assertEquals(2, script.split("ON DELETE CASCADE", -1).length - 1, dialect.configName());
        }
    }

    @Test
    void versions_shouldBeStrictlyIncreasing() {
        int previous = 0;
        for (Migration migration : Migrator.MIGRATIONS) {
            assertTrue(migration.version() > previous);
            previous = migration.version();
        }
    }

    @Test
    void statements_shouldSplitOnLineEndingSemicolonsAndDropComments() {
        List<String> statements = Migrator.statements("""
                -- leading comment
                CREATE TABLE a (x TEXT DEFAULT ';');
                -- between
                CREATE INDEX a_x ON a (x);
                """);

        assertEquals(2, statements.size());
        assertEquals("CREATE TABLE a (x TEXT DEFAULT ';')", statements.get(0));
        assertEquals("CREATE INDEX a_x ON a (x)", statements.get(1));
    }

    private static void insertLegacyUser(Connection conn, String id, String subject, String displayName,
            long createdAt) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO users (id, provider, subject, email, display_name, role, created_at, updated_at) "
                        + "VALUES (?, 'github', ?, '', ?, 'user', ?, ?)")) {
            ps.setString(1, id);
            ps.setString(2, subject);
            ps.setString(3, displayName);
            ps.setLong(4, createdAt);
            ps.setLong(5, createdAt);
            ps.executeUpdate();
        }
    }
}
