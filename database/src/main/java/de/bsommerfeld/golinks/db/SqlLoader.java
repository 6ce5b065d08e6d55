package de.bsommerfeld.golinks.db;

import de.bsommerfeld.golinks.core.config.Dialect;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL statements from classpath resource files.
 *
 * <p>
 * Statements live in {@code sql/<name>.sql} and are written in the SQL subset
 * shared by SQLite, PostgreSQL and MySQL. Where a dialect needs different
 * syntax it ships an override at {@code sql/<dialect>/<name>.sql}, which wins
 * for that dialect only. Migration scripts resolve the same way under
 * {@code migrations/}.
 *
 * <p>
 * Each file is read exactly once per dialect and cached for the lifetime of
 * the JVM. The naming convention is {@code <operation>-<entity>}, e.g.
 * {@code insert-link}, {@code select-tags-for-link}.
 *
 * @see Migrator
 */
public final class SqlLoader {

    static final String SQL_ROOT = "sql";
    static final String MIGRATIONS_ROOT = "migrations";

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the statement {@code name} for {@code dialect}, trimmed.
     *
     * @param dialect the target dialect
     * @param name    the file stem without path prefix or extension
     * @return the SQL string, ready for {@link java.sql.PreparedStatement} use
     * @throws IllegalStateException if neither the override nor the portable
     *                               resource exists
     */
    public static String load(Dialect dialect, String name) {
        return cached(SQL_ROOT, dialect, name);
    }

    /**
     * Returns the migration script {@code file} for {@code dialect}. Scripts
     * may contain several statements; see {@link Migrator#statements(String)}.
     */
    static String loadMigration(Dialect dialect, String file) {
        return cached(MIGRATIONS_ROOT, dialect, file);
    }

    /**
     * Returns the classpath location {@link #load} reads for the given root,
     * dialect and name.
     */
    static String resolve(String root, Dialect dialect, String name) {
        String override = root + "/" + dialect.resourceDir() + "/" + name + ".sql";
        if (SqlLoader.class.getClassLoader().getResource(override) != null)
            return override;
        String portable = root + "/" + name + ".sql";
        if (SqlLoader.class.getClassLoader().getResource(portable) != null)
            return portable;
        throw new IllegalStateException("SQL resource not found: " + portable + " (dialect " + dialect.configName() + ")");
    }

    private static String cached(String root, Dialect dialect, String name) {
        return CACHE.computeIfAbsent(root + "/" + dialect.resourceDir() + "/" + name,
                key -> readResource(resolve(root, dialect, name)));
    }

    private static String readResource(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
