package de.bsommerfeld.golinks.core.config;

import java.util.Locale;

/**
 * The SQL engine a deployment targets. This value is resolved once from
 * configuration and handed explicitly to the connection factory and the
 * migrator; no component keeps it in static state.
 */
public enum Dialect {

    SQLITE("sqlite3", "jdbc:sqlite:"),
    POSTGRES("postgres", "jdbc:postgresql:"),
    MYSQL("mysql", "jdbc:mysql:");

    private final String configName;
    private final String jdbcPrefix;

    Dialect(String configName, String jdbcPrefix) {
        this.configName = configName;
        this.jdbcPrefix = jdbcPrefix;
    }

    /** Name used in configuration files and environment variables. */
    public String configName() {
        return configName;
    }

    public String jdbcPrefix() {
        return jdbcPrefix;
    }

    /** Classpath directory holding statements that override the portable SQL. */
    public String resourceDir() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isEmbedded() {
        return this == SQLITE;
    }

    /**
     * Resolves a configured dialect name. Accepts the canonical names
     * ({@code sqlite3}, {@code postgres}, {@code mysql}) and the common
     * aliases {@code sqlite} and {@code postgresql}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static Dialect fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("database dialect is required (sqlite3, postgres, mysql)");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "sqlite":
            case "sqlite3":
                return SQLITE;
            case "postgres":
            case "postgresql":
                return POSTGRES;
            case "mysql":
                return MYSQL;
            default:
                throw new IllegalArgumentException(
                        "unsupported database dialect '" + name + "': must be sqlite3, postgres or mysql");
        }
    }
}
