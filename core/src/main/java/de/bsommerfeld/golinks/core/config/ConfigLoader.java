package de.bsommerfeld.golinks.core.config;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import de.bsommerfeld.golinks.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads {@link GlobalConfig} from a TOML file, applies environment overrides
 * and validates the result.
 *
 * <p>
 * Recognized environment variables: {@code GOLINKS_DB_DIALECT},
 * {@code GOLINKS_DB_DSN}, {@code GOLINKS_DB_USERNAME},
 * {@code GOLINKS_DB_PASSWORD}. They win over the file. When neither provides a
 * DSN and the dialect is SQLite, the database file is placed in the platform
 * application data directory.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String APP_NAME = "golinks";
    public static final String DEFAULT_FILE_NAME = "golinks.toml";

    private static final TomlMapper MAPPER = new TomlMapper();

    private ConfigLoader() {
    }

    /**
     * Loads from {@code path} using the process environment.
     */
    public static GlobalConfig load(Path path) {
        return load(path, System.getenv());
    }

    /**
     * Loads from {@code path} (optional) and the given environment.
     *
     * @throws IllegalStateException if the file is unreadable or the merged
     *                               configuration is invalid
     */
    public static GlobalConfig load(Path path, Map<String, String> env) {
        GlobalConfig config = readFile(path);
        applyEnvironment(config, env);
        applyDefaults(config);
        validate(config);
        return config;
    }

    private static GlobalConfig readFile(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            LOG.info("No configuration file at {}, using defaults.", path);
            return new GlobalConfig();
        }
        LOG.info("Loading configuration from: {}", path.toAbsolutePath());
        try {
            return MAPPER.readValue(path.toFile(), GlobalConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration file " + path, e);
        }
    }

    private static void applyEnvironment(GlobalConfig config, Map<String, String> env) {
        DatabaseConfig db = config.getDatabase();
        String dialect = env.get("GOLINKS_DB_DIALECT");
        if (dialect != null && !dialect.isBlank())
            db.setDialect(dialect);
        String dsn = env.get("GOLINKS_DB_DSN");
        if (dsn != null && !dsn.isBlank())
            db.setDsn(dsn);
        String username = env.get("GOLINKS_DB_USERNAME");
        if (username != null)
            db.setUsername(username);
        String password = env.get("GOLINKS_DB_PASSWORD");
        if (password != null)
            db.setPassword(password);
    }

    private static void applyDefaults(GlobalConfig config) {
        DatabaseConfig db = config.getDatabase();
        if ((db.getDsn() == null || db.getDsn().isBlank()) && isSqlite(db.getDialect())) {
            Path file = StorageUtils.getAppDataDir(APP_NAME).resolve("golinks.db");
            db.setDsn(file.toAbsolutePath().toString());
        }
    }

    private static boolean isSqlite(String dialect) {
        try {
            return Dialect.fromName(dialect) == Dialect.SQLITE;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    static void validate(GlobalConfig config) {
        try {
            config.dialect();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
        if (config.getDatabase().getDsn() == null || config.getDatabase().getDsn().isBlank()) {
            throw new IllegalStateException("GOLINKS_DB_DSN is required for dialect " + config.getDatabase().getDialect());
        }
        if (config.getClicks().getQueueCapacity() <= 0) {
            throw new IllegalStateException("clicks.queue-capacity must be positive");
        }
        if (config.getClicks().getDrainTimeoutSeconds() <= 0) {
            throw new IllegalStateException("clicks.drain-timeout-seconds must be positive");
        }
        if (config.getMetrics().getRefreshIntervalSeconds() <= 0) {
            throw new IllegalStateException("metrics.refresh-interval-seconds must be positive");
        }
    }
}
