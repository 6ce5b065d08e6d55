package de.bsommerfeld.golinks.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code golinks.toml}. Every section has usable defaults so that a
 * missing file yields a working SQLite setup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("clicks")
    private ClickConfig clicks = new ClickConfig();

    @JsonProperty("metrics")
    private MetricsConfig metrics = new MetricsConfig();

    public DatabaseConfig getDatabase() {
        return database;
    }

    public ClickConfig getClicks() {
        return clicks;
    }

    public MetricsConfig getMetrics() {
        return metrics;
    }

    /** Resolved dialect of the {@code [database]} section. */
    public Dialect dialect() {
        return Dialect.fromName(database.getDialect());
    }
}
