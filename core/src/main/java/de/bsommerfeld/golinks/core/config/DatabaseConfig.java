package de.bsommerfeld.golinks.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connection settings. For SQLite the DSN may be a plain file path; every
 * other dialect expects a full JDBC URL.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseConfig {

    @JsonProperty("dialect")
    private String dialect = Dialect.SQLITE.configName();

    @JsonProperty("dsn")
    private String dsn;

    @JsonProperty("username")
    private String username;

    @JsonProperty("password")
    private String password;

    public String getDialect() {
        return dialect;
    }

    public void setDialect(String dialect) {
        this.dialect = dialect;
    }

    public String getDsn() {
        return dsn;
    }

    public void setDsn(String dsn) {
        this.dsn = dsn;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }
}
