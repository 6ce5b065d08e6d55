package de.bsommerfeld.golinks.core.domain;

import java.util.Locale;

/**
 * Authorization role of a {@link User}. Persisted as its lower-case
 * {@link #value()} in the {@code users.role} column.
 */
public enum Role {

    USER("user"),
    ADMIN("admin");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolves a stored role value. Unknown or missing values fall back to
     * {@link #USER} so that a corrupted row never grants admin rights.
     */
    public static Role fromValue(String value) {
        if (value == null) {
            return USER;
        }
        return "admin".equals(value.trim().toLowerCase(Locale.ROOT)) ? ADMIN : USER;
    }
}
