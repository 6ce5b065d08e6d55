package de.bsommerfeld.golinks.core.domain;

import java.util.Locale;

/**
 * Who may follow a link. Persisted as its lower-case {@link #value()} in the
 * {@code links.visibility} column.
 */
public enum Visibility {

    /** Listed and resolvable by everyone. */
    PUBLIC("public"),
    /** Resolvable by everyone who knows the slug, but never listed. */
    PRIVATE("private"),
    /** Resolvable only by owners, admins and users the link is shared with. */
    SECURE("secure");

    private final String value;

    Visibility(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolves a visibility value. A missing value means {@link #PUBLIC}.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static Visibility fromValue(String value) {
        if (value == null || value.isBlank()) {
            return PUBLIC;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "public":
                return PUBLIC;
            case "private":
                return PRIVATE;
            case "secure":
                return SECURE;
            default:
                throw new IllegalArgumentException(
                        "unknown visibility '" + value + "': must be public, private or secure");
        }
    }
}
