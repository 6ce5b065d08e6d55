package de.bsommerfeld.golinks.core.slug;

/**
 * Thrown when a requested link slug fails the format or reserved-name rules.
 * Raised before any I/O takes place.
 */
public class InvalidSlugException extends IllegalArgumentException {

    /** Why a slug was rejected. */
    public enum Reason {
        EMPTY,
        FORMAT,
        RESERVED
    }

    private final String slug;
    private final Reason reason;

    public InvalidSlugException(String slug, Reason reason, String message) {
        super(message);
        this.slug = slug;
        this.reason = reason;
    }

    public String getSlug() {
        return slug;
    }

    public Reason getReason() {
        return reason;
    }
}
