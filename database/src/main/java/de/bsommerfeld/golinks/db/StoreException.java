package de.bsommerfeld.golinks.db;

/**
 * The single failure type of the store layer. Every {@link java.sql.SQLException}
 * and every rejected input leaving a store is converted into one of these, with
 * a {@link Kind} callers switch on.
 */
public class StoreException extends RuntimeException {

    public enum Kind {
        /** Input rejected before any I/O. */
        VALIDATION,
        NOT_FOUND,
        SLUG_TAKEN,
        KEYWORD_TAKEN,
        DUPLICATE_OWNER,
        PRIMARY_OWNER_IMMUTABLE,
        /** Connectivity, timeout or lock contention. The caller may retry. */
        TRANSIENT,
        /** Any other database failure. */
        STORAGE
    }

    private final Kind kind;

    public StoreException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StoreException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind == Kind.TRANSIENT;
    }

    public static StoreException validation(String message, Throwable cause) {
        return new StoreException(Kind.VALIDATION, message, cause);
    }

    public static StoreException validation(String message) {
        return new StoreException(Kind.VALIDATION, message);
    }

    public static StoreException notFound(String entity, String key) {
        return new StoreException(Kind.NOT_FOUND, entity + " not found: " + key);
    }

    public static StoreException slugTaken(String slug) {
        return new StoreException(Kind.SLUG_TAKEN, "slug already taken: " + slug);
    }

    public static StoreException keywordTaken(String keyword) {
        return new StoreException(Kind.KEYWORD_TAKEN, "keyword already exists: " + keyword);
    }

    public static StoreException duplicateOwner(String linkId, String userId) {
        return new StoreException(Kind.DUPLICATE_OWNER,
                "user " + userId + " already owns link " + linkId);
    }

    public static StoreException primaryOwnerImmutable(String linkId, String userId) {
        return new StoreException(Kind.PRIMARY_OWNER_IMMUTABLE,
                "user " + userId + " is the primary owner of link " + linkId + " and cannot be removed");
    }
}
