package de.bsommerfeld.golinks.core.slug;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Slug normalization and validation shared by links, tags and users.
 *
 * <p>
 * Link slugs are user supplied and validated; tag and display-name slugs are
 * derived and never rejected by this class. All methods are pure and perform
 * no I/O.
 */
public final class SlugRules {

    /** First and last character alphanumeric, hyphens allowed in between. */
    private static final Pattern LINK_SLUG = Pattern.compile("^[a-z0-9]([a-z0-9-]*[a-z0-9])?$");

    /** Route prefixes a link slug would shadow. */
    private static final Set<String> RESERVED = Set.of("auth", "static", "dashboard", "admin");

    private static final Pattern WHITESPACE = Pattern.compile("[\\s_]+");
    private static final Pattern NON_SLUG_CHAR = Pattern.compile("[^a-z0-9-]");
    private static final Pattern HYPHEN_RUN = Pattern.compile("-{2,}");

    private SlugRules() {
    }

    /**
     * Normalizes a requested link slug (trim, lower-case) and validates it.
     *
     * @param raw the slug as entered by the user
     * @return the normalized slug that is stored and compared
     * @throws InvalidSlugException if the slug is empty, malformed or reserved
     */
    public static String normalizeLinkSlug(String raw) {
        String slug = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (slug.isEmpty()) {
            throw new InvalidSlugException(slug, InvalidSlugException.Reason.EMPTY, "slug must not be empty");
        }
        if (!LINK_SLUG.matcher(slug).matches()) {
            throw new InvalidSlugException(slug, InvalidSlugException.Reason.FORMAT,
                    "slug must contain only lowercase letters, digits and hyphens, "
                            + "and must not start or end with a hyphen: " + raw);
        }
        if (RESERVED.contains(slug)) {
            throw new InvalidSlugException(slug, InvalidSlugException.Reason.RESERVED,
                    "slug is reserved: " + slug);
        }
        return slug;
    }

    /**
     * Returns {@code true} if {@code raw} would be accepted by
     * {@link #normalizeLinkSlug(String)}.
     */
    public static boolean isValidLinkSlug(String raw) {
        try {
            normalizeLinkSlug(raw);
            return true;
        } catch (InvalidSlugException e) {
            return false;
        }
    }

    public static boolean isReserved(String slug) {
        return slug != null && RESERVED.contains(slug.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Derives the tag slug used as the tag's identity: lower-case, whitespace
     * and underscores become single hyphens, everything outside
     * {@code [a-z0-9-]} is stripped, hyphen runs collapse and leading/trailing
     * hyphens are trimmed. May return an empty string.
     */
    public static String deriveTagSlug(String name) {
        return derive(name);
    }

    /**
     * Derives the base slug for a user's display name. Falls back to
     * {@code "user"} when nothing usable remains; uniqueness suffixes are
     * added by the user store.
     */
    public static String deriveDisplayNameSlug(String displayName) {
        String slug = derive(displayName);
        return slug.isEmpty() ? "user" : slug;
    }

    private static String derive(String input) {
        if (input == null) {
            return "";
        }
        String s = input.trim().toLowerCase(Locale.ROOT);
        s = WHITESPACE.matcher(s).replaceAll("-");
        s = NON_SLUG_CHAR.matcher(s).replaceAll("");
        s = HYPHEN_RUN.matcher(s).replaceAll("-");
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-')
            start++;
        while (end > start && s.charAt(end - 1) == '-')
            end--;
        return s.substring(start, end);
    }
}
