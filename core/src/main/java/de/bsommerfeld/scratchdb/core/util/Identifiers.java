package de.bsommerfeld.scratchdb.core.util;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Identifier helpers shared by the mirror tables and the durable store.
 */
public final class Identifiers {

    private static final Pattern HEX32 = Pattern.compile("^[0-9a-fA-F]{32}$");
    private static final Pattern CANONICAL_UUID = Pattern
            .compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");
    private static final int MAX_SLUG_LENGTH = 50;

    private Identifiers() {
    }

    /** New random identifier in the 32-char lower-case hex form the mirrors default to. */
    public static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /** Accepts canonical UUIDs and their 32-char hex form without hyphens. */
    public static boolean isUuid(String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        return HEX32.matcher(trimmed).matches() || CANONICAL_UUID.matcher(trimmed).matches();
    }

    /**
     * Normalizes a well-formed identifier to lower-case without hyphens, so
     * {@code 1F2E...} and {@code 1f2e-...} address the same record.
     *
     * @throws IllegalArgumentException if the value is not a UUID
     */
    public static String normalizeUuid(String value) {
        if (!isUuid(value)) {
            throw new IllegalArgumentException("Not a UUID: " + value);
        }
        return value.trim().replace("-", "").toLowerCase(Locale.ROOT);
    }

    /**
     * Human-friendly handle for a task card: the slugified title, or
     * {@code card-<first 8 id chars>} when the title has no slug characters.
     */
    public static String friendlyId(String title, String id) {
        String slug = slugify(title);
        if (!slug.isEmpty()) {
            return slug;
        }
        if (id != null && !id.isBlank()) {
            String compact = id.replace("-", "");
            return "card-" + compact.substring(0, Math.min(8, compact.length()));
        }
        return "card";
    }

    static String slugify(String text) {
        if (text == null) {
            return "";
        }
        String slug = NON_SLUG.matcher(text.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
        slug = trimDashes(slug);
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = trimDashes(slug.substring(0, MAX_SLUG_LENGTH));
        }
        return slug;
    }

    private static String trimDashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '-') {
            end--;
        }
        return s.substring(start, end);
    }
}
