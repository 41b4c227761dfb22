package com.tally.validation;

/**
 * One segment of a {@link Context} path.
 *
 * @param key    field name or map key; empty for unnamed positions such as a codec root
 * @param type   name of the type expected at this position (e.g. "int", "Address")
 * @param actual the raw value seen at this position, kept for diagnostics only (nullable)
 */
public record ContextEntry(String key, String type, Object actual) {

    /**
     * Compact constructor. Null key and type are normalized to the empty string.
     */
    public ContextEntry {
        key = key == null ? "" : key;
        type = type == null ? "" : type;
    }

    /** Creates an entry without an actual value. */
    public static ContextEntry of(String key, String type) {
        return new ContextEntry(key, type, null);
    }

    /** The label used when rendering a path: the key if present, otherwise the type. */
    public String label() {
        return key.isEmpty() ? type : key;
    }
}
