package com.tally.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable, append-only path from the root of a decoded structure to the current position.
 * <p>
 * {@link #push(String, String)} returns a new context; the receiver is never modified, so a
 * context captured by a {@link ValidationError} stays a stable snapshot.
 */
public final class Context {

    private static final Context ROOT = new Context(List.of());

    private final List<ContextEntry> entries;

    private Context(List<ContextEntry> entries) {
        this.entries = entries;
    }

    /** The empty context. */
    public static Context root() {
        return ROOT;
    }

    /**
     * Creates a context from the given entries, first entry outermost.
     *
     * @throws IllegalArgumentException if any entry is null
     */
    public static Context of(ContextEntry... entries) {
        if (entries.length == 0) {
            return ROOT;
        }
        List<ContextEntry> copy = new ArrayList<>(entries.length);
        for (ContextEntry entry : entries) {
            if (entry == null) {
                throw new IllegalArgumentException("entry must not be null");
            }
            copy.add(entry);
        }
        return new Context(Collections.unmodifiableList(copy));
    }

    /** Returns a new context with an entry for {@code key} of {@code type} appended. */
    public Context push(String key, String type) {
        return push(ContextEntry.of(key, type));
    }

    /**
     * Returns a new context with {@code entry} appended.
     *
     * @throws IllegalArgumentException if entry is null
     */
    public Context push(ContextEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry must not be null");
        }
        List<ContextEntry> copy = new ArrayList<>(entries.size() + 1);
        copy.addAll(entries);
        copy.add(entry);
        return new Context(Collections.unmodifiableList(copy));
    }

    /** The entries, outermost first. The list is unmodifiable. */
    public List<ContextEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** The innermost entry, if any. */
    public Optional<ContextEntry> last() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    /**
     * Renders the path as dot-separated labels, e.g. {@code "user.address.zipCode"}.
     * Entries with an empty key contribute their type name instead.
     */
    public String path() {
        return entries.stream().map(ContextEntry::label).collect(Collectors.joining("."));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Context other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return path();
    }
}
