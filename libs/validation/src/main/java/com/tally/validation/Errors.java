package com.tally.validation;

import com.tally.algebra.Monoid;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Immutable, insertion-ordered list of {@link ValidationError}s.
 * <p>
 * Forms a monoid under concatenation ({@link #monoid()}): left entries come first and
 * {@link #empty()} is the identity on both sides. Duplicates are kept as-is.
 */
public final class Errors implements Iterable<ValidationError> {

    private static final Errors EMPTY = new Errors(List.of());

    private static final Monoid<Errors> MONOID = Monoid.of((left, right) -> Errors.concat(left, right), EMPTY);

    private final List<ValidationError> items;

    private Errors(List<ValidationError> items) {
        this.items = items;
    }

    /** The empty error list. */
    public static Errors empty() {
        return EMPTY;
    }

    /** The concatenation monoid. */
    public static Monoid<Errors> monoid() {
        return MONOID;
    }

    /**
     * Creates an error list holding the given errors in order.
     *
     * @throws IllegalArgumentException if any error is null
     */
    public static Errors of(ValidationError... errors) {
        return of(Arrays.asList(errors));
    }

    /**
     * Creates an error list from a list, preserving order.
     *
     * @throws IllegalArgumentException if the list or any element is null
     */
    public static Errors of(List<ValidationError> errors) {
        if (errors == null) {
            throw new IllegalArgumentException("errors must not be null");
        }
        if (errors.isEmpty()) {
            return EMPTY;
        }
        for (ValidationError error : errors) {
            if (error == null) {
                throw new IllegalArgumentException("errors must not contain null");
            }
        }
        return new Errors(List.copyOf(errors));
    }

    /** Shorthand for a single error with no context. */
    public static Errors of(Object value, String message) {
        return of(ValidationError.of(value, message));
    }

    /**
     * Concatenates two error lists: all of {@code left}, then all of {@code right}.
     * Runs in O(len(left) + len(right)).
     */
    public static Errors concat(Errors left, Errors right) {
        if (left == null) {
            throw new IllegalArgumentException("left must not be null");
        }
        if (right == null) {
            throw new IllegalArgumentException("right must not be null");
        }
        if (left.isEmpty()) {
            return right;
        }
        if (right.isEmpty()) {
            return left;
        }
        List<ValidationError> joined = new ArrayList<>(left.size() + right.size());
        joined.addAll(left.items);
        joined.addAll(right.items);
        return new Errors(Collections.unmodifiableList(joined));
    }

    /** Returns this list followed by {@code other}. */
    public Errors concat(Errors other) {
        return concat(this, other);
    }

    /** Returns this list with {@code error} appended. */
    public Errors append(ValidationError error) {
        return concat(this, of(error));
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public ValidationError get(int index) {
        return items.get(index);
    }

    /** The errors as an unmodifiable list. */
    public List<ValidationError> toList() {
        return items;
    }

    /** The message of every error, in order. */
    public List<String> messages() {
        return items.stream().map(ValidationError::message).toList();
    }

    public Stream<ValidationError> stream() {
        return items.stream();
    }

    @Override
    public Iterator<ValidationError> iterator() {
        return items.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Errors other && items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return "Errors" + items;
    }
}
