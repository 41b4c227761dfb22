package com.tally.algebra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Standard {@link Monoid} instances and folds over them.
 */
public final class Monoids {

    private static final Monoid<String> STRING = Monoid.of(String::concat, "");
    private static final Monoid<Integer> INT_SUM = Monoid.of(Integer::sum, 0);
    private static final Monoid<Integer> INT_PRODUCT = Monoid.of((a, b) -> a * b, 1);
    private static final Monoid<Long> LONG_SUM = Monoid.of(Long::sum, 0L);
    private static final Monoid<Boolean> ALL = Monoid.of(Boolean::logicalAnd, Boolean.TRUE);
    private static final Monoid<Boolean> ANY = Monoid.of(Boolean::logicalOr, Boolean.FALSE);

    private Monoids() {
        // utility class
    }

    /** String concatenation with {@code ""} as identity. */
    public static Monoid<String> string() {
        return STRING;
    }

    /** Integer addition with {@code 0} as identity. */
    public static Monoid<Integer> intSum() {
        return INT_SUM;
    }

    /** Integer multiplication with {@code 1} as identity. */
    public static Monoid<Integer> intProduct() {
        return INT_PRODUCT;
    }

    /** Long addition with {@code 0L} as identity. */
    public static Monoid<Long> longSum() {
        return LONG_SUM;
    }

    /** Logical conjunction with {@code true} as identity. */
    public static Monoid<Boolean> all() {
        return ALL;
    }

    /** Logical disjunction with {@code false} as identity. */
    public static Monoid<Boolean> any() {
        return ANY;
    }

    /**
     * Immutable list concatenation with the empty list as identity. Left elements come first.
     */
    public static <A> Monoid<List<A>> list() {
        return Monoid.ofLazy(Monoids::concatLists, List::of);
    }

    /**
     * Keeps the first present value.
     */
    public static <A> Monoid<Optional<A>> first() {
        return Monoid.ofLazy((left, right) -> left.isPresent() ? left : right, Optional::empty);
    }

    /**
     * Keeps the last present value.
     */
    public static <A> Monoid<Optional<A>> last() {
        return Monoid.ofLazy((left, right) -> right.isPresent() ? right : left, Optional::empty);
    }

    /**
     * Function composition: {@code concat(f, g)} applies {@code f} first, then {@code g}.
     */
    public static <A> Monoid<UnaryOperator<A>> endomorphism() {
        return Monoid.ofLazy((f, g) -> a -> g.apply(f.apply(a)), UnaryOperator::identity);
    }

    /**
     * Right-biased map merge: on duplicate keys the right-hand value wins.
     * Iteration order follows first insertion.
     */
    public static <K, V> Monoid<Map<K, V>> mapMerge() {
        return Monoid.ofLazy((left, right) -> {
            if (left.isEmpty()) {
                return right;
            }
            if (right.isEmpty()) {
                return left;
            }
            var merged = new LinkedHashMap<K, V>(left);
            merged.putAll(right);
            return Collections.unmodifiableMap(merged);
        }, Map::of);
    }

    /**
     * Folds all values from left to right, starting at {@code monoid.empty()}.
     *
     * @throws IllegalArgumentException if either argument is null
     */
    public static <A> A fold(Monoid<A> monoid, List<A> values) {
        if (monoid == null) {
            throw new IllegalArgumentException("monoid must not be null");
        }
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        A acc = monoid.empty();
        for (A value : values) {
            acc = monoid.concat(acc, value);
        }
        return acc;
    }

    /**
     * Maps every element into the monoid and folds the results.
     */
    public static <T, A> A foldMap(Monoid<A> monoid, List<T> values, Function<? super T, ? extends A> f) {
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        if (f == null) {
            throw new IllegalArgumentException("f must not be null");
        }
        List<A> mapped = new ArrayList<>(values.size());
        for (T value : values) {
            mapped.add(f.apply(value));
        }
        return fold(monoid, mapped);
    }

    private static <A> List<A> concatLists(List<A> left, List<A> right) {
        if (left.isEmpty()) {
            return right;
        }
        if (right.isEmpty()) {
            return left;
        }
        List<A> joined = new ArrayList<>(left.size() + right.size());
        joined.addAll(left);
        joined.addAll(right);
        return Collections.unmodifiableList(joined);
    }
}
