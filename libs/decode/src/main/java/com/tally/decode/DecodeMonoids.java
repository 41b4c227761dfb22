package com.tally.decode;

import com.tally.algebra.Monoid;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link Monoid} instances over {@link Decode}.
 * <p>
 * Three strategies are available:
 * <ul>
 *   <li>{@link #applicativeMonoid} runs both decoders and combines their values with an inner
 *       monoid; failures accumulate.</li>
 *   <li>{@link #alternativeMonoid} combines values when both succeed and falls back to whichever
 *       side succeeds otherwise.</li>
 *   <li>{@link #altMonoid} keeps the first success in a priority list and never combines values.</li>
 * </ul>
 * The laws hold when the inner monoid is lawful and the decoders are deterministic.
 */
public final class DecodeMonoids {

    private DecodeMonoids() {
        // utility class
    }

    /**
     * {@code empty()} succeeds with {@code m.empty()}. {@code concat(d1, d2)} runs both against
     * the same input: two successes are combined with {@code m.concat}; otherwise the errors of
     * every failed side are returned, {@code d1} first.
     *
     * @throws IllegalArgumentException if m is null
     */
    public static <I, A> Monoid<Decode<I, A>> applicativeMonoid(Monoid<A> m) {
        if (m == null) {
            throw new IllegalArgumentException("m must not be null");
        }
        return Monoid.ofLazy(
                (d1, d2) -> Decoders.ap(d1.map(a -> (Function<A, A>) b -> m.concat(a, b)), d2),
                () -> Decoders.of(m.empty()));
    }

    /**
     * {@code empty()} succeeds with {@code m.empty()}. {@code concat(d1, d2)} first tries the
     * applicative combination. If that fails, {@code d1} alone is tried, then {@code d2} alone.
     * <p>
     * Outcomes for {@code concat(d1, d2)}:
     * <ul>
     *   <li>both succeed: values combined with {@code m}</li>
     *   <li>one succeeds: that value, unchanged</li>
     *   <li>both fail: the errors of every attempt in order, so each side's errors appear
     *       once for the combined attempt and once for its standalone attempt</li>
     * </ul>
     *
     * @throws IllegalArgumentException if m is null
     */
    public static <I, A> Monoid<Decode<I, A>> alternativeMonoid(Monoid<A> m) {
        Monoid<Decode<I, A>> applicative = applicativeMonoid(m);
        return Monoid.ofLazy(
                (d1, d2) -> applicative.concat(d1, d2).alt(() -> d1.alt(() -> d2)),
                applicative::empty);
    }

    /**
     * {@code empty()} is the decoder produced by {@code zero}; it may succeed or fail.
     * {@code concat(d1, d2)} is {@code d1.alt(() -> d2)}: the first success wins and values are
     * never combined. When every decoder fails their errors are returned in attempt order.
     * <p>
     * Using {@code Decoders.left(Errors.empty())} as zero makes {@code empty()} a two-sided identity
     * for failing decoders too.
     *
     * @throws IllegalArgumentException if zero is null
     */
    public static <I, A> Monoid<Decode<I, A>> altMonoid(Supplier<? extends Decode<I, A>> zero) {
        if (zero == null) {
            throw new IllegalArgumentException("zero must not be null");
        }
        return Monoid.ofLazy((d1, d2) -> d1.alt(() -> d2), zero::get);
    }
}
