package com.tally.decode;

import com.tally.algebra.Monoid;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link Monoid} instances over {@link Validate}, with the same strategies as
 * {@link DecodeMonoids}. Both operands of {@code concat} receive the same input and context.
 */
public final class ValidateMonoids {

    private ValidateMonoids() {
        // utility class
    }

    /**
     * {@code empty()} succeeds with {@code m.empty()}. {@code concat(v1, v2)} runs both; two
     * successes are combined with {@code m.concat}, otherwise the errors of every failed side are
     * returned, {@code v1} first.
     *
     * @throws IllegalArgumentException if m is null
     */
    public static <I, A> Monoid<Validate<I, A>> applicativeMonoid(Monoid<A> m) {
        if (m == null) {
            throw new IllegalArgumentException("m must not be null");
        }
        return Monoid.ofLazy(
                (v1, v2) -> Validate.ap(v1.map(a -> (Function<A, A>) b -> m.concat(a, b)), v2),
                () -> Validate.of(m.empty()));
    }

    /**
     * Tries the applicative combination, then {@code v1} alone, then {@code v2} alone. When both
     * fail each side's errors appear twice, once per attempt.
     *
     * @throws IllegalArgumentException if m is null
     */
    public static <I, A> Monoid<Validate<I, A>> alternativeMonoid(Monoid<A> m) {
        Monoid<Validate<I, A>> applicative = applicativeMonoid(m);
        return Monoid.ofLazy(
                (v1, v2) -> applicative.concat(v1, v2).alt(() -> v1.alt(() -> v2)),
                applicative::empty);
    }

    /**
     * {@code concat(v1, v2)} is {@code v1.alt(() -> v2)}; {@code empty()} is produced by {@code zero}.
     *
     * @throws IllegalArgumentException if zero is null
     */
    public static <I, A> Monoid<Validate<I, A>> altMonoid(Supplier<? extends Validate<I, A>> zero) {
        if (zero == null) {
            throw new IllegalArgumentException("zero must not be null");
        }
        return Monoid.ofLazy((v1, v2) -> v1.alt(() -> v2), zero::get);
    }
}
