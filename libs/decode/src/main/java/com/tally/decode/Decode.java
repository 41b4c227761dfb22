package com.tally.decode;

import com.tally.validation.Errors;
import com.tally.validation.Validation;

import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * A pure function from raw input {@code I} to a {@link Validation} of {@code A}.
 * <p>
 * Decoders hold no mutable state and may be shared between threads, provided the functions
 * passed to the combinators are pure as well. Every combinator runs its operands against the
 * same input it was given.
 *
 * @param <I> the raw input type
 * @param <A> the decoded type
 */
@FunctionalInterface
public interface Decode<I, A> {

    /** Decodes {@code input}. */
    Validation<A> decode(I input);

    /**
     * Maps a successful result. {@code f} is never called on failure.
     */
    default <B> Decode<I, B> map(Function<? super A, ? extends B> f) {
        if (f == null) {
            throw new IllegalArgumentException("f must not be null");
        }
        return input -> decode(input).map(f);
    }

    /**
     * Sequential composition. On success the decoder returned by {@code f} runs against the
     * same input; on failure {@code f} is not called and the failure is returned.
     */
    default <B> Decode<I, B> chain(Kleisli<I, ? super A, B> f) {
        if (f == null) {
            throw new IllegalArgumentException("f must not be null");
        }
        return input -> decode(input).chain(a -> f.apply(a).decode(input));
    }

    /**
     * Error recovery. On failure the decoder returned by {@code f} runs against the same input.
     * If it fails too, the result holds the original errors followed by the new ones; if it
     * succeeds, its value replaces the failure. A success passes through and {@code f} is not called.
     */
    default Decode<I, A> chainLeft(Kleisli<I, Errors, A> f) {
        if (f == null) {
            throw new IllegalArgumentException("f must not be null");
        }
        return input -> decode(input).chainLeft(errors -> f.apply(errors).decode(input));
    }

    /** Alias for {@link #chainLeft}. */
    default Decode<I, A> orElse(Kleisli<I, Errors, A> f) {
        return chainLeft(f);
    }

    /**
     * Fallback. If this decoder succeeds, its result is returned and {@code second} is never
     * called. Otherwise {@code second} is called once and its decoder runs against the same
     * input; if that fails too, both error lists are returned in attempt order.
     */
    default Decode<I, A> alt(Supplier<? extends Decode<I, A>> second) {
        if (second == null) {
            throw new IllegalArgumentException("second must not be null");
        }
        return chainLeft(ignored -> second.get());
    }

    /** Rewrites the errors of a failure, e.g. to attach context; success passes through. */
    default Decode<I, A> mapErrors(UnaryOperator<Errors> f) {
        if (f == null) {
            throw new IllegalArgumentException("f must not be null");
        }
        return input -> decode(input).mapErrors(f);
    }

    /** Applies {@code operator} to this decoder. */
    default <B> Decode<I, B> pipe(Operator<I, A, B> operator) {
        return operator.apply(this);
    }

    /** Adapts the input type: {@code g} runs first, then this decoder. */
    default <J> Decode<J, A> contramap(Function<? super J, ? extends I> g) {
        if (g == null) {
            throw new IllegalArgumentException("g must not be null");
        }
        return input -> decode(g.apply(input));
    }
}
