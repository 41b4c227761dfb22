package com.tally.decode;

import java.util.function.Function;

/**
 * A decoder transformer. Operators are what {@link Decoders} and {@link DoNotation} return
 * for use with {@link Decode#pipe(Operator)}.
 *
 * @param <I> input type
 * @param <A> result type of the decoder consumed
 * @param <B> result type of the decoder produced
 */
@FunctionalInterface
public interface Operator<I, A, B> extends Function<Decode<I, A>, Decode<I, B>> {

    /** Runs this operator, then {@code next}. */
    default <C> Operator<I, A, C> then(Operator<I, B, C> next) {
        return decode -> next.apply(apply(decode));
    }
}
