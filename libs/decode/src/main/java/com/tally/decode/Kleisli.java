package com.tally.decode;

/**
 * A function from a plain value to a decoder: the unit of sequential composition used by
 * {@link Decode#chain} and {@link Decode#chainLeft}.
 *
 * @param <I> input type of the produced decoder
 * @param <A> argument type
 * @param <B> result type of the produced decoder
 */
@FunctionalInterface
public interface Kleisli<I, A, B> {

    Decode<I, B> apply(A a);
}
