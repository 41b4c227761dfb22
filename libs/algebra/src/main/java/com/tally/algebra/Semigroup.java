package com.tally.algebra;

/**
 * An associative binary operation on values of type {@code A}.
 * <p>
 * Implementations must satisfy {@code concat(concat(a, b), c) == concat(a, concat(b, c))}.
 *
 * @param <A> the carrier type
 */
@FunctionalInterface
public interface Semigroup<A> {

    /**
     * Combines two values. The left operand comes first in any ordered result.
     */
    A concat(A left, A right);
}
