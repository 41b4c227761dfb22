package com.tally.algebra;

import java.util.function.BinaryOperator;
import java.util.function.Supplier;

/**
 * A {@link Semigroup} with an identity element.
 * <p>
 * Laws, for all {@code x}, {@code y}, {@code z}:
 * <ul>
 *   <li>left identity: {@code concat(empty(), x) == x}</li>
 *   <li>right identity: {@code concat(x, empty()) == x}</li>
 *   <li>associativity: {@code concat(concat(x, y), z) == concat(x, concat(y, z))}</li>
 * </ul>
 * Nothing enforces the laws at runtime.
 *
 * @param <A> the carrier type
 */
public interface Monoid<A> extends Semigroup<A> {

    /** The identity element. Called on demand, so it may build a fresh value each time. */
    A empty();

    /**
     * Creates a monoid from a combine function and a fixed identity value.
     *
     * @throws IllegalArgumentException if {@code concat} is null
     */
    static <A> Monoid<A> of(BinaryOperator<A> concat, A empty) {
        return ofLazy(concat, () -> empty);
    }

    /**
     * Creates a monoid whose identity is produced by a supplier.
     *
     * @throws IllegalArgumentException if either argument is null
     */
    static <A> Monoid<A> ofLazy(BinaryOperator<A> concat, Supplier<A> empty) {
        if (concat == null) {
            throw new IllegalArgumentException("concat must not be null");
        }
        if (empty == null) {
            throw new IllegalArgumentException("empty must not be null");
        }
        return new Monoid<>() {
            @Override
            public A concat(A left, A right) {
                return concat.apply(left, right);
            }

            @Override
            public A empty() {
                return empty.get();
            }
        };
    }

    /**
     * Returns the dual monoid, which combines its operands in reverse order.
     */
    default Monoid<A> reverse() {
        Monoid<A> self = this;
        return ofLazy((left, right) -> self.concat(right, left), self::empty);
    }
}
