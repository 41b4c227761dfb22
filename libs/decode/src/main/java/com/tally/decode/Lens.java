package com.tally.decode;

import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * A getter/setter pair focusing on one field {@code T} of a structure {@code S}.
 * <p>
 * {@link #set} returns an updated copy and must leave its argument untouched.
 *
 * @param <S> the structure type
 * @param <T> the field type
 */
public interface Lens<S, T> {

    T get(S source);

    /** Returns a copy of {@code source} with the field replaced by {@code value}. */
    S set(T value, S source);

    /** Returns a copy of {@code source} with {@code f} applied to the field. */
    default S modify(UnaryOperator<T> f, S source) {
        return set(f.apply(get(source)), source);
    }

    /**
     * Creates a lens from a getter and a setter.
     *
     * @throws IllegalArgumentException if either argument is null
     */
    static <S, T> Lens<S, T> of(Function<? super S, ? extends T> getter, BiFunction<? super T, ? super S, ? extends S> setter) {
        if (getter == null) {
            throw new IllegalArgumentException("getter must not be null");
        }
        if (setter == null) {
            throw new IllegalArgumentException("setter must not be null");
        }
        return new Lens<>() {
            @Override
            public T get(S source) {
                return getter.apply(source);
            }

            @Override
            public S set(T value, S source) {
                return setter.apply(value, source);
            }
        };
    }
}
