package com.tally.decode;

import com.tally.validation.Context;
import com.tally.validation.ContextEntry;
import com.tally.validation.Validation;

import java.util.function.Supplier;

/**
 * A named, bidirectional type: validates raw input {@code I} into {@code A} and encodes
 * {@code A} back to an output {@code O}.
 *
 * @param <A> the decoded type
 * @param <O> the encoded output type
 * @param <I> the raw input type
 */
public interface Codec<A, O, I> {

    /** Name of the decoded type, used as the root label of error paths. */
    String name();

    Validation<A> validate(I input, Context context);

    O encode(A value);

    /**
     * Validates from a root context holding one unnamed entry of type {@link #name()}.
     */
    default Validation<A> decode(I input) {
        return validate(input, Context.of(new ContextEntry("", name(), input)));
    }

    /** This codec's {@link #decode} as a {@link Decode}. */
    default Decode<I, A> asDecode() {
        return this::decode;
    }

    /** This codec's {@link #validate} as a {@link Validate}. */
    default Validate<I, A> asValidate() {
        return this::validate;
    }

    /** See {@link Codecs#alt(Codec, Supplier)}. */
    default Codec<A, O, I> alt(Supplier<? extends Codec<A, O, I>> second) {
        return Codecs.alt(this, second);
    }

    /** See {@link Codecs#pipe(Codec, Codec)}. */
    default <B> Codec<B, O, I> pipe(Codec<B, A, A> next) {
        return Codecs.pipe(this, next);
    }
}
