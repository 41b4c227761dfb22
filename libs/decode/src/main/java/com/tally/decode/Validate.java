package com.tally.decode;

import com.tally.validation.Context;
import com.tally.validation.ContextEntry;
import com.tally.validation.Errors;
import com.tally.validation.Validation;
import com.tally.validation.Validations;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A context-aware decoder: validates an input at a position described by a {@link Context}.
 * <p>
 * The combinators mirror those of {@link Decode} and pass the same input and the same context
 * to every operand. {@link #at(String, String)} is how a validator for a nested field stamps
 * its position onto the errors it produces.
 *
 * @param <I> the raw input type
 * @param <A> the validated type
 */
@FunctionalInterface
public interface Validate<I, A> {

    Validation<A> validate(I input, Context context);

    // ---------------------------------------------------------------- constructors

    /** Always succeeds with {@code a}. */
    static <I, A> Validate<I, A> of(A a) {
        return (input, context) -> Validation.success(a);
    }

    /** Always fails with {@code errors}, ignoring the context. */
    static <I, A> Validate<I, A> left(Errors errors) {
        if (errors == null) {
            throw new IllegalArgumentException("errors must not be null");
        }
        return (input, context) -> Validation.failure(errors);
    }

    /** Fails with one error carrying the input as value and the current context as path. */
    static <I, A> Validate<I, A> failure(String message) {
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        return (input, context) -> Validations.failureWithMessage(input, message, context);
    }

    /** Ignores the context and runs {@code decode}. */
    static <I, A> Validate<I, A> fromDecode(Decode<I, A> decode) {
        if (decode == null) {
            throw new IllegalArgumentException("decode must not be null");
        }
        return (input, context) -> decode.decode(input);
    }

    /**
     * Applicative apply. Both operands run with the same input and context; errors accumulate,
     * those of {@code ff} first.
     */
    static <I, A, B> Validate<I, B> ap(Validate<I, ? extends Function<? super A, ? extends B>> ff,
                                       Validate<I, ? extends A> fa) {
        if (ff == null) {
            throw new IllegalArgumentException("ff must not be null");
        }
        if (fa == null) {
            throw new IllegalArgumentException("fa must not be null");
        }
        return (input, context) -> {
            Validation<? extends Function<? super A, ? extends B>> functionResult = ff.validate(input, context);
            Validation<? extends A> valueResult = fa.validate(input, context);
            return Validation.ap(functionResult, valueResult);
        };
    }

    // ---------------------------------------------------------------- combinators

    default <B> Validate<I, B> map(Function<? super A, ? extends B> f) {
        if (f == null) {
            throw new IllegalArgumentException("f must not be null");
        }
        return (input, context) -> validate(input, context).map(f);
    }

    /** Sequential composition; stops at the first failure. */
    default <B> Validate<I, B> chain(Function<? super A, ? extends Validate<I, B>> f) {
        if (f == null) {
            throw new IllegalArgumentException("f must not be null");
        }
        return (input, context) -> validate(input, context).chain(a -> f.apply(a).validate(input, context));
    }

    /** Error recovery with the same aggregation rule as {@link Decode#chainLeft}. */
    default Validate<I, A> chainLeft(Function<? super Errors, ? extends Validate<I, A>> f) {
        if (f == null) {
            throw new IllegalArgumentException("f must not be null");
        }
        return (input, context) -> validate(input, context).chainLeft(errors -> f.apply(errors).validate(input, context));
    }

    /** Alias for {@link #chainLeft}. */
    default Validate<I, A> orElse(Function<? super Errors, ? extends Validate<I, A>> f) {
        return chainLeft(f);
    }

    /** Fallback; {@code second} is called only when this validator fails. */
    default Validate<I, A> alt(Supplier<? extends Validate<I, A>> second) {
        if (second == null) {
            throw new IllegalArgumentException("second must not be null");
        }
        return chainLeft(ignored -> second.get());
    }

    /** Applies a validator transformer such as the stages of {@link ValidateDoNotation}. */
    default <B> Validate<I, B> pipe(Function<Validate<I, A>, Validate<I, B>> operator) {
        if (operator == null) {
            throw new IllegalArgumentException("operator must not be null");
        }
        return operator.apply(this);
    }

    /** Runs this validator one level deeper, at field {@code key} of type {@code type}. */
    default Validate<I, A> at(String key, String type) {
        return at(ContextEntry.of(key, type));
    }

    /** Runs this validator with {@code entry} pushed onto the context. */
    default Validate<I, A> at(ContextEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry must not be null");
        }
        return (input, context) -> validate(input, context.push(entry));
    }

    /**
     * Runs this validator at field {@code key} of a parent input, recording the field value as
     * the actual value of the new context entry.
     */
    default <P> Validate<P, A> field(String key, String type, Function<? super P, ? extends I> getter) {
        if (getter == null) {
            throw new IllegalArgumentException("getter must not be null");
        }
        return (parent, context) -> {
            I child = getter.apply(parent);
            return validate(child, context.push(new ContextEntry(key, type, child)));
        };
    }

    /** Fixes the context, producing a plain decoder. */
    default Decode<I, A> toDecode(Context context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        return input -> validate(input, context);
    }
}
