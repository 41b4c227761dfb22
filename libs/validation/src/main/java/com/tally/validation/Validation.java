package com.tally.validation;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Outcome of a decode attempt: either a {@link Success} holding the value or a {@link Failure}
 * holding every {@link ValidationError} that was collected.
 * <p>
 * Sequential operations ({@link #chain}) stop at the first failure. {@link #ap} evaluates both
 * sides and accumulates their errors. {@link #chainLeft} and {@link #alt} recover from a failure
 * and keep the original errors when the recovery fails as well.
 *
 * @param <A> the success type
 */
public sealed interface Validation<A> permits Validation.Success, Validation.Failure {

    /** A successful validation. The value may be null. */
    record Success<A>(A value) implements Validation<A> {

        @Override
        public <R> R fold(Function<? super Errors, ? extends R> onFailure,
                          Function<? super A, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /** A failed validation. Errors are never null. */
    record Failure<A>(Errors errors) implements Validation<A> {

        /**
         * @throws IllegalArgumentException if errors is null
         */
        public Failure {
            if (errors == null) {
                throw new IllegalArgumentException("errors must not be null");
            }
        }

        @Override
        public <R> R fold(Function<? super Errors, ? extends R> onFailure,
                          Function<? super A, ? extends R> onSuccess) {
            return onFailure.apply(errors);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }

    // ---------------------------------------------------------------- factories

    static <A> Validation<A> success(A value) {
        return new Success<>(value);
    }

    static <A> Validation<A> failure(Errors errors) {
        return new Failure<>(errors);
    }

    static <A> Validation<A> failure(ValidationError error) {
        return new Failure<>(Errors.of(error));
    }

    /**
     * Applicative apply. Both arguments are already evaluated; when both failed, the errors of
     * {@code ff} come first.
     */
    static <A, B> Validation<B> ap(Validation<? extends Function<? super A, ? extends B>> ff,
                                   Validation<? extends A> fa) {
        return ff.<Validation<B>>fold(
                left -> fa.<Validation<B>>fold(
                        right -> failure(Errors.concat(left, right)),
                        a -> failure(left)),
                f -> fa.<Validation<B>>fold(
                        Validation::failure,
                        a -> success(f.apply(a))));
    }

    // ---------------------------------------------------------------- elimination

    /**
     * Collapses this validation by applying the function matching its variant.
     */
    <R> R fold(Function<? super Errors, ? extends R> onFailure, Function<? super A, ? extends R> onSuccess);

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /** The success value, or empty on failure or when the success value is null. */
    default Optional<A> valueIfPresent() {
        return this.<Optional<A>>fold(errors -> Optional.empty(), Optional::ofNullable);
    }

    /** The errors, or empty on success. */
    default Optional<Errors> errorsIfPresent() {
        return this.<Optional<Errors>>fold(Optional::of, value -> Optional.empty());
    }

    /** The success value, or {@code fallback} on failure. */
    default A getOrElse(A fallback) {
        return fold(errors -> fallback, Function.identity());
    }

    /**
     * The success value.
     *
     * @throws ValidationErrorsException carrying all errors if this is a failure
     */
    default A getOrThrow() {
        if (this instanceof Failure<A> failure) {
            throw new ValidationErrorsException(failure.errors());
        }
        return ((Success<A>) this).value();
    }

    /** The failure as an exception, or empty on success. */
    default Optional<ValidationErrorsException> toException() {
        return this.<Optional<ValidationErrorsException>>fold(
                errors -> Optional.of(new ValidationErrorsException(errors)),
                value -> Optional.empty());
    }

    // ---------------------------------------------------------------- combinators

    /** Transforms the success value; {@code f} is not called on failure. */
    default <B> Validation<B> map(Function<? super A, ? extends B> f) {
        return this.<Validation<B>>fold(Validation::failure, value -> success(f.apply(value)));
    }

    /** Transforms the errors of a failure; a success is returned unchanged. */
    default Validation<A> mapErrors(UnaryOperator<Errors> f) {
        return this.<Validation<A>>fold(errors -> failure(f.apply(errors)), value -> this);
    }

    /** Monadic bind. Stops at the first failure; {@code f} is not called on failure. */
    default <B> Validation<B> chain(Function<? super A, Validation<B>> f) {
        return this.<Validation<B>>fold(Validation::failure, f);
    }

    /**
     * Recovers from a failure. When {@code f} fails too, the result holds the original errors
     * followed by the new ones. A success is returned unchanged and {@code f} is not called.
     */
    default Validation<A> chainLeft(Function<? super Errors, Validation<A>> f) {
        return this.<Validation<A>>fold(
                errors -> f.apply(errors).<Validation<A>>fold(
                        more -> failure(Errors.concat(errors, more)),
                        Validation::success),
                value -> this);
    }

    /** Alias for {@link #chainLeft}. */
    default Validation<A> orElse(Function<? super Errors, Validation<A>> f) {
        return chainLeft(f);
    }

    /**
     * Returns this validation if it succeeded, otherwise the alternative. The supplier is
     * called only on failure. When both fail the errors are concatenated in attempt order.
     */
    default Validation<A> alt(Supplier<Validation<A>> second) {
        return chainLeft(errors -> second.get());
    }
}
