package com.tally.validation;

import com.tally.algebra.Monoid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Factory helpers for {@link Validation} values.
 */
public final class Validations {

    private Validations() {
        // utility class
    }

    /**
     * A single-error failure at {@code context}.
     *
     * @param value   the offending value (nullable)
     * @param message what went wrong
     * @param context where it went wrong
     */
    public static <T> Validation<T> failureWithMessage(Object value, String message, Context context) {
        return Validation.failure(new ValidationError(value, context, message, null));
    }

    /**
     * A single-error failure at {@code context} wrapping a lower-level cause.
     */
    public static <T> Validation<T> failureWithError(Object value, String message, Throwable cause, Context context) {
        return Validation.failure(new ValidationError(value, context, message, cause));
    }

    /**
     * Lifts a monoid on values into a monoid on validations. Two successes combine their values
     * with {@code m}; otherwise the errors of every failed side are concatenated, left first.
     */
    public static <A> Monoid<Validation<A>> applicativeMonoid(Monoid<A> m) {
        if (m == null) {
            throw new IllegalArgumentException("m must not be null");
        }
        return Monoid.ofLazy(
                (left, right) -> Validation.ap(left.map(a -> (Function<A, A>) b -> m.concat(a, b)), right),
                () -> Validation.success(m.empty()));
    }

    /**
     * Collects a list of validations into a validation of a list. Every element is inspected;
     * the errors of all failures are concatenated in list order.
     */
    public static <A> Validation<List<A>> sequence(List<Validation<A>> validations) {
        if (validations == null) {
            throw new IllegalArgumentException("validations must not be null");
        }
        List<A> values = new ArrayList<>(validations.size());
        Errors errors = Errors.empty();
        for (Validation<A> validation : validations) {
            if (validation instanceof Validation.Success<A> success) {
                values.add(success.value());
            } else {
                errors = errors.concat(((Validation.Failure<A>) validation).errors());
            }
        }
        if (errors.isEmpty() && values.size() == validations.size()) {
            return Validation.success(Collections.unmodifiableList(values));
        }
        return Validation.failure(errors);
    }
}
