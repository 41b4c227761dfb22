package com.tally.validation;

import java.util.Optional;

/**
 * A single decode failure.
 * <p>
 * Created at the point where a failure is detected and never modified afterwards.
 *
 * @param value   the offending input value (nullable)
 * @param context path from the root to the offending value; never null
 * @param message human-readable description; never null
 * @param cause   lower-level error that triggered this failure (nullable)
 */
public record ValidationError(Object value, Context context, String message, Throwable cause) {

    /**
     * Compact constructor. A missing context becomes {@link Context#root()}.
     *
     * @throws IllegalArgumentException if message is null
     */
    public ValidationError {
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        context = context == null ? Context.root() : context;
    }

    /** Creates an error with no context and no cause. */
    public static ValidationError of(Object value, String message) {
        return new ValidationError(value, Context.root(), message, null);
    }

    /** Creates an error at the given context with no cause. */
    public static ValidationError of(Object value, Context context, String message) {
        return new ValidationError(value, context, message, null);
    }

    /** The rendered path of {@link #context()}, empty at the root. */
    public String path() {
        return context.path();
    }

    /** The cause as an {@link Optional}. */
    public Optional<Throwable> causeIfPresent() {
        return Optional.ofNullable(cause);
    }

    /**
     * Single-line rendering: {@code "at <path>: <message>"} plus
     * {@code " (caused by: <cause>)"} when a cause is present. A cause without a message is
     * shown by its {@code toString()}.
     */
    public String describe() {
        var sb = new StringBuilder();
        String path = path();
        if (!path.isEmpty()) {
            sb.append("at ").append(path).append(": ");
        }
        sb.append(message);
        if (cause != null) {
            sb.append(" (caused by: ").append(causeText()).append(')');
        }
        return sb.toString();
    }

    /**
     * Multi-line rendering that also shows the offending value.
     */
    public String detailed() {
        var sb = new StringBuilder();
        String path = path();
        if (!path.isEmpty()) {
            sb.append("at ").append(path).append(": ");
        }
        sb.append(message);
        if (cause != null) {
            sb.append("\n  caused by: ").append(cause);
        }
        sb.append("\n  value: ").append(value);
        return sb.toString();
    }

    private String causeText() {
        String text = cause.getMessage();
        return text == null ? cause.toString() : text;
    }

    @Override
    public String toString() {
        return "ValidationError: " + describe();
    }
}
