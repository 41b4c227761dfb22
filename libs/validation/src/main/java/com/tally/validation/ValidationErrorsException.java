package com.tally.validation;

/**
 * Unchecked exception carrying the {@link Errors} of a failed {@link Validation}.
 * <p>
 * Thrown only when a caller explicitly asks for a value ({@link Validation#getOrThrow()});
 * the combinators themselves never throw for a decode failure. The cause is the cause of the
 * first error that has one.
 */
public class ValidationErrorsException extends RuntimeException {

    private final transient Errors errors;

    public ValidationErrorsException(Errors errors) {
        super(summary(errors), firstCause(errors));
        this.errors = errors;
    }

    /** The errors, in the order they were collected. */
    public Errors errors() {
        return errors;
    }

    /**
     * Multi-line rendering listing every error, e.g.
     * <pre>
     * ValidationErrors (2):
     *   [0] at user.name: must not be blank
     *   [1] at user.age: must be positive
     *   caused by: java.lang.NumberFormatException: For input string: "x"
     * </pre>
     * The last line appears only when the exception has a cause.
     */
    public String describe() {
        if (errors.isEmpty()) {
            return summary(errors);
        }
        var sb = new StringBuilder("ValidationErrors (").append(errors.size()).append("):\n");
        for (int i = 0; i < errors.size(); i++) {
            sb.append("  [").append(i).append("] ").append(errors.get(i).describe()).append('\n');
        }
        if (getCause() != null) {
            sb.append("  caused by: ").append(getCause()).append('\n');
        }
        return sb.toString();
    }

    private static String summary(Errors errors) {
        if (errors == null) {
            throw new IllegalArgumentException("errors must not be null");
        }
        return switch (errors.size()) {
            case 0 -> "ValidationErrors: no errors";
            case 1 -> "ValidationErrors: 1 error";
            default -> "ValidationErrors: %d errors".formatted(errors.size());
        };
    }

    private static Throwable firstCause(Errors errors) {
        for (ValidationError error : errors) {
            if (error.cause() != null) {
                return error.cause();
            }
        }
        return null;
    }
}
