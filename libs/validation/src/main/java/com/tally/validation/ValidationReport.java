package com.tally.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializable summary of a {@link Validation} outcome for display or transport.
 *
 * @param valid      true if the validation succeeded
 * @param errorCount total number of errors, including those left out of {@code errors}
 * @param truncated  true if {@code errors} lists fewer entries than {@code errorCount}
 * @param errors     the listed errors, in collection order
 */
public record ValidationReport(boolean valid, int errorCount, boolean truncated, List<Entry> errors) {

    /**
     * One rendered error.
     *
     * @param path    dot-separated context path (empty at the root)
     * @param message the error message
     * @param value   the displayable offending value (nullable, possibly redacted)
     * @param cause   message of the underlying cause (nullable)
     */
    public record Entry(String path, String message, String value, String cause) {}

    /**
     * Compact constructor. A null error list becomes empty.
     */
    public ValidationReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /** A report for a successful validation. */
    public static ValidationReport ok() {
        return new ValidationReport(true, 0, false, List.of());
    }

    /**
     * Builds a report for the given validation.
     */
    public static ValidationReport of(Validation<?> validation, ReportSettings settings) {
        return validation.<ValidationReport>fold(errors -> of(errors, settings), value -> ok());
    }

    /**
     * Builds a failure report from {@code errors}, listing at most {@code settings.maxErrors()}.
     */
    public static ValidationReport of(Errors errors, ReportSettings settings) {
        if (errors == null) {
            throw new IllegalArgumentException("errors must not be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        int listed = Math.min(errors.size(), settings.maxErrors());
        List<Entry> entries = new ArrayList<>(listed);
        for (int i = 0; i < listed; i++) {
            ValidationError error = errors.get(i);
            entries.add(new Entry(
                    error.path(),
                    error.message(),
                    settings.displayValue(error),
                    error.cause() == null ? null : error.cause().getMessage()));
        }
        return new ValidationReport(false, errors.size(), listed < errors.size(), entries);
    }

    /** Renders each listed error as {@code "<path>: <message>"}, or the bare message at the root. */
    public List<String> lines() {
        return errors.stream()
                .map(e -> e.path().isEmpty() ? e.message() : e.path() + ": " + e.message())
                .toList();
    }
}
