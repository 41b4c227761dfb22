package com.tally.validation;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Settings that control how errors are rendered in reports and log lines.
 *
 * @param maxErrors      maximum number of errors listed in a report; the rest are counted only
 * @param includeValues  whether offending values are shown at all
 * @param sensitiveKeys  case-insensitive key fragments whose values are replaced by {@value #REDACTED}
 */
public record ReportSettings(int maxErrors, boolean includeValues, Set<String> sensitiveKeys) {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    /** Default maximum number of listed errors. */
    public static final int DEFAULT_MAX_ERRORS = 100;

    private static final Set<String> DEFAULT_SENSITIVE_KEYS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "credential"
    );

    /**
     * Compact constructor. Sensitive keys are stored lower-cased.
     *
     * @throws IllegalArgumentException if maxErrors is below 1, or sensitiveKeys is null or holds
     *                                  a null or blank entry
     */
    public ReportSettings {
        if (maxErrors < 1) {
            throw new IllegalArgumentException("maxErrors must be >= 1");
        }
        if (sensitiveKeys == null) {
            throw new IllegalArgumentException("sensitiveKeys must not be null");
        }
        for (String key : sensitiveKeys) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("sensitiveKeys must not contain null or blank entries");
            }
        }
        sensitiveKeys = sensitiveKeys.stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /** Defaults: 100 errors, values shown, common credential keys redacted. */
    public static ReportSettings defaults() {
        return new ReportSettings(DEFAULT_MAX_ERRORS, true, DEFAULT_SENSITIVE_KEYS);
    }

    public ReportSettings withMaxErrors(int maxErrors) {
        return new ReportSettings(maxErrors, includeValues, sensitiveKeys);
    }

    public ReportSettings withIncludeValues(boolean includeValues) {
        return new ReportSettings(maxErrors, includeValues, sensitiveKeys);
    }

    public ReportSettings withSensitiveKeys(Set<String> sensitiveKeys) {
        return new ReportSettings(maxErrors, includeValues, sensitiveKeys);
    }

    /**
     * Checks whether a key contains any sensitive fragment.
     */
    public boolean isSensitive(String key) {
        if (key == null || key.isEmpty()) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        for (String fragment : sensitiveKeys) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * The value of {@code error} as it may be displayed: null when values are hidden,
     * {@value #REDACTED} when any key on its path is sensitive, otherwise its string form.
     */
    public String displayValue(ValidationError error) {
        if (!includeValues) {
            return null;
        }
        for (ContextEntry entry : error.context().entries()) {
            if (isSensitive(entry.key())) {
                return REDACTED;
            }
        }
        return String.valueOf(error.value());
    }
}
