package com.tally.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Writes validation failures to SLF4J at DEBUG level.
 * <p>
 * One summary line is logged per failure, followed by one line per listed error. While each
 * error line is written, {@value #MDC_PATH} and {@value #MDC_DECODER} are set in the MDC and
 * removed afterwards. Offending values pass through {@link ReportSettings#displayValue} so
 * sensitive fields are redacted.
 */
public final class ValidationErrorLogger {

    /** MDC key for the context path of the error being logged. */
    public static final String MDC_PATH = "validation.path";

    /** MDC key for the name of the decoder that failed. */
    public static final String MDC_DECODER = "validation.decoder";

    private final Logger log;
    private final ReportSettings settings;

    /**
     * Creates a logger writing to this class's SLF4J logger with default settings.
     */
    public ValidationErrorLogger() {
        this(LoggerFactory.getLogger(ValidationErrorLogger.class), ReportSettings.defaults());
    }

    /**
     * @param log      the SLF4J logger to write to
     * @param settings rendering and redaction settings
     */
    public ValidationErrorLogger(Logger log, ReportSettings settings) {
        if (log == null) {
            throw new IllegalArgumentException("log must not be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.log = log;
        this.settings = settings;
    }

    /**
     * Logs the errors of a failed decode attempt. Does nothing when DEBUG is disabled.
     *
     * @param decoderName name identifying the decoder in the log output
     * @param errors      the collected errors
     */
    public void logFailure(String decoderName, Errors errors) {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug("Decoder '{}' failed with {} error(s)", decoderName, errors.size());

        int listed = Math.min(errors.size(), settings.maxErrors());
        for (int i = 0; i < listed; i++) {
            ValidationError error = errors.get(i);
            MDC.put(MDC_DECODER, decoderName);
            MDC.put(MDC_PATH, error.path());
            try {
                log.debug("  [{}] {} (value: {})", i, error.describe(), settings.displayValue(error));
            } finally {
                MDC.remove(MDC_PATH);
                MDC.remove(MDC_DECODER);
            }
        }
        if (listed < errors.size()) {
            log.debug("  ... {} more error(s) not shown", errors.size() - listed);
        }
    }

    /** Logs the errors if {@code validation} failed; successes are not logged. */
    public <A> Validation<A> logIfFailed(String decoderName, Validation<A> validation) {
        validation.errorsIfPresent().ifPresent(errors -> logFailure(decoderName, errors));
        return validation;
    }

    public ReportSettings settings() {
        return settings;
    }
}
