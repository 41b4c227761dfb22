package com.tally.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Optional;

/**
 * JSON serialization and deserialization for {@link ValidationReport}.
 * <p>
 * Null fields ({@code value}, {@code cause}) are omitted from the output. Unknown properties
 * are ignored on read so that reports written by newer versions still load.
 */
public final class ValidationReportSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private ValidationReportSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Serializes a report to a JSON string.
     *
     * @throws ReportSerializationException if serialization fails
     */
    public static String serialize(ValidationReport report) {
        try {
            return MAPPER.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new ReportSerializationException("Failed to serialize validation report", e);
        }
    }

    /**
     * Builds a report for {@code validation} and serializes it.
     */
    public static String serialize(Validation<?> validation, ReportSettings settings) {
        return serialize(ValidationReport.of(validation, settings));
    }

    /**
     * Deserializes a JSON string to a report.
     *
     * @throws ReportSerializationException if the JSON is malformed
     */
    public static ValidationReport deserialize(String json) {
        try {
            return MAPPER.readValue(json, ValidationReport.class);
        } catch (JsonProcessingException e) {
            throw new ReportSerializationException("Failed to deserialize validation report", e);
        }
    }

    /**
     * Safely deserializes, returning empty on failure.
     */
    public static Optional<ValidationReport> tryDeserialize(String json) {
        try {
            return Optional.of(deserialize(json));
        } catch (ReportSerializationException e) {
            return Optional.empty();
        }
    }

    /**
     * Exception thrown when report serialization/deserialization fails.
     */
    public static class ReportSerializationException extends RuntimeException {
        public ReportSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
