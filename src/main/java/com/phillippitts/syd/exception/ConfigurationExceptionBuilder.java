package com.phillippitts.syd.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ConfigurationException} with structured detail.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw ConfigurationExceptionBuilder.create("Override length does not match star count")
 *         .parameter("numax")
 *         .expected(3)
 *         .actual(2)
 *         .build();
 *
 * throw ConfigurationExceptionBuilder.create("Cannot read star catalog")
 *         .cause(ioException)
 *         .detail("path", path)
 *         .build();
 * </pre>
 */
public final class ConfigurationExceptionBuilder {

    private final String message;
    private String parameter;
    private Throwable cause;
    private Object expected;
    private Object actual;
    private final Map<String, String> details = new LinkedHashMap<>();

    private ConfigurationExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ConfigurationExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ConfigurationExceptionBuilder(message);
    }

    public ConfigurationExceptionBuilder parameter(String parameter) {
        this.parameter = parameter;
        return this;
    }

    public ConfigurationExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ConfigurationExceptionBuilder expected(Object expected) {
        this.expected = expected;
        return this;
    }

    public ConfigurationExceptionBuilder actual(Object actual) {
        this.actual = actual;
        return this;
    }

    /**
     * Adds a key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key detail key
     * @param value detail value
     * @return this builder for chaining
     */
    public ConfigurationExceptionBuilder detail(String key, Object value) {
        if (key != null && value != null) {
            this.details.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} [expected={e}, actual={a}, {key1}={val1}, ...] (parameter: {name})
     * </pre>
     *
     * @return constructed ConfigurationException
     */
    public ConfigurationException build() {
        String detailed = buildDetailedMessage();
        if (parameter == null) {
            return cause == null ? new ConfigurationException(detailed)
                    : new ConfigurationException(detailed, cause);
        }
        return cause == null ? new ConfigurationException(detailed, parameter)
                : new ConfigurationException(detailed, parameter, cause);
    }

    private String buildDetailedMessage() {
        Map<String, String> all = new LinkedHashMap<>();
        if (expected != null) {
            all.put("expected", String.valueOf(expected));
        }
        if (actual != null) {
            all.put("actual", String.valueOf(actual));
        }
        all.putAll(details);
        if (all.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" [");
        boolean first = true;
        for (Map.Entry<String, String> entry : all.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(']').toString();
    }
}
