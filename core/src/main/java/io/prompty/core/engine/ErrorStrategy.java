package io.prompty.core.engine;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * What the executor does when a tag fails to resolve or its expression fails to evaluate. Chosen
 * per tag with the {@code onerror} attribute, falling back to the context's strategy and then to
 * the engine default.
 *
 * <p>
 * Resource-limit, cancellation and circular-include errors are not subject to the strategy.
 */
public enum ErrorStrategy {
    /** Abort the execution and surface the error. */
    THROW("throw"),
    /** Emit the tag's {@code default} attribute, or nothing if it has none. */
    DEFAULT("default"),
    /** Emit nothing. */
    REMOVE("remove"),
    /** Emit the tag's original source text. */
    KEEP_RAW("keepraw"),
    /** Record the error on the logging sink and emit nothing. */
    LOG("log");

    private final String attributeValue;

    ErrorStrategy(String attributeValue) {
        this.attributeValue = attributeValue;
    }

    /** The value used for this strategy in {@code onerror} attributes and configuration. */
    public String attributeValue() {
        return attributeValue;
    }

    /** Parses an {@code onerror} value, case-insensitively. */
    public static Optional<ErrorStrategy> fromAttribute(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.attributeValue.equals(normalized))
                .findFirst();
    }
}
