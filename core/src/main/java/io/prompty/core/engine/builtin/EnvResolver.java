package io.prompty.core.engine.builtin;

import io.prompty.core.engine.ExecutionContext;
import io.prompty.core.model.AttributeNames;
import io.prompty.core.model.Attributes;
import io.prompty.core.model.TagNames;
import io.prompty.core.spi.Resolver;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@code prompty.env}: emits an environment variable. Unset or empty variables yield the
 * {@code default} attribute, fail when {@code required="true"}, and are empty otherwise.
 */
public final class EnvResolver implements Resolver {

    private final Function<String, String> environment;

    public EnvResolver(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    @Override
    public String tagName() {
        return TagNames.ENV;
    }

    @Override
    public void validate(Attributes attributes) {
        if (attributes.get(AttributeNames.NAME).filter(n -> !n.isBlank()).isEmpty()) {
            throw new IllegalArgumentException("missing required attribute: " + AttributeNames.NAME);
        }
    }

    @Override
    public String resolve(ExecutionContext context, Attributes attributes) {
        String name = attributes.getOrDefault(AttributeNames.NAME, "");
        String value = environment.apply(name);
        if (value != null && !value.isEmpty()) {
            return value;
        }
        if (attributes.has(AttributeNames.DEFAULT)) {
            return attributes.getOrDefault(AttributeNames.DEFAULT, "");
        }
        if (AttributeNames.TRUE.equals(attributes.getOrDefault(AttributeNames.REQUIRED, ""))) {
            throw new IllegalArgumentException("required environment variable not set: " + name);
        }
        return "";
    }
}
