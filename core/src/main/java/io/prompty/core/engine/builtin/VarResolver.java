package io.prompty.core.engine.builtin;

import io.prompty.core.engine.ExecutionContext;
import io.prompty.core.expr.Values;
import io.prompty.core.model.AttributeNames;
import io.prompty.core.model.Attributes;
import io.prompty.core.model.TagNames;
import io.prompty.core.spi.Resolver;
import java.util.Optional;

/**
 * {@code prompty.var}: emits the value at the {@code name} path as text.
 *
 * <p>
 * A missing value falls back to the {@code default} attribute only when the tag has no
 * {@code onerror} attribute; with one, the miss is reported so the chosen strategy applies.
 */
public final class VarResolver implements Resolver {

    @Override
    public String tagName() {
        return TagNames.VAR;
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
        Optional<Object> value = context.get(name);
        if (value.isPresent()) {
            return Values.toText(value.get());
        }
        if (attributes.has(AttributeNames.DEFAULT) && !attributes.has(AttributeNames.ON_ERROR)) {
            return attributes.getOrDefault(AttributeNames.DEFAULT, "");
        }
        throw new IllegalArgumentException(Suggestions.describeMissing("variable", name, context.keys()));
    }
}
