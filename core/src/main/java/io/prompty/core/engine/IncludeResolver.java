package io.prompty.core.engine;

import io.prompty.core.model.AttributeNames;
import io.prompty.core.model.Attributes;
import io.prompty.core.model.TagNames;
import io.prompty.core.spi.Resolver;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * {@code prompty.include}: renders a registered template in a child scope.
 *
 * <p>
 * {@code with} selects a value as the child's data (a map becomes the root, anything else is
 * bound as {@code value}); {@code isolate="true"} hides the caller's data; every other attribute is
 * bound as a string. Depth and cycle checks run before the included template is entered.
 */
final class IncludeResolver implements Resolver {

    private static final Set<String> CONTROL_ATTRIBUTES = Set.of(
            AttributeNames.TEMPLATE,
            AttributeNames.WITH,
            AttributeNames.ISOLATE,
            AttributeNames.ON_ERROR,
            AttributeNames.DEFAULT,
            AttributeNames.CONTENT);

    @Override
    public String tagName() {
        return TagNames.INCLUDE;
    }

    @Override
    public void validate(Attributes attributes) {
        if (attributes.get(AttributeNames.TEMPLATE).filter(t -> !t.isBlank()).isEmpty()) {
            throw new IllegalArgumentException("missing required attribute: " + AttributeNames.TEMPLATE);
        }
    }

    @Override
    public String resolve(ExecutionContext context, Attributes attributes) {
        ExecutionSession session = context.session();
        if (session == null) {
            throw new IllegalStateException(TagNames.INCLUDE + " can only run inside a template execution");
        }
        String name = attributes.getOrDefault(AttributeNames.TEMPLATE, "");
        Template template = session.engine()
                .templates()
                .get(name)
                .orElseThrow(() -> new IllegalArgumentException("template not found: " + name));

        Map<String, Object> data = new LinkedHashMap<>();
        attributes.get(AttributeNames.WITH).flatMap(context::get).ifPresent(selected -> {
            if (selected instanceof Map<?, ?> map) {
                map.forEach((k, v) -> data.put(String.valueOf(k), v));
            } else {
                data.put(AttributeNames.VALUE, selected);
            }
        });
        attributes.asMap().forEach((key, value) -> {
            if (!CONTROL_ATTRIBUTES.contains(key)) {
                data.put(key, value);
            }
        });
        boolean isolate = AttributeNames.TRUE.equals(attributes.getOrDefault(AttributeNames.ISOLATE, ""));
        ExecutionContext child = isolate ? context.isolatedChild(data) : context.child(data);

        session.enterInclude(name, session.currentPosition(), TagNames.INCLUDE);
        try {
            return session.renderIncluded(template, child);
        } finally {
            session.exitInclude();
        }
    }
}
