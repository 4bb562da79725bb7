package io.prompty.core.spi;

import io.prompty.core.engine.ExecutionContext;
import io.prompty.core.model.Attributes;

/**
 * Plug-in handler for one tag name. The executor looks resolvers up by tag name when it reaches a
 * tag, so they may be registered after a template has been parsed.
 *
 * <p>
 * Both methods signal failure by throwing. The executor wraps the failure in a
 * {@link io.prompty.core.error.ResolverException} carrying the tag position and routes it
 * through the active error strategy.
 *
 * <p>
 * Implementations must be thread-safe: one instance serves every concurrent execution.
 */
public interface Resolver {

    /** The tag name this resolver handles. */
    String tagName();

    /**
     * Checks the attributes before {@link #resolve} is called. Also used by template validation,
     * where no context is available. The default accepts everything.
     */
    default void validate(Attributes attributes) {}

    /**
     * Produces the output text for one tag occurrence. For block tags the rendered body is passed
     * in the {@link io.prompty.core.model.AttributeNames#CONTENT} attribute.
     *
     * @return the text to emit; {@code null} is treated as empty
     */
    String resolve(ExecutionContext context, Attributes attributes);
}
