package io.prompty.core.error;

import io.prompty.core.model.Position;
import java.util.List;

/** Thrown when an include would re-enter a template already on the include chain. Always fatal. */
public final class CircularIncludeException extends TemplateExecutionException {

    private static final long serialVersionUID = 1L;

    private final transient List<String> chain;

    public CircularIncludeException(List<String> chain, Position position, String tagName) {
        super("circular include: " + String.join(" -> ", chain), position, tagName);
        this.chain = List.copyOf(chain);
    }

    /** Template names from the outermost include to the repeated one. */
    public List<String> chain() {
        return chain;
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
