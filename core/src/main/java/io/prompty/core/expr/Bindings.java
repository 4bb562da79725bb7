package io.prompty.core.expr;

import java.util.Optional;

/** Source of variable values for expression evaluation. */
@FunctionalInterface
public interface Bindings {

    /** Looks up a dotted path. Paths that are absent or bound to {@code null} yield empty. */
    Optional<Object> lookup(String path);
}
