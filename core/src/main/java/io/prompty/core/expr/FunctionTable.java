package io.prompty.core.expr;

import io.prompty.core.spi.TemplateFunction;
import java.util.Optional;

/** The set of functions an expression may call. Nothing outside it is reachable. */
@FunctionalInterface
public interface FunctionTable {

    Optional<TemplateFunction> lookup(String name);
}
