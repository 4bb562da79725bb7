package io.prompty.core.engine;

import io.prompty.core.expr.FunctionTable;
import io.prompty.core.spi.TemplateFunction;
import java.util.Objects;
import java.util.Optional;

/** Functions callable from expressions. The built-in library is registered on creation. */
public final class FunctionRegistry extends NamedRegistry<TemplateFunction> implements FunctionTable {

    FunctionRegistry() {
        super("function");
    }

    /**
     * @throws io.prompty.core.error.RegistrationException if the name is taken (including by a
     *     built-in) or reserved
     */
    public void register(TemplateFunction function) {
        Objects.requireNonNull(function, "function must not be null");
        add(function.name(), function);
    }

    public boolean tryRegister(TemplateFunction function) {
        Objects.requireNonNull(function, "function must not be null");
        return tryAdd(function.name(), function);
    }

    public boolean unregister(String name) {
        return remove(name);
    }

    @Override
    public Optional<TemplateFunction> lookup(String name) {
        return get(name);
    }

    void registerBuiltin(TemplateFunction function) {
        addBuiltin(function.name(), function);
    }
}
