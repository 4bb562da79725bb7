package io.prompty.core.engine;

import io.prompty.core.spi.Resolver;
import java.util.Objects;

/** Tag name to {@link Resolver} bindings consulted by the executor. */
public final class ResolverRegistry extends NamedRegistry<Resolver> {

    ResolverRegistry() {
        super("resolver");
    }

    /**
     * @throws io.prompty.core.error.RegistrationException if the tag name is taken or reserved
     */
    public void register(Resolver resolver) {
        Objects.requireNonNull(resolver, "resolver must not be null");
        add(resolver.tagName(), resolver);
    }

    /** Like {@link #register} but reports a collision by returning {@code false}. */
    public boolean tryRegister(Resolver resolver) {
        Objects.requireNonNull(resolver, "resolver must not be null");
        return tryAdd(resolver.tagName(), resolver);
    }

    public boolean unregister(String tagName) {
        return remove(tagName);
    }

    void registerBuiltin(Resolver resolver) {
        addBuiltin(resolver.tagName(), resolver);
    }
}
