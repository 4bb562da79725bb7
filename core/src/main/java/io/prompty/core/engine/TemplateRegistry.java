package io.prompty.core.engine;

/** Named templates available to {@code prompty.include}. */
public final class TemplateRegistry extends NamedRegistry<Template> {

    TemplateRegistry() {
        super("template");
    }

    void register(String name, Template template) {
        add(name, template);
    }

    boolean tryRegister(String name, Template template) {
        return tryAdd(name, template);
    }

    boolean unregister(String name) {
        return remove(name);
    }
}
