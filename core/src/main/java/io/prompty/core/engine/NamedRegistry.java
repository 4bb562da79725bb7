package io.prompty.core.engine;

import io.prompty.core.error.RegistrationException;
import io.prompty.core.model.TagNames;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name-keyed store with first-registration-wins semantics, shared by the resolver, function and
 * template registries. Thread-safe; listings are snapshots.
 */
abstract class NamedRegistry<T> {

    private static final Logger LOG = LoggerFactory.getLogger(NamedRegistry.class);

    private final Map<String, T> entries = new ConcurrentHashMap<>();
    private final Set<String> builtins = ConcurrentHashMap.newKeySet();
    private final String kind;

    NamedRegistry(String kind) {
        this.kind = kind;
    }

    /**
     * Registers {@code entry} under {@code name}.
     *
     * @throws RegistrationException if the name is blank, reserved, or already taken
     */
    final void add(String name, T entry) {
        checkName(name);
        if (TagNames.isReserved(name)) {
            throw new RegistrationException(
                    kind + " name uses the reserved prefix '" + TagNames.RESERVED_PREFIX + "': " + name, name);
        }
        if (entries.putIfAbsent(name, entry) != null) {
            throw new RegistrationException(kind + " already registered: " + name, name);
        }
        LOG.info("Registered {}: name={}", kind, name);
    }

    /** Registers a built-in, bypassing the reserved-prefix check. */
    final void addBuiltin(String name, T entry) {
        checkName(name);
        if (entries.putIfAbsent(name, entry) != null) {
            throw new RegistrationException(kind + " already registered: " + name, name);
        }
        builtins.add(name);
    }

    final boolean tryAdd(String name, T entry) {
        checkName(name);
        if (TagNames.isReserved(name)) {
            return false;
        }
        boolean added = entries.putIfAbsent(name, entry) == null;
        if (added) {
            LOG.info("Registered {}: name={}", kind, name);
        }
        return added;
    }

    /**
     * Removes a registration. Built-ins cannot be removed.
     *
     * @return {@code true} if something was removed
     */
    final boolean remove(String name) {
        if (name == null || builtins.contains(name)) {
            return false;
        }
        boolean removed = entries.remove(name) != null;
        if (removed) {
            LOG.info("Unregistered {}: name={}", kind, name);
        }
        return removed;
    }

    public final Optional<T> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(entries.get(name));
    }

    public final boolean has(String name) {
        return name != null && entries.containsKey(name);
    }

    /** Sorted snapshot of registered names. */
    public final List<String> names() {
        return List.copyOf(new TreeSet<>(entries.keySet()));
    }

    public final int size() {
        return entries.size();
    }

    public final boolean isBuiltin(String name) {
        return builtins.contains(name);
    }

    private void checkName(String name) {
        if (name == null || name.isBlank()) {
            throw new RegistrationException(kind + " name must not be null or blank", name);
        }
    }
}
