package io.prompty.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, immutable mapping of attribute name to string value for a single tag. Iteration order
 * is source order.
 */
public final class Attributes {

    /** Shared empty instance. */
    public static final Attributes EMPTY = new Attributes(Map.of());

    private final Map<String, String> values;

    private Attributes(Map<String, String> values) {
        this.values = values;
    }

    /** Creates attributes preserving the iteration order of {@code values}. */
    public static Attributes of(Map<String, String> values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.isEmpty()) {
            return EMPTY;
        }
        return new Attributes(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /** Convenience factory for alternating name/value pairs. */
    public static Attributes of(String... pairs) {
        if (pairs.length % 2 != 0) {
            throw new IllegalArgumentException("pairs must have an even length, got: " + pairs.length);
        }
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return of(map);
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public String getOrDefault(String name, String fallback) {
        String value = values.get(name);
        return value != null ? value : fallback;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    /** Returns a copy of these attributes with {@code name} set to {@code value}. */
    public Attributes with(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        return new Attributes(Collections.unmodifiableMap(copy));
    }

    public List<String> names() {
        return List.copyOf(values.keySet());
    }

    public Map<String, String> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Attributes other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
