package io.prompty.core.engine;

import io.prompty.core.expr.Bindings;
import io.prompty.core.expr.Values;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Hierarchical data scope a template executes against.
 *
 * <p>
 * Paths are dotted ({@code user.address.city}); segments walk into maps by key and into lists by
 * numeric index. A child context created with {@link #child} falls through to its parent when the
 * first path segment is not bound locally; one created with {@link #isolatedChild} sees only its
 * own data. A value bound to {@code null} is treated as absent.
 *
 * <p>
 * Not thread-safe. Use one context per concurrent execution.
 */
public final class ExecutionContext implements Bindings {

    private final Map<String, Object> data;
    private final ExecutionContext parent;
    private final ErrorStrategy errorStrategy;
    private final ExecutionSession session;

    private ExecutionContext(
            Map<String, Object> data, ExecutionContext parent, ErrorStrategy errorStrategy, ExecutionSession session) {
        this.data = data;
        this.parent = parent;
        this.errorStrategy = errorStrategy;
        this.session = session;
    }

    /** Creates a root context over a copy of {@code data}, using the engine's default strategy. */
    public static ExecutionContext of(Map<String, ?> data) {
        return new ExecutionContext(copy(data), null, null, null);
    }

    /** Creates a root context with an explicit error strategy. */
    public static ExecutionContext of(Map<String, ?> data, ErrorStrategy errorStrategy) {
        Objects.requireNonNull(errorStrategy, "errorStrategy must not be null");
        return new ExecutionContext(copy(data), null, errorStrategy, null);
    }

    public static ExecutionContext empty() {
        return of(Map.of());
    }

    /** Looks up a dotted path; absent and {@code null} values yield empty. */
    public Optional<Object> get(String path) {
        Objects.requireNonNull(path, "path must not be null");
        String[] segments = path.split("\\.", -1);
        if (data.containsKey(segments[0])) {
            return walk(data.get(segments[0]), segments);
        }
        return parent != null ? parent.get(path) : Optional.empty();
    }

    @Override
    public Optional<Object> lookup(String path) {
        return get(path);
    }

    public Object getOrDefault(String path, Object fallback) {
        return get(path).orElse(fallback);
    }

    /** Looks up a path and renders the value as text. */
    public Optional<String> getString(String path) {
        return get(path).map(Values::toText);
    }

    public boolean has(String path) {
        return get(path).isPresent();
    }

    /** Binds a single top-level key in this scope. Parent scopes are never modified. */
    public void set(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        data.put(key, value);
    }

    /** Unmodifiable copy of all visible top-level data; local keys shadow inherited ones. */
    public Map<String, Object> snapshot() {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (parent != null) {
            merged.putAll(parent.snapshot());
        }
        merged.putAll(data);
        return Collections.unmodifiableMap(merged);
    }

    /** Sorted names of all visible top-level keys. */
    public List<String> keys() {
        TreeSet<String> keys = new TreeSet<>(data.keySet());
        if (parent != null) {
            keys.addAll(parent.keys());
        }
        return new ArrayList<>(keys);
    }

    /** Creates a child whose lookups fall through to this context. */
    public ExecutionContext child(Map<String, ?> childData) {
        return new ExecutionContext(copy(childData), this, errorStrategy, session);
    }

    /** Creates a child that sees only {@code childData}. The error strategy is still inherited. */
    public ExecutionContext isolatedChild(Map<String, ?> childData) {
        return new ExecutionContext(copy(childData), null, errorStrategy, session);
    }

    /** Returns a view of the same data with a different error strategy. */
    public ExecutionContext withErrorStrategy(ErrorStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy must not be null");
        return new ExecutionContext(data, parent, strategy, session);
    }

    /** The strategy chosen for this scope, or empty to use the engine default. */
    public Optional<ErrorStrategy> errorStrategy() {
        return Optional.ofNullable(errorStrategy);
    }

    public Optional<ExecutionContext> parent() {
        return Optional.ofNullable(parent);
    }

    /** The cancellation token of the running execution, or {@link CancellationToken#none()}. */
    public CancellationToken cancellationToken() {
        return session != null ? session.cancellationToken() : CancellationToken.none();
    }

    ExecutionSession session() {
        return session;
    }

    ExecutionContext bind(ExecutionSession executionSession) {
        ExecutionContext boundParent = parent != null ? parent.bind(executionSession) : null;
        return new ExecutionContext(data, boundParent, errorStrategy, executionSession);
    }

    private static Optional<Object> walk(Object root, String[] segments) {
        Object current = root;
        for (int i = 1; i < segments.length && current != null; i++) {
            current = step(current, segments[i]);
        }
        return Optional.ofNullable(current);
    }

    private static Object step(Object current, String segment) {
        if (current instanceof Map<?, ?> map) {
            return map.get(segment);
        }
        if (current instanceof List<?> list && isIndex(segment)) {
            int index = Integer.parseInt(segment);
            return index < list.size() ? list.get(index) : null;
        }
        return null;
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, Object> copy(Map<String, ?> source) {
        Objects.requireNonNull(source, "data must not be null");
        return new LinkedHashMap<>(source);
    }
}
