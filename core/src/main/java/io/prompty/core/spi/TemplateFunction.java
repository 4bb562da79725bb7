package io.prompty.core.spi;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A pure function callable from {@code eval} expressions. Functions are the only way an
 * expression can reach host code, so implementations must not perform I/O or have side effects.
 *
 * <p>
 * The evaluator checks arity before calling {@link #apply}. Failures are signalled by throwing;
 * the evaluator reports them as {@code FUNCTION_FAILED} expression errors.
 */
public interface TemplateFunction {

    /** Value of {@link #maxArgs()} for functions accepting any number of arguments. */
    int VARIADIC = -1;

    /** Name used to call the function. */
    String name();

    int minArgs();

    /** Maximum argument count, or {@link #VARIADIC}. */
    int maxArgs();

    /** Computes the result. {@code args} is unmodifiable and its size respects the arity bounds. */
    Object apply(List<Object> args);

    default boolean acceptsArgumentCount(int count) {
        return count >= minArgs() && (maxArgs() == VARIADIC || count <= maxArgs());
    }

    /** Human-readable arity range, e.g. {@code "2"}, {@code "1 to 3"} or {@code "at least 1"}. */
    default String arityDescription() {
        if (maxArgs() == VARIADIC) {
            return "at least " + minArgs();
        }
        return minArgs() == maxArgs() ? String.valueOf(minArgs()) : minArgs() + " to " + maxArgs();
    }

    /** Creates a function from a lambda body. */
    static TemplateFunction of(String name, int minArgs, int maxArgs, Function<List<Object>, Object> body) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(body, "body must not be null");
        if (minArgs < 0) {
            throw new IllegalArgumentException("minArgs must not be negative, got: " + minArgs);
        }
        if (maxArgs != VARIADIC && maxArgs < minArgs) {
            throw new IllegalArgumentException("maxArgs must be >= minArgs or VARIADIC, got: " + maxArgs);
        }
        return new TemplateFunction() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public int minArgs() {
                return minArgs;
            }

            @Override
            public int maxArgs() {
                return maxArgs;
            }

            @Override
            public Object apply(List<Object> args) {
                return body.apply(args);
            }

            @Override
            public String toString() {
                return "TemplateFunction[" + name + "]";
            }
        };
    }
}
