package io.prompty.core.engine.builtin;

import static io.prompty.core.spi.TemplateFunction.VARIADIC;

import io.prompty.core.expr.Values;
import io.prompty.core.spi.TemplateFunction;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The function library available to every expression: string, collection, type conversion and
 * utility functions, plus {@link DateTimeFunctions}. All functions are pure except {@code now}.
 */
public final class BuiltinFunctions {

    private BuiltinFunctions() {}

    /** Every built-in function; {@code now} reads {@code clock}. */
    public static List<TemplateFunction> all(Clock clock) {
        Objects.requireNonNull(clock, "clock must not be null");
        List<TemplateFunction> functions = new ArrayList<>();
        functions.addAll(strings());
        functions.addAll(collections());
        functions.addAll(types());
        functions.addAll(utilities());
        functions.addAll(DateTimeFunctions.all(clock));
        return functions;
    }

    static List<TemplateFunction> strings() {
        return List.of(
                TemplateFunction.of("upper", 1, 1, args -> text(args, 0).toUpperCase(Locale.ROOT)),
                TemplateFunction.of("lower", 1, 1, args -> text(args, 0).toLowerCase(Locale.ROOT)),
                TemplateFunction.of("trim", 1, 1, args -> text(args, 0).strip()),
                TemplateFunction.of("trimPrefix", 2, 2, args -> {
                    String s = text(args, 0);
                    String prefix = text(args, 1);
                    return s.startsWith(prefix) ? s.substring(prefix.length()) : s;
                }),
                TemplateFunction.of("trimSuffix", 2, 2, args -> {
                    String s = text(args, 0);
                    String suffix = text(args, 1);
                    return s.endsWith(suffix) ? s.substring(0, s.length() - suffix.length()) : s;
                }),
                TemplateFunction.of("hasPrefix", 2, 2, args -> text(args, 0).startsWith(text(args, 1))),
                TemplateFunction.of("hasSuffix", 2, 2, args -> text(args, 0).endsWith(text(args, 1))),
                TemplateFunction.of("contains", 2, 2, args -> text(args, 0).contains(text(args, 1))),
                TemplateFunction.of("replace", 3, 3, args -> text(args, 0).replace(text(args, 1), text(args, 2))),
                TemplateFunction.of("split", 2, 2, args -> split(text(args, 0), text(args, 1))),
                TemplateFunction.of("join", 2, 2, args -> {
                    List<Object> items = list(args.get(0), "join");
                    List<String> parts = new ArrayList<>(items.size());
                    items.forEach(item -> parts.add(Values.toText(item)));
                    return String.join(text(args, 1), parts);
                }));
    }

    static List<TemplateFunction> collections() {
        return List.of(
                TemplateFunction.of("len", 1, 1, args -> length(args.get(0))),
                TemplateFunction.of("first", 1, 1, args -> {
                    List<Object> items = list(args.get(0), "first");
                    return items.isEmpty() ? null : items.get(0);
                }),
                TemplateFunction.of("last", 1, 1, args -> {
                    List<Object> items = list(args.get(0), "last");
                    return items.isEmpty() ? null : items.get(items.size() - 1);
                }),
                TemplateFunction.of("keys", 1, 1, args -> new ArrayList<Object>(map(args.get(0), "keys").keySet())),
                TemplateFunction.of("values", 1, 1, args -> new ArrayList<>(map(args.get(0), "values").values())),
                TemplateFunction.of("has", 2, 2, args -> map(args.get(0), "has").containsKey(text(args, 1))));
    }

    static List<TemplateFunction> types() {
        return List.of(
                TemplateFunction.of("toString", 1, 1, args -> text(args, 0)),
                TemplateFunction.of("toInt", 1, 1, args -> toInt(args.get(0))),
                TemplateFunction.of("toFloat", 1, 1, args -> toFloat(args.get(0))),
                TemplateFunction.of("toBool", 1, 1, args -> toBool(args.get(0))),
                TemplateFunction.of("typeOf", 1, 1, args -> Values.typeName(args.get(0))),
                TemplateFunction.of("isNil", 1, 1, args -> args.get(0) == null),
                TemplateFunction.of("isEmpty", 1, 1, args -> isEmpty(args.get(0))));
    }

    static List<TemplateFunction> utilities() {
        return List.of(
                TemplateFunction.of("default", 2, 2, args -> isBlankValue(args.get(0)) ? args.get(1) : args.get(0)),
                TemplateFunction.of("coalesce", 1, VARIADIC, args -> args.stream()
                        .filter(arg -> !isBlankValue(arg))
                        .findFirst()
                        .orElse(null)));
    }

    private static List<Object> split(String s, String separator) {
        if (separator.isEmpty()) {
            return new ArrayList<>(Arrays.asList((Object[]) s.split("")));
        }
        List<Object> parts = new ArrayList<>();
        int from = 0;
        int at;
        while ((at = s.indexOf(separator, from)) >= 0) {
            parts.add(s.substring(from, at));
            from = at + separator.length();
        }
        parts.add(s.substring(from));
        return parts;
    }

    private static int length(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof CharSequence s) {
            return s.toString().codePointCount(0, s.length());
        }
        if (value instanceof Map<?, ?> m) {
            return m.size();
        }
        return Values.asList(value)
                .map(List::size)
                .orElseThrow(() -> new IllegalArgumentException("len: unsupported type " + Values.typeName(value)));
    }

    private static long toInt(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (value instanceof CharSequence s) {
            String trimmed = s.toString().strip();
            try {
                return new BigDecimal(trimmed).longValue();
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("toInt: cannot convert '" + trimmed + "' to int", e);
            }
        }
        throw new IllegalArgumentException("toInt: cannot convert " + Values.typeName(value) + " to int");
    }

    private static double toFloat(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (value instanceof CharSequence s) {
            String trimmed = s.toString().strip();
            try {
                return Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("toFloat: cannot convert '" + trimmed + "' to float", e);
            }
        }
        throw new IllegalArgumentException("toFloat: cannot convert " + Values.typeName(value) + " to float");
    }

    private static boolean toBool(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence s) {
            switch (s.toString().strip().toLowerCase(Locale.ROOT)) {
                case "true":
                case "1":
                case "yes":
                    return true;
                case "false":
                case "0":
                case "no":
                case "":
                    return false;
                default:
                    throw new IllegalArgumentException("toBool: cannot convert '" + s + "' to bool");
            }
        }
        throw new IllegalArgumentException("toBool: cannot convert " + Values.typeName(value) + " to bool");
    }

    private static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence s) {
            return s.length() == 0;
        }
        if (value instanceof Map<?, ?> m) {
            return m.isEmpty();
        }
        return Values.asList(value).map(List::isEmpty).orElse(false);
    }

    private static boolean isBlankValue(Object value) {
        return value == null || (value instanceof CharSequence s && s.length() == 0);
    }

    private static String text(List<Object> args, int index) {
        return Values.toText(args.get(index));
    }

    private static List<Object> list(Object value, String function) {
        if (value == null) {
            return List.of();
        }
        return Values.asList(value)
                .orElseThrow(() -> new IllegalArgumentException(
                        function + ": expected list, got " + Values.typeName(value)));
    }

    private static Map<String, Object> map(Object value, String function) {
        if (value instanceof Map<?, ?> m) {
            return Values.stringKeys(m);
        }
        throw new IllegalArgumentException(function + ": expected map, got " + Values.typeName(value));
    }
}
