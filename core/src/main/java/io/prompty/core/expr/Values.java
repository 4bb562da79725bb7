package io.prompty.core.expr;

import io.prompty.core.error.ExpressionException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Value semantics shared by the evaluator, the executor and the built-in functions: truthiness,
 * text rendering, equality and ordering.
 *
 * <p>
 * Supported value types are {@code null}, {@link CharSequence}, {@link Boolean}, {@link Number},
 * {@link List} (and other collections and object arrays), {@link Map} and {@code java.time} values.
 */
public final class Values {

    private Values() {}

    /**
     * Truthiness: {@code null} is false, booleans are themselves, strings are true when non-empty,
     * numbers when non-zero and not NaN, collections and maps when non-empty. Any other object is true.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0.0 && !Double.isNaN(d);
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        if (value instanceof Object[] array) {
            return array.length > 0;
        }
        return true;
    }

    /** Renders a value as template output text. {@code null} renders as the empty string. */
    public static String toText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof CharSequence || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Number n) {
            return numberToText(n);
        }
        if (value instanceof ZonedDateTime || value instanceof OffsetDateTime) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format((TemporalAccessor) value);
        }
        if (value instanceof Map<?, ?> m) {
            return stringKeys(m).entrySet().stream()
                    .map(e -> e.getKey() + "=" + toText(e.getValue()))
                    .collect(Collectors.joining(", ", "{", "}"));
        }
        Optional<List<Object>> list = asList(value);
        if (list.isPresent()) {
            return list.get().stream().map(Values::toText).collect(Collectors.joining(", ", "[", "]"));
        }
        return value.toString();
    }

    /**
     * Loose equality: numbers compare by numeric value, strings by content, booleans by value and
     * {@code null} equals only {@code null}. Values of different kinds are never equal.
     */
    public static boolean looseEquals(Object left, Object right) {
        if (left == null || right == null) {
            return left == null && right == null;
        }
        if (left instanceof Number a && right instanceof Number b) {
            return toDouble(a) == toDouble(b);
        }
        if (left instanceof CharSequence a && right instanceof CharSequence b) {
            return a.toString().equals(b.toString());
        }
        if (left instanceof Boolean a && right instanceof Boolean b) {
            return a.equals(b);
        }
        if (isNumber(left) || isNumber(right) || left instanceof CharSequence || right instanceof CharSequence) {
            return false;
        }
        return left.equals(right);
    }

    /**
     * Orders two numbers or two strings.
     *
     * @throws ExpressionException with kind {@code TYPE_MISMATCH} for any other combination
     */
    public static int compare(Object left, Object right, String operator) {
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(toDouble(a), toDouble(b));
        }
        if (left instanceof CharSequence a && right instanceof CharSequence b) {
            return a.toString().compareTo(b.toString());
        }
        throw new ExpressionException(
                ExpressionException.Kind.TYPE_MISMATCH,
                "cannot compare " + typeName(left) + " " + operator + " " + typeName(right));
    }

    public static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger;
    }

    public static double toDouble(Number number) {
        return number.doubleValue();
    }

    /** Short type name used in error messages and by the {@code typeOf} function. */
    public static String typeName(Object value) {
        if (value == null) {
            return "nil";
        }
        if (value instanceof CharSequence) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "bool";
        }
        if (isIntegral(value)) {
            return "int";
        }
        if (value instanceof Number) {
            return "float";
        }
        if (value instanceof Map) {
            return "map";
        }
        if (value instanceof Collection || value instanceof Object[]) {
            return "list";
        }
        if (value instanceof TemporalAccessor) {
            return "time";
        }
        return value.getClass().getSimpleName();
    }

    /** Views sequence-like values (lists, other collections, arrays) as a list. */
    public static Optional<List<Object>> asList(Object value) {
        if (value instanceof List<?> list) {
            return Optional.of(new ArrayList<>(list));
        }
        if (value instanceof Collection<?> collection) {
            return Optional.of(new ArrayList<>(collection));
        }
        if (value instanceof Object[] array) {
            return Optional.of(new ArrayList<>(Arrays.asList(array)));
        }
        return Optional.empty();
    }

    /** Copies a map into key order, converting keys to strings. */
    public static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> copy = new TreeMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    private static String numberToText(Number n) {
        if (isIntegral(n)) {
            return n.toString();
        }
        if (n instanceof BigDecimal big) {
            return big.stripTrailingZeros().toPlainString();
        }
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
}
