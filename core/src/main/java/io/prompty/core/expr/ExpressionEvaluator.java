package io.prompty.core.expr;

import io.prompty.core.error.ExpressionException;
import io.prompty.core.error.PromptyException;
import io.prompty.core.error.ResourceLimitException;
import io.prompty.core.model.Position;
import io.prompty.core.spi.TemplateFunction;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates compiled expressions against a set of bindings. Function calls are resolved only
 * through the supplied {@link FunctionTable}; there is no other route to host code.
 *
 * <p>
 * Thread-safe as long as the function table is.
 */
public final class ExpressionEvaluator {

    private final FunctionTable functions;
    private final long functionTimeoutNanos;

    public ExpressionEvaluator(FunctionTable functions, Duration functionTimeout) {
        this.functions = Objects.requireNonNull(functions, "functions must not be null");
        Objects.requireNonNull(functionTimeout, "functionTimeout must not be null");
        this.functionTimeoutNanos = functionTimeout.toNanos();
    }

    /** Evaluates to a raw value: {@code null}, string, number, boolean, list, map or time. */
    public Object evaluate(CompiledExpression expression, Bindings bindings) {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(bindings, "bindings must not be null");
        return eval(expression.root(), bindings);
    }

    /** Evaluates and applies truthiness. */
    public boolean test(CompiledExpression expression, Bindings bindings) {
        return Values.isTruthy(evaluate(expression, bindings));
    }

    private Object eval(Expression expression, Bindings bindings) {
        if (expression instanceof Expression.Literal literal) {
            return literal.value();
        }
        if (expression instanceof Expression.Variable variable) {
            return bindings.lookup(variable.path()).orElse(null);
        }
        if (expression instanceof Expression.Not not) {
            return !Values.isTruthy(eval(not.operand(), bindings));
        }
        if (expression instanceof Expression.Binary binary) {
            return binary(binary, bindings);
        }
        if (expression instanceof Expression.Call call) {
            return call(call, bindings);
        }
        throw new ExpressionException(
                ExpressionException.Kind.UNKNOWN_OPERATOR,
                "unsupported expression node: " + expression.getClass().getSimpleName());
    }

    private Object binary(Expression.Binary binary, Bindings bindings) {
        BinaryOperator op = binary.operator();
        if (op == BinaryOperator.AND) {
            return Values.isTruthy(eval(binary.left(), bindings)) && Values.isTruthy(eval(binary.right(), bindings));
        }
        if (op == BinaryOperator.OR) {
            return Values.isTruthy(eval(binary.left(), bindings)) || Values.isTruthy(eval(binary.right(), bindings));
        }
        Object left = eval(binary.left(), bindings);
        Object right = eval(binary.right(), bindings);
        return switch (op) {
            case EQ -> Values.looseEquals(left, right);
            case NE -> !Values.looseEquals(left, right);
            case LT -> Values.compare(left, right, op.symbol()) < 0;
            case GT -> Values.compare(left, right, op.symbol()) > 0;
            case LE -> Values.compare(left, right, op.symbol()) <= 0;
            case GE -> Values.compare(left, right, op.symbol()) >= 0;
            default -> throw new ExpressionException(
                    ExpressionException.Kind.UNKNOWN_OPERATOR, "unknown operator '" + op.symbol() + "'");
        };
    }

    private Object call(Expression.Call call, Bindings bindings) {
        TemplateFunction function = functions
                .lookup(call.function())
                .orElseThrow(() -> new ExpressionException(
                        ExpressionException.Kind.UNKNOWN_FUNCTION, "unknown function: " + call.function()));
        int count = call.arguments().size();
        if (!function.acceptsArgumentCount(count)) {
            String direction = count < function.minArgs() ? "too few" : "too many";
            throw new ExpressionException(
                    ExpressionException.Kind.ARITY_MISMATCH,
                    String.format(
                            "%s arguments: %s (expected %s, got %d)",
                            direction, function.name(), function.arityDescription(), count));
        }
        List<Object> args = new ArrayList<>(count);
        for (Expression argument : call.arguments()) {
            args.add(eval(argument, bindings));
        }
        long start = System.nanoTime();
        Object result;
        try {
            result = function.apply(Collections.unmodifiableList(args));
        } catch (PromptyException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExpressionException(
                    ExpressionException.Kind.FUNCTION_FAILED,
                    "function " + function.name() + " failed: " + e.getMessage(),
                    e);
        }
        long elapsed = System.nanoTime() - start;
        if (elapsed > functionTimeoutNanos) {
            throw new ResourceLimitException(
                    ResourceLimitException.Limit.FUNCTION_TIMEOUT,
                    String.format(
                            "function %s exceeded timeout: %dms > %dms",
                            function.name(), elapsed / 1_000_000, functionTimeoutNanos / 1_000_000),
                    Position.NONE,
                    null);
        }
        return result;
    }
}
