package io.prompty.core.expr;

import io.prompty.core.error.ExpressionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An expression parsed once and evaluated many times. Immutable and thread-safe.
 *
 * @param source the expression text as written in the {@code eval} attribute
 * @param root   the parsed syntax tree
 */
public record CompiledExpression(String source, Expression root) {

    public CompiledExpression {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(root, "root must not be null");
    }

    /**
     * Parses {@code source}.
     *
     * @throws ExpressionException with kind {@code SYNTAX} if the text is not a valid expression
     */
    public static CompiledExpression compile(String source) {
        return new CompiledExpression(source, ExpressionParser.parse(source));
    }

    /** Names of all functions called anywhere in the expression, in source order. */
    public List<String> functionNames() {
        List<String> names = new ArrayList<>();
        collectFunctions(root, names);
        return names;
    }

    private static void collectFunctions(Expression expression, List<String> names) {
        if (expression instanceof Expression.Call call) {
            names.add(call.function());
            call.arguments().forEach(arg -> collectFunctions(arg, names));
        } else if (expression instanceof Expression.Not not) {
            collectFunctions(not.operand(), names);
        } else if (expression instanceof Expression.Binary binary) {
            collectFunctions(binary.left(), names);
            collectFunctions(binary.right(), names);
        }
    }

    @Override
    public String toString() {
        return source;
    }
}
