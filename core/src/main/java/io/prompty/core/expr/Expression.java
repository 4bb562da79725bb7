package io.prompty.core.expr;

import java.util.List;
import java.util.Objects;

/** Abstract syntax tree of an {@code eval} expression. */
public sealed interface Expression
        permits Expression.Literal, Expression.Variable, Expression.Not, Expression.Binary, Expression.Call {

    /** A string, number, boolean or {@code nil} constant. */
    record Literal(Object value) implements Expression {}

    /** A dotted path looked up in the bindings; absent paths evaluate to {@code null}. */
    record Variable(String path) implements Expression {
        public Variable {
            Objects.requireNonNull(path, "path must not be null");
        }
    }

    record Not(Expression operand) implements Expression {
        public Not {
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    record Binary(BinaryOperator operator, Expression left, Expression right) implements Expression {
        public Binary {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    /** A call of a function resolved through the function registry at evaluation time. */
    record Call(String function, List<Expression> arguments) implements Expression {
        public Call {
            Objects.requireNonNull(function, "function must not be null");
            arguments = List.copyOf(arguments);
        }
    }
}
