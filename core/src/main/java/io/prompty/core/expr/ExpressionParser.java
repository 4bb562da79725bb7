package io.prompty.core.expr;

import io.prompty.core.error.ExpressionException;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the expression language. Precedence from lowest to highest:
 * {@code ||}, {@code &&}, equality, comparison, unary {@code !}, primary.
 */
final class ExpressionParser {

    private final List<ExpressionToken> tokens;
    private int pos;

    private ExpressionParser(List<ExpressionToken> tokens) {
        this.tokens = tokens;
    }

    static Expression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ExpressionException(ExpressionException.Kind.SYNTAX, "empty expression");
        }
        ExpressionParser parser = new ExpressionParser(new ExpressionLexer(text).tokenize());
        Expression root = parser.or();
        if (parser.peek().type() != ExpressionToken.Type.EOF) {
            throw unexpected(parser.peek());
        }
        return root;
    }

    private Expression or() {
        Expression left = and();
        while (matchOperator("||")) {
            left = new Expression.Binary(BinaryOperator.OR, left, and());
        }
        return left;
    }

    private Expression and() {
        Expression left = equality();
        while (matchOperator("&&")) {
            left = new Expression.Binary(BinaryOperator.AND, left, equality());
        }
        return left;
    }

    private Expression equality() {
        Expression left = comparison();
        while (isOperator("==") || isOperator("!=")) {
            BinaryOperator op = operator(advance());
            left = new Expression.Binary(op, left, comparison());
        }
        return left;
    }

    private Expression comparison() {
        Expression left = unary();
        while (isOperator("<") || isOperator(">") || isOperator("<=") || isOperator(">=")) {
            BinaryOperator op = operator(advance());
            left = new Expression.Binary(op, left, unary());
        }
        return left;
    }

    private Expression unary() {
        if (peek().type() == ExpressionToken.Type.NOT) {
            advance();
            return new Expression.Not(unary());
        }
        return primary();
    }

    private Expression primary() {
        ExpressionToken token = advance();
        switch (token.type()) {
            case STRING:
            case NUMBER:
            case TRUE:
            case FALSE:
            case NIL:
                return new Expression.Literal(token.literal());
            case IDENTIFIER:
                if (peek().type() == ExpressionToken.Type.LPAREN) {
                    advance();
                    return new Expression.Call(token.text(), arguments());
                }
                return new Expression.Variable(token.text());
            case LPAREN:
                Expression inner = or();
                expect(ExpressionToken.Type.RPAREN, "expected closing parenthesis");
                return inner;
            case EOF:
                throw new ExpressionException(ExpressionException.Kind.SYNTAX, "unexpected end of expression");
            default:
                throw unexpected(token);
        }
    }

    private List<Expression> arguments() {
        List<Expression> args = new ArrayList<>();
        if (peek().type() == ExpressionToken.Type.RPAREN) {
            advance();
            return args;
        }
        args.add(or());
        while (peek().type() == ExpressionToken.Type.COMMA) {
            advance();
            args.add(or());
        }
        expect(ExpressionToken.Type.RPAREN, "expected closing parenthesis");
        return args;
    }

    private void expect(ExpressionToken.Type type, String detail) {
        ExpressionToken token = peek();
        if (token.type() != type) {
            throw new ExpressionException(
                    ExpressionException.Kind.SYNTAX, detail + ", found " + token + " at offset " + token.offset());
        }
        advance();
    }

    private boolean matchOperator(String symbol) {
        if (isOperator(symbol)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean isOperator(String symbol) {
        ExpressionToken token = peek();
        return token.type() == ExpressionToken.Type.OPERATOR && token.text().equals(symbol);
    }

    private static BinaryOperator operator(ExpressionToken token) {
        return BinaryOperator.fromSymbol(token.text())
                .orElseThrow(() -> new ExpressionException(
                        ExpressionException.Kind.UNKNOWN_OPERATOR, "unknown operator '" + token.text() + "'"));
    }

    private ExpressionToken peek() {
        return tokens.get(pos);
    }

    private ExpressionToken advance() {
        ExpressionToken token = tokens.get(pos);
        if (token.type() != ExpressionToken.Type.EOF) {
            pos++;
        }
        return token;
    }

    private static ExpressionException unexpected(ExpressionToken token) {
        return new ExpressionException(
                ExpressionException.Kind.SYNTAX, "unexpected token " + token + " at offset " + token.offset());
    }
}
