package io.prompty.core.expr;

/** Token of the expression language; {@code offset} is relative to the expression text. */
record ExpressionToken(Type type, String text, Object literal, int offset) {

    enum Type {
        IDENTIFIER,
        STRING,
        NUMBER,
        TRUE,
        FALSE,
        NIL,
        OPERATOR,
        LPAREN,
        RPAREN,
        COMMA,
        NOT,
        EOF
    }

    @Override
    public String toString() {
        return type == Type.EOF ? "end of expression" : "'" + text + "'";
    }
}
