package io.prompty.core.parse;

import io.prompty.core.model.Position;

/**
 * A lexical token.
 *
 * @param kind     token kind
 * @param lexeme   token text; meaning depends on {@code kind}
 * @param position where the token starts
 * @param end      offset just past the last source character of the token
 */
public record Token(TokenKind kind, String lexeme, Position position, int end) {

    @Override
    public String toString() {
        return kind + "(" + lexeme + ")@" + position;
    }
}
