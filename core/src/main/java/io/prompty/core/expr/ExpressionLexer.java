package io.prompty.core.expr;

import io.prompty.core.error.ExpressionException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/** Tokenizer for the expression language. */
final class ExpressionLexer {

    private final String text;
    private int pos;

    ExpressionLexer(String text) {
        this.text = text;
    }

    List<ExpressionToken> tokenize() {
        List<ExpressionToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                tokens.add(new ExpressionToken(ExpressionToken.Type.EOF, "", null, pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private ExpressionToken next() {
        int start = pos;
        char c = text.charAt(pos);
        switch (c) {
            case '(':
                pos++;
                return new ExpressionToken(ExpressionToken.Type.LPAREN, "(", null, start);
            case ')':
                pos++;
                return new ExpressionToken(ExpressionToken.Type.RPAREN, ")", null, start);
            case ',':
                pos++;
                return new ExpressionToken(ExpressionToken.Type.COMMA, ",", null, start);
            case '"':
            case '\'':
                return string(c);
            case '!':
                if (peek(1) == '=') {
                    pos += 2;
                    return operator("!=", start);
                }
                pos++;
                return new ExpressionToken(ExpressionToken.Type.NOT, "!", null, start);
            case '=':
                if (peek(1) == '=') {
                    pos += 2;
                    return operator("==", start);
                }
                throw syntax("unexpected character '='", start);
            case '<':
            case '>':
                if (peek(1) == '=') {
                    pos += 2;
                    return operator(c + "=", start);
                }
                pos++;
                return operator(String.valueOf(c), start);
            case '&':
            case '|':
                if (peek(1) == c) {
                    pos += 2;
                    return operator("" + c + c, start);
                }
                throw syntax("unexpected character '" + c + "'", start);
            default:
                break;
        }
        if (Character.isDigit(c) || (c == '-' && Character.isDigit(peek(1)))) {
            return number();
        }
        if (Character.isLetter(c) || c == '_') {
            return identifier();
        }
        throw syntax("unexpected character '" + c + "'", start);
    }

    private ExpressionToken operator(String symbol, int start) {
        return new ExpressionToken(ExpressionToken.Type.OPERATOR, symbol, null, start);
    }

    private ExpressionToken string(char quote) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == quote) {
                pos++;
                return new ExpressionToken(ExpressionToken.Type.STRING, text.substring(start, pos), sb.toString(), start);
            }
            if (c == '\\' && pos + 1 < text.length()) {
                char e = text.charAt(pos + 1);
                switch (e) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '\\', '"', '\'' -> sb.append(e);
                    default -> sb.append('\\').append(e);
                }
                pos += 2;
                continue;
            }
            sb.append(c);
            pos++;
        }
        throw syntax("unterminated string literal", start);
    }

    private ExpressionToken number() {
        int start = pos;
        if (text.charAt(pos) == '-') {
            pos++;
        }
        while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
            pos++;
        }
        String raw = text.substring(start, pos);
        Number value;
        try {
            BigDecimal decimal = new BigDecimal(raw);
            if (raw.indexOf('.') < 0 && decimal.abs().compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) <= 0) {
                value = decimal.longValueExact();
            } else {
                value = decimal.doubleValue();
            }
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ExpressionException(
                    ExpressionException.Kind.SYNTAX, "invalid number '" + raw + "' at offset " + start, e);
        }
        return new ExpressionToken(ExpressionToken.Type.NUMBER, raw, value, start);
    }

    private ExpressionToken identifier() {
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                pos++;
            } else {
                break;
            }
        }
        String word = text.substring(start, pos);
        return switch (word) {
            case "true" -> new ExpressionToken(ExpressionToken.Type.TRUE, word, Boolean.TRUE, start);
            case "false" -> new ExpressionToken(ExpressionToken.Type.FALSE, word, Boolean.FALSE, start);
            case "nil" -> new ExpressionToken(ExpressionToken.Type.NIL, word, null, start);
            default -> new ExpressionToken(ExpressionToken.Type.IDENTIFIER, word, null, start);
        };
    }

    private char peek(int ahead) {
        int p = pos + ahead;
        return p < text.length() ? text.charAt(p) : '\0';
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private static ExpressionException syntax(String detail, int offset) {
        return new ExpressionException(ExpressionException.Kind.SYNTAX, detail + " at offset " + offset);
    }
}
