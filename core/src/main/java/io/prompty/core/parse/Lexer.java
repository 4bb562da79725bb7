package io.prompty.core.parse;

import io.prompty.core.error.LexException;
import io.prompty.core.model.Position;
import io.prompty.core.model.TagNames;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Turns template source into a flat token list. A lexer instance is bound to one source string
 * and is not thread-safe; {@link #tokenize(String, Delimiters)} is the usual entry point.
 *
 * <p>
 * Bodies of {@code prompty.raw} and {@code prompty.comment} blocks are not tokenized: everything
 * up to the matching close tag is emitted as a single {@link TokenKind#LITERAL_BODY} token.
 */
public final class Lexer {

    private static final int SNIPPET_LENGTH = 20;

    private final String source;
    private final Delimiters delimiters;
    private final int[] lineStarts;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    public Lexer(String source, Delimiters delimiters) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.delimiters = Objects.requireNonNull(delimiters, "delimiters must not be null");
        this.lineStarts = computeLineStarts(source);
    }

    public static List<Token> tokenize(String source, Delimiters delimiters) {
        return new Lexer(source, delimiters).tokenize();
    }

    public List<Token> tokenize() {
        tokens.clear();
        pos = 0;
        StringBuilder text = new StringBuilder();
        int textStart = 0;
        String open = delimiters.open();
        String escape = delimiters.escape();
        while (pos < source.length()) {
            if (source.startsWith(escape, pos)) {
                if (text.length() == 0) {
                    textStart = pos;
                }
                text.append(open);
                pos += escape.length();
            } else if (source.startsWith(open, pos)) {
                flushText(text, textStart);
                lexTag();
                textStart = pos;
            } else {
                if (text.length() == 0) {
                    textStart = pos;
                }
                text.append(source.charAt(pos));
                pos++;
            }
        }
        flushText(text, textStart);
        tokens.add(new Token(TokenKind.EOF, "", positionAt(source.length()), source.length()));
        return List.copyOf(tokens);
    }

    /** Maps a character offset to a line/column position. */
    public Position positionAt(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        int line = idx >= 0 ? idx : -idx - 2;
        return new Position(offset, line + 1, offset - lineStarts[line] + 1);
    }

    private void flushText(StringBuilder text, int start) {
        if (text.length() > 0) {
            tokens.add(new Token(TokenKind.TEXT, text.toString(), positionAt(start), pos));
            text.setLength(0);
        }
    }

    private void lexTag() {
        int start = pos;
        if (source.startsWith(delimiters.blockClose(), pos)) {
            lexCloseTag(start);
            return;
        }
        pos += delimiters.open().length();
        skipWhitespace();
        String name = readName(true, start);
        tokens.add(new Token(TokenKind.TAG_OPEN, name, positionAt(start), pos));

        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                throw error("unterminated tag", start);
            }
            if (source.startsWith(delimiters.selfClose(), pos)) {
                int at = pos;
                pos += delimiters.selfClose().length();
                tokens.add(new Token(TokenKind.SELF_CLOSE, delimiters.selfClose(), positionAt(at), pos));
                return;
            }
            if (source.startsWith(delimiters.close(), pos)) {
                int at = pos;
                pos += delimiters.close().length();
                tokens.add(new Token(TokenKind.TAG_END, delimiters.close(), positionAt(at), pos));
                if (TagNames.isLiteralBody(name)) {
                    lexLiteralBody(name, start);
                }
                return;
            }
            if (isNameStart(source.charAt(pos))) {
                lexAttribute();
            } else {
                throw error("unexpected character '" + source.charAt(pos) + "' in tag", pos);
            }
        }
    }

    private void lexCloseTag(int start) {
        pos += delimiters.blockClose().length();
        skipWhitespace();
        String name = readName(true, start);
        skipWhitespace();
        if (pos >= source.length()) {
            throw error("unterminated tag", start);
        }
        if (!source.startsWith(delimiters.close(), pos)) {
            throw error("unexpected character '" + source.charAt(pos) + "' in closing tag", pos);
        }
        pos += delimiters.close().length();
        tokens.add(new Token(TokenKind.TAG_CLOSE, name, positionAt(start), pos));
    }

    private void lexAttribute() {
        int keyStart = pos;
        String key = readName(false, keyStart);
        tokens.add(new Token(TokenKind.ATTRIBUTE_KEY, key, positionAt(keyStart), pos));
        skipWhitespace();
        if (pos >= source.length()) {
            throw error("unterminated tag", keyStart);
        }
        if (source.charAt(pos) != '=') {
            throw error("unexpected character '" + source.charAt(pos) + "', expected '=' after " + key, pos);
        }
        pos++;
        skipWhitespace();
        if (pos >= source.length()) {
            throw error("unterminated tag", keyStart);
        }
        char quote = source.charAt(pos);
        if (quote != '"' && quote != '\'') {
            throw error("unexpected character '" + quote + "', expected quoted value for " + key, pos);
        }
        int valueStart = pos;
        pos++;
        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= source.length()) {
                throw error("unterminated string literal", valueStart);
            }
            char c = source.charAt(pos);
            if (c == quote) {
                pos++;
                break;
            }
            if (c == '\\' && pos + 1 < source.length()) {
                char next = source.charAt(pos + 1);
                if (next == '"' || next == '\'' || next == '\\') {
                    value.append(next);
                    pos += 2;
                    continue;
                }
            }
            value.append(c);
            pos++;
        }
        tokens.add(new Token(TokenKind.ATTRIBUTE_VALUE, value.toString(), positionAt(valueStart), pos));
    }

    private void lexLiteralBody(String name, int tagStart) {
        int bodyStart = pos;
        int search = pos;
        while (true) {
            int candidate = source.indexOf(delimiters.blockClose(), search);
            if (candidate < 0) {
                throw error("unclosed " + name + " block", tagStart);
            }
            int p = skipWhitespaceFrom(candidate + delimiters.blockClose().length());
            if (source.startsWith(name, p)) {
                int afterName = skipWhitespaceFrom(p + name.length());
                if (source.startsWith(delimiters.close(), afterName)) {
                    tokens.add(new Token(
                            TokenKind.LITERAL_BODY, source.substring(bodyStart, candidate), positionAt(bodyStart), candidate));
                    pos = candidate;
                    lexCloseTag(candidate);
                    return;
                }
            }
            search = candidate + 1;
        }
    }

    private String readName(boolean tagName, int tagStart) {
        if (pos >= source.length()) {
            throw error("unterminated tag", tagStart);
        }
        if (!isNameStart(source.charAt(pos))) {
            throw error("invalid tag name", pos);
        }
        int nameStart = pos;
        pos++;
        while (pos < source.length() && isNamePart(source.charAt(pos), tagName)) {
            pos++;
        }
        return source.substring(nameStart, pos);
    }

    private void skipWhitespace() {
        pos = skipWhitespaceFrom(pos);
    }

    private int skipWhitespaceFrom(int from) {
        int p = from;
        while (p < source.length() && Character.isWhitespace(source.charAt(p))) {
            p++;
        }
        return p;
    }

    private LexException error(String detail, int offset) {
        int end = Math.min(source.length(), offset + SNIPPET_LENGTH);
        return new LexException(detail, positionAt(offset), source.substring(offset, end));
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNamePart(char c, boolean allowDot) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || (allowDot && c == '.');
    }

    private static int[] computeLineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}
