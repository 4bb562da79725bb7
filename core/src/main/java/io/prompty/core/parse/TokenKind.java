package io.prompty.core.parse;

/** Kinds of tokens produced by the {@link Lexer}. */
public enum TokenKind {
    /** Literal text between tags; escapes already applied. */
    TEXT,
    /** Open delimiter and tag name; the lexeme is the name. */
    TAG_OPEN,
    /** Close delimiter ending an opening tag that has a body. */
    TAG_END,
    /** Self-close marker ending a tag without a body. */
    SELF_CLOSE,
    /** Block-close tag; the lexeme is the name being closed. */
    TAG_CLOSE,
    ATTRIBUTE_KEY,
    ATTRIBUTE_VALUE,
    /** Verbatim body of a raw or comment block. */
    LITERAL_BODY,
    EOF
}
