package io.prompty.core.model;

/** Names of the built-in tags. All of them carry the reserved {@link #RESERVED_PREFIX}. */
public final class TagNames {

    public static final String RESERVED_PREFIX = "prompty.";

    public static final String VAR = "prompty.var";
    public static final String RAW = "prompty.raw";
    public static final String COMMENT = "prompty.comment";
    public static final String INCLUDE = "prompty.include";
    public static final String ENV = "prompty.env";
    public static final String IF = "prompty.if";
    public static final String ELSEIF = "prompty.elseif";
    public static final String ELSE = "prompty.else";
    public static final String FOR = "prompty.for";
    public static final String SWITCH = "prompty.switch";
    public static final String CASE = "prompty.case";
    public static final String CASE_DEFAULT = "prompty.casedefault";
    public static final String EXTENDS = "prompty.extends";
    public static final String BLOCK = "prompty.block";
    public static final String PARENT = "prompty.parent";

    private TagNames() {}

    public static boolean isReserved(String name) {
        return name != null && name.startsWith(RESERVED_PREFIX);
    }

    /** Tags whose body the lexer captures verbatim instead of tokenizing. */
    public static boolean isLiteralBody(String name) {
        return RAW.equals(name) || COMMENT.equals(name);
    }
}
