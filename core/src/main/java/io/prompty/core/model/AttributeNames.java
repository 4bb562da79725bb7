package io.prompty.core.model;

/** Attribute names understood by the built-in tags. */
public final class AttributeNames {

    public static final String NAME = "name";
    public static final String DEFAULT = "default";
    public static final String ON_ERROR = "onerror";
    public static final String EVAL = "eval";
    public static final String TEMPLATE = "template";
    public static final String WITH = "with";
    public static final String ISOLATE = "isolate";
    public static final String ITEM = "item";
    public static final String INDEX = "index";
    public static final String IN = "in";
    public static final String LIMIT = "limit";
    public static final String VALUE = "value";
    public static final String REQUIRED = "required";

    /**
     * Key under which a block tag's rendered children are handed to its resolver. The dot makes it
     * impossible to collide with an attribute written in source.
     */
    public static final String CONTENT = "prompty.content";

    public static final String TRUE = "true";

    private AttributeNames() {}
}
