package io.prompty.core.model;

/**
 * Location of a token or node in template source. Lines and columns are 1-based; the offset is
 * the 0-based character index into the source.
 *
 * @param offset character offset, or {@code -1} when unknown
 * @param line   1-based line number, or {@code 0} when unknown
 * @param column 1-based column number, or {@code 0} when unknown
 */
public record Position(int offset, int line, int column) {

    /** Placeholder for errors that are not tied to a source location. */
    public static final Position NONE = new Position(-1, 0, 0);

    /** Position of the first character of a source. */
    public static final Position START = new Position(0, 1, 1);

    /** Returns {@code true} if this position points into real source. */
    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
