package io.prompty.core.parse;

import java.util.Objects;

/**
 * The pair of strings that open and close a tag. The block-close marker is {@code open + "/"}, the
 * self-close marker is {@code "/" + close} and the escape sequence is {@code "\\" + open}.
 */
public record Delimiters(String open, String close) {

    /** The default pair: {@code {~} and {@code ~}}. */
    public static final Delimiters DEFAULT = new Delimiters("{~", "~}");

    public Delimiters {
        Objects.requireNonNull(open, "open must not be null");
        Objects.requireNonNull(close, "close must not be null");
        if (open.isBlank() || close.isBlank()) {
            throw new IllegalArgumentException("delimiters must not be blank");
        }
        if (open.equals(close)) {
            throw new IllegalArgumentException("open and close delimiters must differ, got: " + open);
        }
    }

    String blockClose() {
        return open + "/";
    }

    String selfClose() {
        return "/" + close;
    }

    String escape() {
        return "\\" + open;
    }
}
